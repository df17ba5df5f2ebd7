package org.clausewitz.cwt.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a schema set cannot be loaded. The registry keeps its previous snapshot.
 */
public final class SchemaLoadException extends Exception {
    private final List<SchemaError> errors;

    public SchemaLoadException(List<SchemaError> errors) {
        super(summarize(errors));
        this.errors = List.copyOf(errors);
    }

    public List<SchemaError> errors() {
        return errors;
    }

    private static String summarize(List<SchemaError> errors) {
        if (errors.size() == 1) {
            return errors.get(0)
                         .describe();
        }
        return errors.size() + " schema errors:\n" + errors.stream()
                                                           .map(SchemaError::describe)
                                                           .collect(Collectors.joining("\n"));
    }
}
