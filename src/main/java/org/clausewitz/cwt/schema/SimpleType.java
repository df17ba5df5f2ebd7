package org.clausewitz.cwt.schema;

import java.util.Optional;

/**
 * Built-in scalar value kinds of the CWT language.
 */
public enum SimpleType {
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    SCALAR("scalar"),
    PERCENTAGE_FIELD("percentage_field"),
    LOCALISATION("localisation"),
    LOCALISATION_SYNCED("localisation_synced"),
    LOCALISATION_INLINE("localisation_inline"),
    DATE_FIELD("date_field"),
    VARIABLE_FIELD("variable_field"),
    INT_VARIABLE_FIELD("int_variable_field"),
    VALUE_FIELD("value_field"),
    INT_VALUE_FIELD("int_value_field"),
    SCOPE_FIELD("scope_field"),
    FILEPATH("filepath"),
    ICON("icon");

    private final String keyword;

    SimpleType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean acceptsRange() {
        return this == INT || this == FLOAT || this == VARIABLE_FIELD || this == INT_VARIABLE_FIELD
               || this == VALUE_FIELD || this == INT_VALUE_FIELD;
    }

    public static Optional<SimpleType> fromKeyword(String keyword) {
        for (var type : values()) {
            if (type.keyword.equals(keyword)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
