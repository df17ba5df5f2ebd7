package org.clausewitz.cwt.analysis;

import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Names;
import org.clausewitz.cwt.validate.LocalisationOracle;
import org.clausewitz.cwt.validate.SymbolLookup;
import org.clausewitz.cwt.validate.Validator;
import org.clausewitz.cwt.validate.ValidatorConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects what a document contributes to the workspace index: the definitions it declares per
 * the types whose paths cover it, the members it adds to complex enums, and the values it declares
 * for value sets.
 */
final class SymbolExtractor {
    private SymbolExtractor() {}

    /**
     * @param symbols Lookup the value-set pass matches type references against
     */
    static List<SymbolLocation> extract(Schema schema, SymbolLookup symbols, String path, AstNode.Block root) {
        var result = new ArrayList<SymbolLocation>();
        for (var type : schema.typesForPath(path)) {
            for (var definition : type.definitions(root)) {
                type.definitionName(definition)
                    .ifPresent(name -> result.add(new SymbolLocation(type.name(),
                                                                     Names.intern(name),
                                                                     path,
                                                                     definition.key()
                                                                               .span())));
            }
        }
        for (var definition : schema.enums()) {
            if (definition.isComplex()) {
                ComplexEnumCollector.collect(definition, path, root, result);
            }
        }
        var validator = new Validator(schema, symbols, LocalisationOracle.ACCEPT_ALL, ValidatorConfig.DEFAULT);
        for (var value : validator.collectValueSets(root, path)) {
            result.add(new SymbolLocation(SymbolLookup.valueSetNamespace(value.set()),
                                          Names.intern(value.name()),
                                          path,
                                          value.span()));
        }
        return List.copyOf(result);
    }
}
