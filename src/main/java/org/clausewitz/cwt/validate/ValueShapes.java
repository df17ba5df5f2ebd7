package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.tree.AstNode;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Lexical shape tests for untyped scalar text.
 */
final class ValueShapes {
    private static final Pattern INT = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern DATE = Pattern.compile("\\d{1,4}\\.\\d{1,2}\\.\\d{1,2}");
    private static final Pattern PERCENTAGE = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)%?");

    private ValueShapes() {}

    static boolean isBool(String text) {
        return text.equalsIgnoreCase("yes") || text.equalsIgnoreCase("no");
    }

    static boolean isInt(String text) {
        return INT.matcher(text)
                  .matches();
    }

    static boolean isFloat(String text) {
        return FLOAT.matcher(text)
                    .matches();
    }

    static boolean isDate(String text) {
        return DATE.matcher(text)
                   .matches();
    }

    static boolean isPercentage(String text) {
        return PERCENTAGE.matcher(text)
                         .matches();
    }

    static OptionalDouble number(String text) {
        if (!isFloat(text)) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Short description of a script value for messages.
     */
    static String describe(AstNode node) {
        if (node instanceof AstNode.Scalar scalar) {
            return "'" + scalar.text() + "'";
        }
        if (node instanceof AstNode.Block) {
            return "a block";
        }
        if (node instanceof AstNode.Array array) {
            return array.tag()
                        .map(tag -> "a " + tag + " colour")
                        .orElse("a list");
        }
        return "a reference";
    }
}
