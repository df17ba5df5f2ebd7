package org.clausewitz.cwt.tree;

/**
 * Renders syntax trees back to script text.
 */
public final class AstPrinter {
    private static final String INDENT = "    ";

    private AstPrinter() {}

    /**
     * Compact single-line rendering, used in diagnostics and changeset output.
     */
    public static String oneLine(AstNode node) {
        var sb = new StringBuilder();
        appendOneLine(sb, node);
        return sb.toString();
    }

    /**
     * Multi-line rendering of a file root: entries at top level, nested blocks indented.
     */
    public static String file(AstNode.Block root) {
        var sb = new StringBuilder();
        appendBody(sb, root, 0);
        return sb.toString();
    }

    private static void appendBody(StringBuilder sb, AstNode.Block block, int depth) {
        for (var entry : block.entries()) {
            appendEntry(sb, entry, depth);
        }
        for (var value : block.values()) {
            sb.append(INDENT.repeat(depth));
            appendOneLine(sb, value);
            sb.append('\n');
        }
        for (var conditional : block.conditionals()) {
            sb.append(INDENT.repeat(depth))
              .append(conditional.header())
              .append('\n');
            appendBody(sb, conditional.body(), depth + 1);
            sb.append(INDENT.repeat(depth))
              .append("]\n");
        }
    }

    private static void appendEntry(StringBuilder sb, Entry entry, int depth) {
        sb.append(INDENT.repeat(depth));
        appendKey(sb, entry.key());
        sb.append(' ')
          .append(entry.operator()
                       .symbol())
          .append(' ');
        if (entry.value() instanceof AstNode.Block block && !block.isEmpty()) {
            sb.append("{\n");
            appendBody(sb, block, depth + 1);
            sb.append(INDENT.repeat(depth))
              .append("}\n");
        } else {
            appendOneLine(sb, entry.value());
            sb.append('\n');
        }
    }

    private static void appendOneLine(StringBuilder sb, AstNode node) {
        if (node instanceof AstNode.Scalar scalar) {
            if (scalar.quoted()) {
                appendQuoted(sb, scalar.text());
            } else {
                sb.append(scalar.text());
            }
        } else if (node instanceof AstNode.Reference reference) {
            switch (reference.kind()) {
                case VARIABLE -> sb.append('@')
                                   .append(reference.name());
                case INLINE_MATH -> sb.append("@[ ")
                                      .append(reference.name())
                                      .append(" ]");
                case PARAMETER -> sb.append('$')
                                    .append(reference.name())
                                    .append('$');
            }
        } else if (node instanceof AstNode.Array array) {
            array.tag()
                 .ifPresent(tag -> sb.append(tag)
                                     .append(' '));
            sb.append('{');
            for (var element : array.elements()) {
                sb.append(' ');
                appendOneLine(sb, element);
            }
            sb.append(" }");
        } else if (node instanceof AstNode.Block block) {
            if (block.isEmpty()) {
                sb.append("{ }");
                return;
            }
            sb.append('{');
            appendItemsOneLine(sb, block);
            sb.append(" }");
        } else if (node instanceof AstNode.Conditional conditional) {
            sb.append(conditional.header());
            appendItemsOneLine(sb, conditional.body());
            sb.append(" ]");
        }
    }

    private static void appendItemsOneLine(StringBuilder sb, AstNode.Block block) {
        for (var entry : block.entries()) {
            sb.append(' ');
            appendKey(sb, entry.key());
            sb.append(' ')
              .append(entry.operator()
                           .symbol())
              .append(' ');
            appendOneLine(sb, entry.value());
        }
        for (var value : block.values()) {
            sb.append(' ');
            appendOneLine(sb, value);
        }
        for (var conditional : block.conditionals()) {
            sb.append(' ');
            appendOneLine(sb, conditional);
        }
    }

    private static void appendKey(StringBuilder sb, Key key) {
        if (key.quoted()) {
            appendQuoted(sb, key.text());
        } else {
            sb.append(key.text());
        }
    }

    private static void appendQuoted(StringBuilder sb, String text) {
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
    }
}
