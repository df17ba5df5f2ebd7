package org.clausewitz.cwt.lexer;

import org.clausewitz.cwt.tree.LineIndex;
import org.clausewitz.cwt.tree.Names;
import org.clausewitz.cwt.tree.SourceLocation;
import org.clausewitz.cwt.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lexer for Clausewitz script and CWT schema text.
 *
 * <p>Tokens are produced lazily by {@link #next()}. A lexer can be started at any offset of the
 * buffer with {@link #from(String, int)}. Lexing never fails: characters that cannot start a
 * token become {@link TokenKind#INVALID} tokens, a string missing its closing quote becomes an
 * {@link TokenKind#UNTERMINATED_STRING} running to the end of its line, and lexing continues
 * behind them.
 */
public final class Lexer implements Iterable<Token> {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final char BOM = '\uFEFF';
    private static final char NO_BREAK_SPACE = '\u00A0';

    private final String input;
    private int pos;
    private int line;
    private int column;
    private boolean finished;

    private Lexer(String input, SourceLocation start) {
        this.input = input;
        this.pos = start.offset();
        this.line = start.line();
        this.column = start.column();
        if (pos == 0 && !input.isEmpty() && input.charAt(0) == BOM) {
            pos = 1;
        }
    }

    public static Lexer of(String input) {
        return new Lexer(input, SourceLocation.START);
    }

    /**
     * Lexer positioned at {@code offset}. Line and column are recomputed from the buffer.
     */
    public static Lexer from(String input, int offset) {
        if (offset < 0 || offset > input.length()) {
            throw new IllegalArgumentException("Offset " + offset + " outside input of length " + input.length());
        }
        return new Lexer(input,
                         LineIndex.of(input)
                                  .locationOf(offset));
    }

    /**
     * Lex the whole input eagerly, including the trailing EOF token.
     */
    public static List<Token> tokenize(String input) {
        var tokens = new ArrayList<Token>();
        var lexer = of(input);
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (token.kind() != TokenKind.EOF);
        return tokens;
    }

    /**
     * Next token. After the end of input every call returns an EOF token.
     */
    public Token next() {
        skipWhitespace();
        if (isAtEnd()) {
            finished = true;
            return new Token(TokenKind.EOF, "", SourceSpan.at(currentLocation()));
        }
        var start = currentLocation();
        char c = peek();
        if (c == '#') {
            return scanComment(start);
        }
        if (c == '"') {
            return scanString(start);
        }
        if (c == '{') {
            advance();
            return new Token(TokenKind.LBRACE, "{", span(start));
        }
        if (c == '}') {
            advance();
            return new Token(TokenKind.RBRACE, "}", span(start));
        }
        if (c == '@' && peekAt(1) == '[') {
            return scanInlineMath(start);
        }
        if (c == '[' && peekAt(1) == '[') {
            return scanConditionalOpen(start);
        }
        if (c == ']') {
            advance();
            return new Token(TokenKind.CONDITIONAL_CLOSE, "]", span(start));
        }
        if (c == '<' && isAngleReferenceAhead()) {
            return scanWord(start);
        }
        if (isOperatorStart(c)) {
            return scanOperator(start);
        }
        if (Character.isISOControl(c)) {
            advance();
            return new Token(TokenKind.INVALID, String.valueOf(c), span(start));
        }
        return scanWord(start);
    }

    /**
     * Current char offset; the offset at which the next token (or its leading whitespace) starts.
     */
    public int offset() {
        return pos;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return !finished;
            }

            @Override
            public Token next() {
                if (finished) {
                    throw new NoSuchElementException();
                }
                return Lexer.this.next();
            }
        };
    }

    private Token scanComment(SourceLocation start) {
        int hashes = 0;
        while (!isAtEnd() && peek() == '#') {
            advance();
            hashes++ ;
        }
        int bodyStart = pos;
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
        var body = input.substring(bodyStart, pos)
                        .strip();
        var kind = switch (hashes) {
            case 1 -> TokenKind.COMMENT;
            case 2 -> TokenKind.OPTION_COMMENT;
            default -> TokenKind.DOC_COMMENT;
        };
        return new Token(kind, Names.intern(body), span(start));
    }

    private Token scanString(SourceLocation start) {
        advance();
        // opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            char c = peek();
            if (c == '\\' && pos + 1 < input.length()) {
                advance();
                char escaped = advance();
                if (escaped != '"' && escaped != '\\') {
                    sb.append('\\');
                }
                sb.append(escaped);
            } else if (c == '\n' && !closingQuoteAhead()) {
                break;
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd() || peek() != '"') {
            return new Token(TokenKind.UNTERMINATED_STRING, Names.intern(sb.toString()), span(start));
        }
        advance();
        // closing quote
        return new Token(TokenKind.STRING, Names.intern(sb.toString()), span(start));
    }

    /**
     * A string may span lines only when a closing quote follows before the next '=' or brace.
     */
    private boolean closingQuoteAhead() {
        for (int i = pos; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '"') {
                return true;
            }
            if (c == '=' || c == '{' || c == '}') {
                return false;
            }
        }
        return false;
    }

    private Token scanInlineMath(SourceLocation start) {
        advance();
        advance();
        // @[
        int bodyStart = pos;
        int depth = 1;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '[') {
                depth++ ;
            } else if (c == ']') {
                depth-- ;
                if (depth == 0) {
                    break;
                }
            } else if (c == '\n') {
                break;
            }
            advance();
        }
        if (isAtEnd() || peek() != ']') {
            return new Token(TokenKind.INVALID, "unterminated inline math", span(start));
        }
        var body = input.substring(bodyStart, pos)
                        .strip();
        advance();
        // ]
        return new Token(TokenKind.IDENTIFIER, Names.intern("@[" + body + "]"), span(start));
    }

    private Token scanConditionalOpen(SourceLocation start) {
        advance();
        advance();
        // [[
        int nameStart = pos;
        while (!isAtEnd() && peek() != ']' && !Character.isWhitespace(peek())) {
            advance();
        }
        var name = input.substring(nameStart, pos);
        if (isAtEnd() || peek() != ']' || name.isEmpty() || name.equals("!")) {
            return new Token(TokenKind.INVALID, "[[" + name, span(start));
        }
        advance();
        // ]
        return new Token(TokenKind.CONDITIONAL_OPEN, Names.intern(name), span(start));
    }

    private Token scanOperator(SourceLocation start) {
        char c = advance();
        boolean followedByEquals = !isAtEnd() && peek() == '=';
        var text = switch (c) {
            case '=' -> followedByEquals
                        ? "=="
                        : "=";
            case '<' -> followedByEquals
                        ? "<="
                        : "<";
            case '>' -> followedByEquals
                        ? ">="
                        : ">";
            case '!' -> "!=";
            case '?' -> "?=";
            default -> throw new IllegalStateException("Not an operator start: " + c);
        };
        if (text.length() == 2) {
            advance();
        }
        return new Token(TokenKind.OPERATOR, text, span(start));
    }

    private Token scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        int angleDepth = 0;
        int bracketDepth = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '<' && isAngleReferenceAhead()) {
                angleDepth++ ;
            } else if (c == '>' && angleDepth > 0) {
                angleDepth-- ;
            } else if (c == '[') {
                bracketDepth++ ;
            } else if (c == ']') {
                // an unmatched ']' closes a conditional section
                if (bracketDepth == 0) {
                    break;
                }
                bracketDepth-- ;
            } else if (isWordTerminator(c)) {
                break;
            }
            sb.append(advance());
        }
        if (sb.length() == 0) {
            // nothing consumed
            sb.append(advance());
            return new Token(TokenKind.INVALID, sb.toString(), span(start));
        }
        var text = sb.toString();
        var kind = isNumber(text)
                   ? TokenKind.NUMBER
                   : TokenKind.IDENTIFIER;
        return new Token(kind, Names.intern(text), span(start));
    }

    private boolean isWordTerminator(char c) {
        if (Character.isWhitespace(c) || Character.isISOControl(c)) {
            return true;
        }
        return switch (c) {
            case '{', '}', '=', '#', '"', '<', '>' -> true;
            case '!', '?' -> peekAt(1) == '=';
            default -> false;
        };
    }

    private boolean isOperatorStart(char c) {
        return switch (c) {
            case '=', '<', '>' -> true;
            case '!', '?' -> peekAt(1) == '=';
            default -> false;
        };
    }

    /**
     * Whether the '<' at the current position opens a CWT type reference such as {@code <building>}.
     */
    private boolean isAngleReferenceAhead() {
        int i = pos + 1;
        if (i >= input.length() || !isIdentifierStart(input.charAt(i))) {
            return false;
        }
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '>') {
                return true;
            }
            if (!isIdentifierPart(c)) {
                return false;
            }
            i++ ;
        }
        return false;
    }

    static boolean isNumber(String text) {
        int i = 0;
        int len = text.length();
        if (len > 0 && (text.charAt(0) == '-' || text.charAt(0) == '+')) {
            i++ ;
        }
        if (i >= len) {
            return false;
        }
        boolean digits = false;
        boolean dot = false;
        for (; i < len; i++) {
            char c = text.charAt(i);
            if (c >= '0' && c <= '9') {
                digits = true;
            } else if (c == '.' && !dot) {
                dot = true;
                digits = false;
            } else {
                return false;
            }
        }
        return digits;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == BOM || c == NO_BREAK_SPACE) {
                advance();
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int ahead) {
        int idx = pos + ahead;
        return idx < input.length()
               ? input.charAt(idx)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == ':';
    }
}
