package org.clausewitz.cwt.parser;

import org.clausewitz.cwt.error.Diagnostic;
import org.clausewitz.cwt.error.DiagnosticCode;
import org.clausewitz.cwt.lexer.Lexer;
import org.clausewitz.cwt.lexer.Token;
import org.clausewitz.cwt.lexer.TokenKind;
import org.clausewitz.cwt.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable parsing state: a lookahead window over the lexer, collected comments and diagnostics.
 */
final class ParsingContext {
    private final Lexer lexer;
    private final ParserConfig config;
    private final List<Token> lookahead;
    private final List<Token> comments;
    private final List<Diagnostic> diagnostics;

    private Token previous;
    private boolean stopped;

    private ParsingContext(Lexer lexer, ParserConfig config) {
        this.lexer = lexer;
        this.config = config;
        this.lookahead = new ArrayList<>(4);
        this.comments = new ArrayList<>();
        this.diagnostics = new ArrayList<>();
    }

    static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(Lexer.of(input), config);
    }

    // === Token Access ===

    Token peek() {
        return peek(0);
    }

    /**
     * Token {@code ahead} positions after the current one, comments skipped.
     */
    Token peek(int ahead) {
        while (lookahead.size() <= ahead) {
            var token = lexer.next();
            if (token.kind()
                     .isComment()) {
                if (config.keepComments()) {
                    comments.add(token);
                }
                continue;
            }
            lookahead.add(token);
            if (token.kind() == TokenKind.EOF) {
                // pad so peeks past the end keep returning EOF
                while (lookahead.size() <= ahead) {
                    lookahead.add(token);
                }
            }
        }
        return lookahead.get(ahead);
    }

    Token advance() {
        var token = peek();
        if (token.kind() != TokenKind.EOF) {
            lookahead.remove(0);
        }
        previous = token;
        return token;
    }

    boolean check(TokenKind kind) {
        return peek().kind() == kind;
    }

    /**
     * Span end of the last consumed token, or the current token start if nothing was consumed.
     */
    SourceSpan previousSpan() {
        return previous != null
               ? previous.span()
               : SourceSpan.at(peek().span()
                                     .start());
    }

    // === Error Recovery ===

    void error(String message, SourceSpan span) {
        diagnostics.add(Diagnostic.error(DiagnosticCode.PARSE_ERROR, message, span));
        if (config.recoveryStrategy() == RecoveryStrategy.NONE) {
            stopped = true;
        }
    }

    boolean isStopped() {
        return stopped;
    }

    /**
     * Skip tokens until the next entry start ({@code atom operator}), a closing brace or bracket, a
     * conditional section or the end of input. Nested brace blocks are skipped whole. At least one
     * token is consumed.
     */
    void resynchronize() {
        skipOne();
        while (!stopped) {
            var token = peek();
            if (isBoundary(token.kind())) {
                return;
            }
            if (token.kind()
                     .isAtom() && peek(1).kind() == TokenKind.OPERATOR) {
                return;
            }
            skipOne();
        }
    }

    private static boolean isBoundary(TokenKind kind) {
        return kind == TokenKind.EOF || kind == TokenKind.RBRACE || kind == TokenKind.CONDITIONAL_OPEN
               || kind == TokenKind.CONDITIONAL_CLOSE;
    }

    private void skipOne() {
        var token = advance();
        if (token.kind() != TokenKind.LBRACE) {
            return;
        }
        int depth = 1;
        while (depth > 0 && !check(TokenKind.EOF)) {
            var inner = advance();
            if (inner.kind() == TokenKind.LBRACE) {
                depth++;
            } else if (inner.kind() == TokenKind.RBRACE) {
                depth--;
            }
        }
    }

    List<Token> comments() {
        return comments;
    }

    List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}
