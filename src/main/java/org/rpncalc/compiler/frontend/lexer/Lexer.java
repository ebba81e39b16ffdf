package org.rpncalc.compiler.frontend.lexer;

import org.rpncalc.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * an infix expression into a sequence of tokens in source order.
 * <p>
 * A lexer instance scans exactly one expression and is not reusable.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final UnknownCharacterPolicy unknownCharacterPolicy;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer that rejects unknown characters.
     * @param source The expression text.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, UnknownCharacterPolicy.REJECT);
    }

    /**
     * Creates a new Lexer with an explicit policy for unknown characters.
     * @param source The expression text.
     * @param diagnostics The engine for reporting errors.
     * @param unknownCharacterPolicy What to do with characters no rule matches.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, UnknownCharacterPolicy unknownCharacterPolicy) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.unknownCharacterPolicy = unknownCharacterPolicy;
    }

    /**
     * Performs the tokenization of the entire expression.
     * Errors are reported to the diagnostics engine; the returned list then holds
     * every token that could be recognized.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '+': addToken(TokenType.ADD); break;
            case '-': addToken(TokenType.SUB); break;
            case '*': addToken(TokenType.MULT); break;
            case '/': addToken(TokenType.DIV); break;
            case '^': addToken(TokenType.POW); break;
            case '%': addToken(TokenType.REM); break;
            case '(': addToken(TokenType.OPEN_BRACKET); break;
            case ')': addToken(TokenType.CLOSED_BRACKET); break;
            // Ignore whitespace
            case ' ', '\r', '\t', '\n':
                break;
            default:
                if (isDigit(c)) {
                    constant();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    unknown(c);
                }
                break;
        }
    }

    private void constant() {
        while (isDigit(peek())) advance();
        addToken(TokenType.CONSTANT);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.VARIABLE);
    }

    private void unknown(char c) {
        if (unknownCharacterPolicy == UnknownCharacterPolicy.SKIP) {
            LOG.debug("Skipping unexpected character '{}' at column {}", c, start + 1);
            return;
        }
        diagnostics.reportError("Unexpected character: " + c, start + 1);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        LOG.trace("{} '{}'", type, text);
        tokens.add(new Token(type, text, start + 1));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z');
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }
}
