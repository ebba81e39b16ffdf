package org.rpncalc.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the expression text by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Variable, Constant, Add).
 * @param text The exact text of the token. For variables this is the identifier name,
 *             for constants the digit run. Operators and brackets are identified by type alone.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int column
) {

    /**
     * Creates a token without a known source position.
     * @param type The type of the token.
     * @param text The text of the token.
     * @return The token, positioned at column 0.
     */
    public static Token of(TokenType type, String text) {
        return new Token(type, text, 0);
    }
}
