package org.rpncalc.compiler.frontend.lexer;

/**
 * Decides what the {@link Lexer} does with a character that no scanning rule matches.
 * Whitespace is never affected and is always skipped.
 */
public enum UnknownCharacterPolicy {
    /** Report an error diagnostic; the expression is rejected with a lex error. */
    REJECT,
    /** Drop the character silently, as the reference calculator did. */
    SKIP
}
