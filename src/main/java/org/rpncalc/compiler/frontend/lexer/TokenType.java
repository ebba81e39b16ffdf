package org.rpncalc.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier such as a, b or abc. */
    VARIABLE,
    /** A decimal digit run such as 12 or 231. */
    CONSTANT,

    // Binary operators.
    /** The '+' character. */
    ADD,
    /** The '-' character. */
    SUB,
    /** The '*' character. */
    MULT,
    /** The '/' character. */
    DIV,
    /** The '^' character. */
    POW,
    /** The '%' character. */
    REM,

    // Grouping. Only the lexer and the postfix converter ever see these.
    /** The '(' character. */
    OPEN_BRACKET,
    /** The ')' character. */
    CLOSED_BRACKET
}
