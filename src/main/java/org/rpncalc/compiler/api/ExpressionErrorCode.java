package org.rpncalc.compiler.api;

/**
 * Defines unique, testable error codes for every failure of the expression pipeline.
 * This decouples callers and tests from the wording of error messages.
 */
public enum ExpressionErrorCode {
    // region Lexer Errors
    /** A character could not be classified by any tokenizer rule. */
    LEX_ERROR,
    // endregion

    // region Converter & Tree Builder Errors
    /** Mismatched parentheses, or a postfix sequence that does not reduce to a single tree. */
    SYNTAX_ERROR,
    /** A token kind reached a stage that must never see it (brackets in the tree builder). */
    INVALID_TOKEN,
    // endregion

    // region Evaluation Errors
    /** A variable leaf has no entry in the supplied bindings. */
    MISSING_VARIABLE,
    /** Fewer bindings were supplied than the tree has variable leaves. */
    ARITY_ERROR,
    // endregion

    // region General Errors
    /** An invariant of a producing stage was violated. Indicates a defect, not bad input. */
    INTERNAL_ERROR
    // endregion
}
