package org.rpncalc.compiler.diagnostics;

/**
 * Represents a single diagnostic message
 * produced while processing an expression.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param column The 1-based column in the expression text the message refers to.
 */
public record Diagnostic(
        Type type,
        String message,
        int column
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the expression from being processed. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] column %d: %s", type, column, message);
    }
}
