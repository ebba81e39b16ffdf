package org.rpncalc.compiler.api;

/**
 * An exception that is thrown when any stage of the expression pipeline fails.
 * <p>
 * The {@link ExpressionErrorCode} lets callers tell failure kinds apart without
 * inspecting the message text.
 */
public class ExpressionException extends Exception {

    private final ExpressionErrorCode errorCode;

    /**
     * Constructs a new expression exception.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     */
    public ExpressionException(ExpressionErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * Constructs a new expression exception with a cause.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ExpressionException(ExpressionErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The kind of failure.
     */
    public ExpressionErrorCode getErrorCode() {
        return errorCode;
    }
}
