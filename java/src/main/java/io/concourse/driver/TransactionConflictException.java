package io.concourse.driver;

/**
 * Raised when a staged transaction cannot be committed because another session changed data it used.
 * The staged work is discarded by the server; callers should {@code stage()} again and replay the whole sequence.
 */
public final class TransactionConflictException extends ConcourseApiException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "TRANSACTION_CONFLICT";

    static final String DEFAULT_MESSAGE = "Another client has made changes to data used within the current transaction, "
        + "so it cannot continue. Please abort the transaction and try again.";

    public TransactionConflictException(int statusCode, String message) {
        super(statusCode, CODE, message == null || message.isBlank() ? DEFAULT_MESSAGE : message);
    }
}
