package io.concourse.driver;

/**
 * Connection-level failure. Once raised, the connection that produced it is no longer usable.
 */
public final class TransportException extends ConcourseException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
