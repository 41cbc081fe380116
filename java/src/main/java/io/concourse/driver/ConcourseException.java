package io.concourse.driver;

/**
 * Base exception thrown by the Concourse Java driver.
 */
public class ConcourseException extends Exception {

    private static final long serialVersionUID = 1L;

    public ConcourseException(String message) {
        super(message);
    }

    public ConcourseException(String message, Throwable cause) {
        super(message, cause);
    }
}
