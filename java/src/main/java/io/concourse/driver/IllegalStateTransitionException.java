package io.concourse.driver;

/**
 * Raised for a transaction request that is not valid in the current state, such as staging twice.
 */
public final class IllegalStateTransitionException extends ConcourseException {

    private static final long serialVersionUID = 1L;

    public IllegalStateTransitionException(String message) {
        super(message);
    }
}
