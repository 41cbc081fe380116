package io.concourse.driver;

/**
 * Raised before any network call when mutually exclusive arguments were supplied together.
 */
public final class AmbiguousArgumentsException extends ConcourseException {

    private static final long serialVersionUID = 1L;

    public AmbiguousArgumentsException(String operation, String first, String second) {
        super(operation + " accepts " + first + " or " + second + ", not both");
    }
}
