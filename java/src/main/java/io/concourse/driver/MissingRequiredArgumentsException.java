package io.concourse.driver;

/**
 * Raised before any network call when the supplied arguments match no variant of an operation.
 */
public final class MissingRequiredArgumentsException extends ConcourseException {

    private static final long serialVersionUID = 1L;

    private final String required;

    public MissingRequiredArgumentsException(String operation, String required) {
        super(operation + " requires " + required);
        this.required = required;
    }

    /**
     * @return the minimum argument combination the operation needs, for example {@code "criteria or record"}.
     */
    public String getRequired() {
        return required;
    }
}
