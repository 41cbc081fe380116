package io.concourse.driver;

/**
 * Raised when the server rejects the login handshake or a credential it previously issued.
 */
public final class AuthenticationException extends ConcourseApiException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "AUTHENTICATION_FAILED";

    public AuthenticationException(int statusCode, String message) {
        super(statusCode, CODE, message);
    }
}
