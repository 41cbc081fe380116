package io.concourse.driver;

/**
 * Exception representing an error reply from Concourse Server. When the server responds with a non-2xx status
 * the driver hydrates this type (or one of its subclasses) so callers can inspect both the HTTP status and the
 * structured error code.
 */
public class ConcourseApiException extends ConcourseException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public ConcourseApiException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the server.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return server error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "Concourse request failed with status " + status;
        }
        return "Concourse request failed with status " + status + " (" + code + ")";
    }
}
