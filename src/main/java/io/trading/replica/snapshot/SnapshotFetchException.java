package io.trading.replica.snapshot;

/**
 * REST depth snapshot could not be obtained: non-2xx status, transport failure
 * or a body that is not a depth snapshot. Carries the raw response body.
 */
public class SnapshotFetchException extends RuntimeException {

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String responseBody;

    public SnapshotFetchException(String message, int statusCode, String responseBody) {
        this(message, statusCode, responseBody, null);
    }

    public SnapshotFetchException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message + " (status=" + statusCode + ", body=" + abbreviate(responseBody) + ")", cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 256 ? body : body.substring(0, 256) + "...";
    }
}
