package io.trading.replica.transport;

/**
 * Response of a REST call.
 *
 * @param statusCode HTTP status code
 * @param body       Response body decoded as UTF-8
 */
public record RestResponse(
    int statusCode,
    String body
) {
    public RestResponse {
        if (body == null) {
            body = "";
        }
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
