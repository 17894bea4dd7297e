package com.example.s3explorer;

/**
 * Error returned by the remote explorer API. Callers can inspect the HTTP status and, where the
 * response carried one, the error code.
 */
public final class ExplorerApiException extends ExplorerException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public ExplorerApiException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return error code, nullable when the response body did not include one.
     */
    public String getCode() {
        return code;
    }

    public boolean isAuthorizationDenied() {
        return statusCode == 403;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "Request failed with status " + status;
        }
        return "Request failed with status " + status + " (" + code + ")";
    }
}
