package de.alive.inboxscan.exception;

public class UnsubscribeException extends Exception {

    private final int statusCode;
    private final boolean retryable;

    public UnsubscribeException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public UnsubscribeException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.retryable = true;
    }

    public static UnsubscribeException forStatus(int statusCode) {
        return new UnsubscribeException("HTTP " + statusCode, statusCode, statusCode >= 500);
    }

    // the HTTP status, or -1 when no response was received
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
