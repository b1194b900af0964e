package com.epiccharts.twitter;

/**
 * Thrown when a call to the social platform fails at the transport or API level.
 */
public class SocialFeedException extends RuntimeException {

    private final int statusCode;

    public SocialFeedException(String message) {
        this(message, -1, null);
    }

    public SocialFeedException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public SocialFeedException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    private SocialFeedException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or {@code -1} when the request never completed.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
