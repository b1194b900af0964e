package com.epiccharts.core.vision;

/**
 * Thrown when chart data cannot be extracted from an image.
 * <p>
 * Callers branch on {@link #getKind()}, never on the message text.
 */
public class ExtractionException extends RuntimeException {

    public enum Kind {
        /** The model looked at the image and found nothing chartable. */
        NO_DATA,
        /** The model answered, but the answer is not well-formed chart data. */
        INVALID_STRUCTURE,
        /** The model could not be reached, returned nothing, or returned something unparseable. */
        TRANSPORT
    }

    private final Kind kind;

    public ExtractionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns {@code true} when the failure is something the requester can act on.
     */
    public boolean isUserActionable() {
        return kind == Kind.NO_DATA || kind == Kind.INVALID_STRUCTURE;
    }
}
