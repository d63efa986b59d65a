package com.opinion.builder.feed;

/**
 * An inbound frame could not be turned into a {@link FeedMessage}.
 */
public class MalformedMessageException extends RuntimeException {

    public enum Reason { UNPARSEABLE, UNKNOWN_TYPE, MISSING_FIELD, INVALID_VALUE }

    private final Reason reason;

    public MalformedMessageException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MalformedMessageException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
