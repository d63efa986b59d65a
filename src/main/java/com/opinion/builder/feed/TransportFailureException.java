package com.opinion.builder.feed;

/**
 * The feed connection dropped, stopped answering, or could not send. Always handled by
 * reconnecting; never reaches query callers.
 */
public class TransportFailureException extends RuntimeException {

    public TransportFailureException(String message) {
        super(message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
