package com.opinion.builder.feed;

public enum DispatchOutcome {
    /** Market state updated. */
    APPLIED,
    /** Depth diff, heartbeat reply or subscription ack: valid but carries no topic state. */
    IGNORED,
    /** No topic for the message's market id; dropped. */
    UNKNOWN_ENTITY,
    /** Dropped, see {@link MalformedMessageException}. */
    MALFORMED
}
