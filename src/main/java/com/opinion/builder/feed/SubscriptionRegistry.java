package com.opinion.builder.feed;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The set of subscriptions the service wants, independent of whether a connection is up.
 * {@link FeedConnection} reads it on every (re)connect and follows its changes while active.
 * <p>
 * Guarded by its own monitor, never held together with any store lock.
 */
@Component
public class SubscriptionRegistry {

    private final Object lock = new Object();
    private final Set<Subscription> desired = new LinkedHashSet<>();
    private final Sinks.Many<SubscriptionChange> changes = Sinks.many().multicast().directBestEffort();

    /** @return true if the subscription was not present yet */
    public boolean add(Subscription subscription) {
        synchronized (lock) {
            if (!desired.add(subscription)) {
                return false;
            }
            changes.tryEmitNext(new SubscriptionChange(SubscriptionChange.Action.ADDED, subscription));
            return true;
        }
    }

    /** @return true if the subscription was present */
    public boolean remove(Subscription subscription) {
        synchronized (lock) {
            if (!desired.remove(subscription)) {
                return false;
            }
            changes.tryEmitNext(new SubscriptionChange(SubscriptionChange.Action.REMOVED, subscription));
            return true;
        }
    }

    public boolean contains(Subscription subscription) {
        synchronized (lock) {
            return desired.contains(subscription);
        }
    }

    /** Immutable copy in insertion order. */
    public Set<Subscription> snapshot() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(desired));
        }
    }

    public int size() {
        synchronized (lock) {
            return desired.size();
        }
    }

    /**
     * Changes in mutation order. Only subscribers present at emission time see a change;
     * combine with {@link #snapshot()} taken after subscribing.
     */
    public Flux<SubscriptionChange> changes() {
        return changes.asFlux();
    }
}
