package com.opinion.builder.feed;

import com.opinion.builder.events.ConnectionStateChange;
import com.opinion.builder.events.ReconnectAttempt;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one upstream feed session alive and routes its frames to {@link MessageDispatcher}.
 * <p>
 * States: DISCONNECTED → CONNECTING → SUBSCRIBING → ACTIVE, with RECONNECTING between a failure
 * and the next attempt. Every (re)connect replays the whole {@link SubscriptionRegistry}; while a
 * session is open, registry changes are forwarded as they happen. A session that stays silent for
 * longer than the liveness timeout is treated as dead.
 * <p>
 * Frames are dispatched one at a time on a dedicated single thread, which keeps per-market
 * updates in arrival order. Once {@link #stop()} returns, no further frame reaches the store and
 * the listener hears nothing more. Everything worth reporting goes to the {@link FeedEventListener}.
 */
public class FeedConnection {

    private final FeedTransport transport;
    private final SubscriptionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final FeedEventListener listener;
    private final FeedSettings settings;
    private final ReconnectBackoff backoff;
    private final Clock clock;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicReference<SessionSubscriptions> current = new AtomicReference<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong reconnectAttempts = new AtomicLong();
    private final AtomicLong framesReceived = new AtomicLong();

    // held while a frame is applied and while running flips; see stop()
    private final Object dispatchGate = new Object();
    private volatile boolean running;
    private volatile Instant lastFrameAt;
    private volatile Instant livenessMark;

    private Disposable loop;
    private Scheduler feedLoop;
    private Scheduler timer;

    public FeedConnection(FeedTransport transport,
                          SubscriptionRegistry registry,
                          MessageDispatcher dispatcher,
                          FeedEventListener listener,
                          FeedSettings settings,
                          ReconnectBackoff backoff,
                          Clock clock) {
        this.transport = transport;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.listener = listener;
        this.settings = settings;
        this.backoff = backoff;
        this.clock = clock;
    }

    /** Starts connecting in the background. No-op if already started. */
    public synchronized void start() {
        if (loop != null) {
            return;
        }
        feedLoop = Schedulers.newSingle("feed-loop");
        timer = Schedulers.newSingle("feed-timer");
        synchronized (dispatchGate) {
            running = true;
        }
        consecutiveFailures.set(0);

        loop = Mono.defer(this::connectOnce)
                .retryWhen(Retry.from(signals -> signals.concatMap(this::scheduleReconnect)))
                .subscribe(
                        v -> { },
                        e -> report(() -> listener.onFeedLoopEnded(e)));
    }

    /**
     * Closes the session, cancels any pending reconnect and waits for an in-flight frame to
     * finish. Idempotent.
     */
    public synchronized void stop() {
        synchronized (dispatchGate) {
            running = false;
        }
        if (loop != null) {
            loop.dispose();
            loop = null;
        }
        if (feedLoop != null) {
            feedLoop.dispose();
            timer.dispose();
            feedLoop = null;
            timer = null;
        }
        current.set(null);
        transition(ConnectionState.DISCONNECTED, "stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public ConnectionState state() {
        return state.get();
    }

    public ConnectionStatus status() {
        Instant last = lastFrameAt;
        SessionSubscriptions subs = current.get();
        return new ConnectionStatus(
                state.get(),
                last,
                last == null ? null : Duration.between(last, clock.instant()),
                reconnectAttempts.get(),
                framesReceived.get(),
                subs == null ? 0 : subs.sentCount());
    }

    private Mono<Void> connectOnce() {
        transition(ConnectionState.CONNECTING, null);
        return transport.connect(settings.endpoint(), this::runSession)
                .then(Mono.error(() -> new TransportFailureException("feed closed by upstream")));
    }

    private Mono<Long> scheduleReconnect(Retry.RetrySignal signal) {
        Throwable cause = signal.failure();
        // same lock stop() takes to flip running
        synchronized (dispatchGate) {
            if (!running) {
                return Mono.error(cause);
            }
            int attempt = consecutiveFailures.incrementAndGet();
            reconnectAttempts.incrementAndGet();
            Duration delay = backoff.delayFor(attempt);
            transition(ConnectionState.RECONNECTING, cause.getMessage());
            listener.onReconnectScheduled(new ReconnectAttempt(attempt, delay, cause));
            return Mono.delay(delay, timer);
        }
    }

    private Mono<Void> runSession(FeedSession session) {
        transition(ConnectionState.SUBSCRIBING, null);
        SessionSubscriptions subs = new SessionSubscriptions(session);
        current.set(subs);

        // subscribed before the snapshot is read so nothing added in between is lost
        Mono<Void> liveChanges = registry.changes().doOnNext(subs::apply).then();

        Mono<Void> active = Mono.fromRunnable(() -> {
                    Set<Subscription> desired = registry.snapshot();
                    subs.subscribeAll(desired);
                    livenessMark = clock.instant();
                    consecutiveFailures.set(0);
                    transition(ConnectionState.ACTIVE, null);
                })
                .then(Mono.firstWithSignal(inbound(session), heartbeat(session)));

        return Mono.firstWithSignal(liveChanges, active)
                .doFinally(sig -> current.compareAndSet(subs, null));
    }

    private Mono<Void> inbound(FeedSession session) {
        return session.receive()
                .publishOn(feedLoop)
                .doOnNext(this::onFrame)
                .then();
    }

    private Mono<Void> heartbeat(FeedSession session) {
        Duration interval = settings.heartbeatInterval();
        return Flux.interval(interval, interval, timer)
                .doOnNext(tick -> {
                    Duration silent = Duration.between(livenessMark, clock.instant());
                    if (silent.compareTo(settings.livenessTimeout()) > 0) {
                        throw new TransportFailureException("no inbound traffic for " + silent.toMillis() + " ms");
                    }
                    session.send(FeedFrames.heartbeat());
                })
                .then();
    }

    void onFrame(String frame) {
        synchronized (dispatchGate) {
            if (!running) {
                return;
            }
            Instant now = clock.instant();
            Instant mark = livenessMark;
            if (mark == null || now.isAfter(mark)) {
                livenessMark = now;
            }
            lastFrameAt = now;
            framesReceived.incrementAndGet();
            try {
                dispatcher.dispatch(frame);
            } catch (RuntimeException e) {
                listener.onFrameFailed(frame, e);
            }
        }
    }

    private void transition(ConnectionState to, String reason) {
        synchronized (dispatchGate) {
            if (!running && to != ConnectionState.DISCONNECTED) {
                return;
            }
            ConnectionState from = state.getAndSet(to);
            if (from == to) {
                return;
            }
            listener.onStateChange(new ConnectionStateChange(from, to, clock.instant(), reason));
        }
    }

    private void report(Runnable hook) {
        synchronized (dispatchGate) {
            if (running) {
                hook.run();
            }
        }
    }

    /**
     * What one session has told upstream. Removals that arrive before the initial replay are
     * remembered so the replay does not resurrect them.
     */
    private final class SessionSubscriptions {

        private final FeedSession session;
        private final Set<Subscription> sent = new LinkedHashSet<>();
        private final Set<Subscription> removedEarly = new HashSet<>();

        private SessionSubscriptions(FeedSession session) {
            this.session = session;
        }

        synchronized void subscribeAll(Set<Subscription> desired) {
            for (Subscription subscription : desired) {
                if (!removedEarly.contains(subscription)) {
                    subscribe(subscription);
                }
            }
        }

        synchronized void apply(SubscriptionChange change) {
            Subscription subscription = change.subscription();
            switch (change.action()) {
                case ADDED -> {
                    removedEarly.remove(subscription);
                    subscribe(subscription);
                }
                case REMOVED -> {
                    if (sent.remove(subscription)) {
                        session.send(FeedFrames.unsubscribe(subscription));
                        report(() -> listener.onUnsubscriptionSent(subscription));
                    } else {
                        removedEarly.add(subscription);
                    }
                }
            }
        }

        synchronized int sentCount() {
            return sent.size();
        }

        private void subscribe(Subscription subscription) {
            if (sent.add(subscription)) {
                session.send(FeedFrames.subscribe(subscription));
                report(() -> listener.onSubscriptionSent(subscription));
            }
        }
    }
}
