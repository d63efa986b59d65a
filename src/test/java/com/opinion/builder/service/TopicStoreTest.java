package com.opinion.builder.service;

import com.opinion.builder.entity.MarketState;
import com.opinion.builder.entity.OutcomeSide;
import com.opinion.builder.entity.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TopicStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private TopicStore store;

    @BeforeEach
    void setUp() {
        store = new TopicStore(new TopicSearchIndex(2));
    }

    private static Topic topic(long id, String question, BigDecimal volume) {
        return Topic.builder()
                .marketId(id)
                .question(question)
                .state(new MarketState(new BigDecimal("0.50"), null, null, volume, null, T0))
                .build();
    }

    @Test
    void upsertThenGet() {
        store.upsertStatic(topic(2764, "Will it rain?", BigDecimal.TEN));

        Topic stored = store.get(2764).orElseThrow();
        assertEquals("2764", stored.id());
        assertEquals("Will it rain?", stored.question());
        assertTrue(store.contains(2764));
        assertEquals(1, store.size());
        assertTrue(store.get(1).isEmpty());
    }

    @Test
    void upsertOfKnownMarketKeepsDescriptiveFieldsAndTakesState() {
        store.upsertStatic(topic(7, "Original question", BigDecimal.ONE));

        store.upsertStatic(topic(7, "Rewritten question", new BigDecimal("42")));

        Topic stored = store.get(7).orElseThrow();
        assertEquals("Original question", stored.question());
        assertEquals(new BigDecimal("42"), stored.state().volume());
        assertEquals(1, store.size());
    }

    @Test
    void mutationOfUnknownMarketIsRejected() {
        store.upsertStatic(topic(1, "a", null));

        boolean applied = store.applyMutation(99, s -> s.withPrice(OutcomeSide.YES, BigDecimal.ONE, T0));

        assertFalse(applied);
        assertEquals(1, store.size());
        assertFalse(store.contains(99));
    }

    @Test
    void mutationReplacesStateOnly() {
        Topic original = store.upsertStatic(topic(5, "Question", BigDecimal.TEN));

        assertTrue(store.applyMutation(5, s -> s.withPrice(OutcomeSide.NO, new BigDecimal("0.30"), T0.plusSeconds(5))));

        Topic updated = store.get(5).orElseThrow();
        assertEquals(original.question(), updated.question());
        assertEquals(new BigDecimal("0.30"), updated.state().lastPrice());
        assertEquals(new BigDecimal("0.30"), updated.state().noPrice());
        assertEquals(T0.plusSeconds(5), updated.state().updatedAt());
        // the earlier reference is untouched
        assertEquals(new BigDecimal("0.50"), original.state().lastPrice());
    }

    @Test
    void getAllIsAnImmutableCopy() {
        store.upsertStatic(topic(1, "a", null));
        List<Topic> all = store.getAll();

        store.upsertStatic(topic(2, "b", null));

        assertEquals(1, all.size());
        assertThrows(UnsupportedOperationException.class, () -> all.add(topic(3, "c", null)));
    }

    @Test
    void concurrentTradesOnOneMarketAreNotLost() throws Exception {
        store.upsertStatic(topic(1, "hot market", BigDecimal.ZERO));
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    startGate.await();
                    for (int i = 0; i < perThread; i++) {
                        store.applyMutation(1, s -> s.withTrade(OutcomeSide.YES, new BigDecimal("0.6"), BigDecimal.ONE, T0));
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, new BigDecimal(threads * perThread).compareTo(store.get(1).orElseThrow().state().volume()));
    }

    @Test
    void readersNeverSeeHalfAppliedUpdates() throws Exception {
        store.upsertStatic(topic(1, "m", BigDecimal.ZERO));
        CountDownLatch done = new CountDownLatch(1);
        Thread writer = new Thread(() -> {
            for (int i = 1; i <= 2000; i++) {
                BigDecimal p = BigDecimal.valueOf(i);
                store.applyMutation(1, s -> s.withPrice(OutcomeSide.YES, p, T0));
            }
            done.countDown();
        });
        writer.start();

        while (done.getCount() > 0) {
            MarketState s = store.get(1).orElseThrow().state();
            if (s.lastPrice() != null && s.yesPrice() != null) {
                assertEquals(s.lastPrice(), s.yesPrice());
            }
        }
        writer.join();
    }
}
