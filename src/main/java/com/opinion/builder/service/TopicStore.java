package com.opinion.builder.service;

import com.opinion.builder.entity.MarketState;
import com.opinion.builder.entity.Topic;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Authoritative in-memory state of every tracked topic, keyed by market id.
 * <p>
 * Records are immutable and swapped atomically per key, so writes on different markets
 * don't contend, writes on one market are serialized, and readers always get whole records.
 */
@Component
@RequiredArgsConstructor
public class TopicStore {

    private final ConcurrentHashMap<Long, Topic> topics = new ConcurrentHashMap<>();
    private final TopicSearchIndex searchIndex;

    public Optional<Topic> get(long marketId) {
        return Optional.ofNullable(topics.get(marketId));
    }

    public boolean contains(long marketId) {
        return topics.containsKey(marketId);
    }

    /** Point-in-time copy of all records. */
    public List<Topic> getAll() {
        return List.copyOf(topics.values());
    }

    public int size() {
        return topics.size();
    }

    /**
     * Initial-load write. A market already present keeps its descriptive fields and only
     * takes the incoming market state.
     */
    public Topic upsertStatic(Topic topic) {
        Objects.requireNonNull(topic, "topic");
        Topic stored = topics.merge(topic.marketId(), topic,
                (existing, incoming) -> existing.withState(incoming.state()));
        searchIndex.index(stored);
        return stored;
    }

    /**
     * Atomically replaces the market state of one topic.
     *
     * @return false if the market is unknown, in which case nothing happens
     */
    public boolean applyMutation(long marketId, UnaryOperator<MarketState> mutation) {
        Topic updated = topics.computeIfPresent(marketId, (id, current) ->
                current.withState(Objects.requireNonNull(mutation.apply(current.state()), "mutation result")));
        return updated != null;
    }
}
