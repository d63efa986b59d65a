package com.opinion.builder.service;

import com.opinion.builder.entity.Topic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Keyword index over the descriptive text of topics (question, description, categories).
 * Holds market ids only; {@link TopicStore} stays the source of truth for the records.
 * <p>
 * Writes come from {@link TopicStore#upsertStatic(Topic)} and are serialized; searches are
 * lock-free and may run concurrently with them.
 */
@Component
public class TopicSearchIndex {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    static final double EXACT_WEIGHT = 1.0;
    static final double PREFIX_WEIGHT = 0.8;
    static final double EDIT_WEIGHT = 0.6;

    private final Map<String, Set<Long>> postings = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> tokensById = new ConcurrentHashMap<>();
    private final int maxEditDistance;

    public TopicSearchIndex(@Value("${opinion.search.max-edit-distance:2}") int maxEditDistance) {
        this.maxEditDistance = Math.max(0, maxEditDistance);
    }

    /** (Re)indexes the text fields of a topic, dropping tokens it no longer carries. */
    public synchronized void index(Topic topic) {
        long id = topic.marketId();
        Set<String> tokens = tokenize(topic);
        Set<String> previous = tokensById.put(id, tokens);

        for (String token : tokens) {
            postings.compute(token, (k, ids) -> {
                Set<Long> set = ids == null ? ConcurrentHashMap.newKeySet() : ids;
                set.add(id);
                return set;
            });
        }
        if (previous != null) {
            for (String stale : previous) {
                if (!tokens.contains(stale)) {
                    postings.computeIfPresent(stale, (k, ids) -> {
                        ids.remove(id);
                        return ids.isEmpty() ? null : ids;
                    });
                }
            }
        }
    }

    /**
     * Market ids matching every token of {@code query}, best match first. Ties keep the lower
     * market id first.
     */
    public List<Long> search(String query, boolean fuzzy) {
        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return List.of();
        }

        Map<Long, Double> scores = null;
        for (String queryToken : queryTokens) {
            Map<Long, Double> matches = match(queryToken, fuzzy);
            if (scores == null) {
                scores = matches;
            } else {
                scores.keySet().retainAll(matches.keySet());
                scores.replaceAll((id, score) -> score + matches.get(id));
            }
            if (scores.isEmpty()) {
                return List.of();
            }
        }

        List<Map.Entry<Long, Double>> ranked = new ArrayList<>(scores.entrySet());
        ranked.sort(Map.Entry.<Long, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        return ranked.stream().map(Map.Entry::getKey).toList();
    }

    private Map<Long, Double> match(String queryToken, boolean fuzzy) {
        Map<Long, Double> best = new HashMap<>();
        if (!fuzzy) {
            Set<Long> ids = postings.get(queryToken);
            if (ids != null) {
                ids.forEach(id -> best.put(id, EXACT_WEIGHT));
            }
            return best;
        }

        int allowed = allowedDistance(queryToken);
        for (Map.Entry<String, Set<Long>> entry : postings.entrySet()) {
            double weight = weigh(queryToken, entry.getKey(), allowed);
            if (weight > 0) {
                for (Long id : entry.getValue()) {
                    best.merge(id, weight, Math::max);
                }
            }
        }
        return best;
    }

    private double weigh(String queryToken, String term, int allowed) {
        if (term.equals(queryToken)) {
            return EXACT_WEIGHT;
        }
        if (queryToken.length() >= 3 && term.startsWith(queryToken)) {
            return PREFIX_WEIGHT;
        }
        if (allowed == 0) {
            return 0;
        }
        int distance = editDistance(queryToken, term, allowed);
        return distance <= allowed ? EDIT_WEIGHT - 0.1 * (distance - 1) : 0;
    }

    private int allowedDistance(String token) {
        if (token.length() >= 4) {
            return maxEditDistance;
        }
        return token.length() == 3 ? Math.min(1, maxEditDistance) : 0;
    }

    /**
     * Levenshtein distance, giving up with {@code limit + 1} once every cell of a row
     * exceeds {@code limit}.
     */
    static int editDistance(String a, String b, int limit) {
        if (Math.abs(a.length() - b.length()) > limit) {
            return limit + 1;
        }
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            int rowMin = curr[0];
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
                rowMin = Math.min(rowMin, curr[j]);
            }
            if (rowMin > limit) {
                return limit + 1;
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[b.length()];
    }

    static Set<String> tokenize(Topic topic) {
        Set<String> tokens = new LinkedHashSet<>(tokenize(topic.question()));
        tokens.addAll(tokenize(topic.description()));
        for (String category : topic.categories()) {
            tokens.addAll(tokenize(category));
        }
        return Set.copyOf(tokens);
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String raw : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (!raw.isEmpty()) {
                tokens.add(raw);
            }
        }
        return tokens;
    }
}
