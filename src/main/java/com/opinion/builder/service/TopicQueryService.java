package com.opinion.builder.service;

import com.opinion.builder.dto.DateRange;
import com.opinion.builder.dto.Pagination;
import com.opinion.builder.dto.PriceRange;
import com.opinion.builder.dto.SortOption;
import com.opinion.builder.dto.TopicFilter;
import com.opinion.builder.entity.OutcomeType;
import com.opinion.builder.entity.Topic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Read side over {@link TopicStore}. Never blocks on the feed: every call works on a
 * point-in-time copy of the store and returns promptly even while the connection is down.
 */
@Service
public class TopicQueryService {

    private final TopicStore store;
    private final TopicSearchIndex searchIndex;
    private final int defaultLimit;
    private final int maxLimit;
    private final int searchDefaultLimit;

    public TopicQueryService(TopicStore store,
                             TopicSearchIndex searchIndex,
                             @Value("${opinion.query.default-limit:50}") int defaultLimit,
                             @Value("${opinion.query.max-limit:200}") int maxLimit,
                             @Value("${opinion.search.default-limit:100}") int searchDefaultLimit) {
        this.store = store;
        this.searchIndex = searchIndex;
        this.maxLimit = Math.max(1, maxLimit);
        this.defaultLimit = Math.min(Math.max(1, defaultLimit), this.maxLimit);
        this.searchDefaultLimit = Math.min(Math.max(1, searchDefaultLimit), this.maxLimit);
    }

    public record Page(List<Topic> items, int total, int limit, int offset) {}

    public Page list(TopicFilter filter, SortOption sort, Pagination pagination) {
        Predicate<Topic> predicate = compile(filter == null ? TopicFilter.none() : filter);
        Comparator<Topic> order = comparator(sort == null ? SortOption.defaults() : sort);
        Pagination page = pagination == null ? Pagination.defaults() : pagination;
        int limit = resolveLimit(page.limit(), defaultLimit);
        int offset = resolveOffset(page.offset());

        List<Topic> matched = store.getAll().stream()
                .filter(predicate)
                .sorted(order)
                .toList();
        int total = matched.size();
        if (offset >= total) {
            return new Page(List.of(), total, limit, offset);
        }
        return new Page(matched.subList(offset, Math.min(total, offset + limit)), total, limit, offset);
    }

    /** Simple listing: end-date window plus sort and pagination. */
    public Page getTopics(Instant endDateBefore, Instant endDateAfter,
                          String orderBy, String order, Integer limit, Integer offset) {
        TopicFilter filter = TopicFilter.builder()
                .endDateRange(endDateBefore == null && endDateAfter == null
                        ? null : new DateRange(endDateAfter, endDateBefore))
                .build();
        return list(filter, new SortOption(orderBy, order), new Pagination(limit, offset));
    }

    public Optional<Topic> getById(long marketId) {
        return store.get(marketId);
    }

    /**
     * Keyword search. Ranking comes from the index, the records themselves are read from the
     * store at call time. The page reports the limit actually applied, after clamping.
     */
    public Page search(String query, Integer limit, boolean fuzzy) {
        if (query == null || query.isBlank()) {
            throw new InvalidFilterException("q", "search query must not be blank");
        }
        int max = resolveLimit(limit, searchDefaultLimit);
        List<Topic> items = searchIndex.search(query, fuzzy).stream()
                .map(store::get)
                .flatMap(Optional::stream)
                .limit(max)
                .toList();
        return new Page(items, items.size(), max, 0);
    }

    private int resolveLimit(Integer requested, int fallback) {
        if (requested == null) {
            return fallback;
        }
        if (requested < 1) {
            throw new InvalidFilterException("limit", "limit must be at least 1");
        }
        return Math.min(requested, maxLimit);
    }

    private static int resolveOffset(Integer requested) {
        if (requested == null) {
            return 0;
        }
        if (requested < 0) {
            throw new InvalidFilterException("offset", "offset must not be negative");
        }
        return requested;
    }

    static Comparator<Topic> comparator(SortOption sort) {
        SortField field = SortField.fromWireName(sort.field());
        String order = sort.order().trim().toLowerCase(Locale.ROOT);
        Comparator<Topic> byField;
        switch (order) {
            case "asc" -> byField = field.comparator();
            case "desc" -> byField = field.comparator().reversed();
            default -> throw new InvalidFilterException("sort.order", "sort order must be asc or desc: " + sort.order());
        }
        return byField.thenComparingLong(Topic::marketId);
    }

    /** Validates every criterion up front and folds them into one predicate. */
    static Predicate<Topic> compile(TopicFilter filter) {
        List<Predicate<Topic>> parts = new ArrayList<>();

        DateRange endDates = filter.endDateRange();
        if (endDates != null) {
            Instant start = endDates.start();
            Instant end = endDates.end();
            if (start != null && end != null && start.isAfter(end)) {
                throw new InvalidFilterException("end_date_range", "end_date_range.start is after end_date_range.end");
            }
            if (start != null) {
                parts.add(t -> t.endDate() != null && !t.endDate().isBefore(start));
            }
            if (end != null) {
                parts.add(t -> t.endDate() != null && !t.endDate().isAfter(end));
            }
        }

        if (!filter.outcomeTypes().isEmpty()) {
            if (filter.outcomeTypes().stream().anyMatch(Objects::isNull)) {
                throw new InvalidFilterException("outcome_types", "outcome_types must not contain null");
            }
            Set<OutcomeType> types = EnumSet.copyOf(filter.outcomeTypes());
            parts.add(t -> types.contains(t.outcomeType()));
        }

        Set<String> wanted = lowerCased(filter.categories());
        if (!wanted.isEmpty()) {
            parts.add(t -> t.categories().stream().anyMatch(c -> wanted.contains(c.toLowerCase(Locale.ROOT))));
        }

        Set<String> include = lowerCased(filter.keywords());
        if (!include.isEmpty()) {
            parts.add(t -> containsAny(t.question(), include));
        }

        Set<String> exclude = lowerCased(filter.excludeKeywords());
        if (!exclude.isEmpty()) {
            parts.add(t -> !containsAny(t.question(), exclude));
        }

        PriceRange prices = filter.priceRange();
        if (prices != null) {
            BigDecimal min = parseDecimal("price_range.min", prices.min());
            BigDecimal max = parseDecimal("price_range.max", prices.max());
            checkBounds("price_range", min, max);
            if (min != null) {
                parts.add(t -> t.state().lastPrice() != null && t.state().lastPrice().compareTo(min) >= 0);
            }
            if (max != null) {
                parts.add(t -> t.state().lastPrice() != null && t.state().lastPrice().compareTo(max) <= 0);
            }
        }

        BigDecimal minVolume = filter.minVolume();
        BigDecimal maxVolume = filter.maxVolume();
        if (minVolume != null && minVolume.signum() < 0) {
            throw new InvalidFilterException("min_volume", "min_volume must not be negative");
        }
        if (maxVolume != null && maxVolume.signum() < 0) {
            throw new InvalidFilterException("max_volume", "max_volume must not be negative");
        }
        checkBounds("volume", minVolume, maxVolume);
        if (minVolume != null) {
            parts.add(t -> t.state().volume() != null && t.state().volume().compareTo(minVolume) >= 0);
        }
        if (maxVolume != null) {
            parts.add(t -> t.state().volume() != null && t.state().volume().compareTo(maxVolume) <= 0);
        }

        Instant createdAfter = filter.createdAfter();
        if (createdAfter != null) {
            parts.add(t -> t.createdAt() != null && !t.createdAt().isBefore(createdAfter));
        }

        return parts.stream().reduce(t -> true, Predicate::and);
    }

    private static BigDecimal parseDecimal(String parameter, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidFilterException(parameter, parameter + " is not a decimal number: " + value);
        }
    }

    private static void checkBounds(String parameter, BigDecimal min, BigDecimal max) {
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new InvalidFilterException(parameter, parameter + " minimum is greater than its maximum");
        }
    }

    private static boolean containsAny(String text, Set<String> needles) {
        String haystack = text.toLowerCase(Locale.ROOT);
        return needles.stream().anyMatch(haystack::contains);
    }

    private static Set<String> lowerCased(List<String> values) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
