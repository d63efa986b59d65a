package com.opinion.builder.service;

import com.opinion.builder.dto.DateRange;
import com.opinion.builder.dto.Pagination;
import com.opinion.builder.dto.PriceRange;
import com.opinion.builder.dto.SortOption;
import com.opinion.builder.dto.TopicFilter;
import com.opinion.builder.entity.MarketState;
import com.opinion.builder.entity.OutcomeSide;
import com.opinion.builder.entity.OutcomeType;
import com.opinion.builder.entity.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicQueryServiceTest {

    private TopicStore store;
    private TopicQueryService service;

    @BeforeEach
    void setUp() {
        TopicSearchIndex index = new TopicSearchIndex(2);
        store = new TopicStore(index);
        service = new TopicQueryService(store, index, 50, 200, 100);

        store.upsertStatic(topic(1, "Will Bitcoin hit 100k?", OutcomeType.BINARY,
                "2025-01-10T00:00:00Z", "2024-01-01T00:00:00Z", List.of("Crypto"), "0.40", "1000"));
        store.upsertStatic(topic(2, "Ethereum ETF approved?", OutcomeType.BINARY,
                "2025-03-01T00:00:00Z", "2024-02-01T00:00:00Z", List.of("crypto", "ETF"), "0.75", "500"));
        store.upsertStatic(topic(3, "Who wins the election?", OutcomeType.CATEGORICAL,
                "2024-11-05T00:00:00Z", "2023-06-01T00:00:00Z", List.of("Politics"), null, null));
        store.upsertStatic(topic(4, "Fed rate cut in March?", OutcomeType.SCALAR,
                null, "2024-03-01T00:00:00Z", List.of("Macro"), "0.10", "2000"));
    }

    private static Topic topic(long id, String question, OutcomeType type, String endDate, String createdAt,
                               List<String> categories, String price, String volume) {
        return Topic.builder()
                .marketId(id)
                .question(question)
                .outcomeType(type)
                .endDate(endDate == null ? null : Instant.parse(endDate))
                .createdAt(Instant.parse(createdAt))
                .categories(categories)
                .state(new MarketState(
                        price == null ? null : new BigDecimal(price), null, null,
                        volume == null ? null : new BigDecimal(volume), null, null))
                .build();
    }

    private static List<Long> ids(TopicQueryService.Page page) {
        return page.items().stream().map(Topic::marketId).toList();
    }

    private TopicQueryService.Page list(TopicFilter filter) {
        return service.list(filter, null, null);
    }

    @Test
    void defaultsSortByEndDateAscendingWithMissingFirst() {
        TopicQueryService.Page page = service.list(null, null, null);

        assertEquals(List.of(4L, 3L, 1L, 2L), ids(page));
        assertEquals(4, page.total());
        assertEquals(50, page.limit());
        assertEquals(0, page.offset());
    }

    @Test
    void descendingVolumePutsMissingLast() {
        TopicQueryService.Page page = service.list(null, new SortOption("volume", "desc"), null);

        assertEquals(List.of(4L, 1L, 2L, 3L), ids(page));
    }

    @Test
    void equalKeysFallBackToMarketId() {
        store.upsertStatic(topic(9, "Another macro market", OutcomeType.BINARY,
                null, "2024-03-01T00:00:00Z", List.of(), "0.10", "2000"));

        assertEquals(List.of(4L, 9L, 1L, 2L, 3L), ids(service.list(null, new SortOption("volume", "desc"), null)));
    }

    @Test
    void categoriesMatchIgnoringCase() {
        assertEquals(List.of(1L, 2L), ids(list(TopicFilter.builder().categories(List.of("CRYPTO")).build())));
    }

    @Test
    void keywordInclusionAndExclusion() {
        TopicFilter filter = TopicFilter.builder()
                .keywords(List.of("bitcoin", "ethereum"))
                .excludeKeywords(List.of("etf"))
                .build();

        assertEquals(List.of(1L), ids(list(filter)));
    }

    @Test
    void blankKeywordsDoNotRestrict() {
        TopicFilter filter = TopicFilter.builder().keywords(List.of(" ")).categories(List.of("")).build();

        assertEquals(4, list(filter).total());
    }

    @Test
    void priceRangeSkipsTopicsWithoutPrice() {
        TopicFilter filter = TopicFilter.builder().priceRange(new PriceRange("0.3", "0.8")).build();

        assertEquals(List.of(1L, 2L), ids(list(filter)));
    }

    @Test
    void outcomeTypeMembership() {
        TopicFilter filter = TopicFilter.builder()
                .outcomeTypes(List.of(OutcomeType.CATEGORICAL, OutcomeType.SCALAR))
                .build();

        assertEquals(List.of(4L, 3L), ids(list(filter)));
    }

    @Test
    void createdAfterIsInclusive() {
        TopicFilter filter = TopicFilter.builder().createdAfter(Instant.parse("2024-02-01T00:00:00Z")).build();

        assertEquals(List.of(4L, 2L), ids(list(filter)));
    }

    @Test
    void volumeRange() {
        TopicFilter filter = TopicFilter.builder()
                .minVolume(new BigDecimal("500"))
                .maxVolume(new BigDecimal("1000"))
                .build();

        assertEquals(List.of(1L, 2L), ids(list(filter)));
    }

    @Test
    void filtersCombineAsConjunction() {
        TopicFilter filter = TopicFilter.builder()
                .categories(List.of("crypto"))
                .minVolume(new BigDecimal("600"))
                .endDateRange(new DateRange(Instant.parse("2025-01-01T00:00:00Z"), null))
                .build();

        assertEquals(List.of(1L), ids(list(filter)));
    }

    @Test
    void getTopicsUsesEndDateWindow() {
        TopicQueryService.Page page = service.getTopics(Instant.parse("2025-02-01T00:00:00Z"), null,
                null, null, null, null);

        assertEquals(List.of(3L, 1L), ids(page));
    }

    @Test
    void pagination() {
        TopicQueryService.Page page = service.list(null, null, new Pagination(2, 1));

        assertEquals(List.of(3L, 1L), ids(page));
        assertEquals(4, page.total());
        assertEquals(2, page.limit());
        assertEquals(1, page.offset());
    }

    @Test
    void offsetPastTheEndIsAnEmptyPage() {
        TopicQueryService.Page page = service.list(null, null, new Pagination(10, 10));

        assertTrue(page.items().isEmpty());
        assertEquals(4, page.total());
    }

    @Test
    void limitIsClamped() {
        assertEquals(200, service.list(null, null, new Pagination(5000, 0)).limit());
    }

    @Test
    void invalidInputsAreRejected() {
        assertEquals("limit", assertThrows(InvalidFilterException.class,
                () -> service.list(null, null, new Pagination(0, 0))).getParameter());
        assertEquals("offset", assertThrows(InvalidFilterException.class,
                () -> service.list(null, null, new Pagination(10, -1))).getParameter());
        assertEquals("sort.field", assertThrows(InvalidFilterException.class,
                () -> service.list(null, new SortOption("popularity", "asc"), null)).getParameter());
        assertEquals("sort.order", assertThrows(InvalidFilterException.class,
                () -> service.list(null, new SortOption("volume", "sideways"), null)).getParameter());
        assertEquals("price_range", assertThrows(InvalidFilterException.class,
                () -> list(TopicFilter.builder().priceRange(new PriceRange("0.9", "0.1")).build())).getParameter());
        assertEquals("price_range.min", assertThrows(InvalidFilterException.class,
                () -> list(TopicFilter.builder().priceRange(new PriceRange("cheap", null)).build())).getParameter());
        assertEquals("min_volume", assertThrows(InvalidFilterException.class,
                () -> list(TopicFilter.builder().minVolume(new BigDecimal("-1")).build())).getParameter());
        assertEquals("volume", assertThrows(InvalidFilterException.class,
                () -> list(TopicFilter.builder().minVolume(BigDecimal.TEN).maxVolume(BigDecimal.ONE).build())).getParameter());
        assertEquals("end_date_range", assertThrows(InvalidFilterException.class,
                () -> list(TopicFilter.builder().endDateRange(new DateRange(
                        Instant.parse("2025-02-01T00:00:00Z"), Instant.parse("2025-01-01T00:00:00Z"))).build())).getParameter());
        assertEquals("outcome_types", assertThrows(InvalidFilterException.class,
                () -> list(TopicFilter.builder().outcomeTypes(Arrays.asList((OutcomeType) null)).build())).getParameter());
    }

    @Test
    void searchResolvesAgainstCurrentState() {
        store.applyMutation(1, s -> s.withPrice(OutcomeSide.YES, new BigDecimal("0.55"), Instant.now()));

        List<Topic> hits = service.search("bitcoin", null, false).items();

        assertEquals(1, hits.size());
        assertEquals(new BigDecimal("0.55"), hits.get(0).state().lastPrice());
    }

    @Test
    void searchHonoursLimit() {
        assertEquals(1, service.search("crypto", 1, false).items().size());
        assertEquals(2, service.search("crypto", null, false).items().size());
    }

    @Test
    void searchReportsClampedLimit() {
        TopicQueryService.Page page = service.search("crypto", 1000, false);

        assertEquals(200, page.limit());
        assertEquals(2, page.total());
        assertEquals(100, service.search("crypto", null, false).limit());
    }

    @Test
    void blankSearchIsRejected() {
        assertEquals("q", assertThrows(InvalidFilterException.class,
                () -> service.search("  ", null, true)).getParameter());
    }

    @Test
    void getById() {
        assertEquals("Ethereum ETF approved?", service.getById(2).orElseThrow().question());
        assertTrue(service.getById(404).isEmpty());
    }
}
