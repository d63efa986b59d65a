package com.opinion.builder.controller;

import com.opinion.builder.dto.TopicDetailResponse;
import com.opinion.builder.dto.TopicFilterRequest;
import com.opinion.builder.dto.TopicListResponse;
import com.opinion.builder.service.TopicQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/topics")
@RequiredArgsConstructor
public class TopicController {

    private final TopicQueryService queryService;

    @GetMapping
    public TopicListResponse list(
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset,
            @RequestParam(value = "end_date_before", required = false) Instant endDateBefore,
            @RequestParam(value = "end_date_after", required = false) Instant endDateAfter,
            @RequestParam(value = "order_by", required = false) String orderBy,
            @RequestParam(value = "order", required = false) String order) {
        return toResponse(queryService.getTopics(endDateBefore, endDateAfter, orderBy, order, limit, offset));
    }

    @GetMapping("/search")
    public TopicListResponse search(@RequestParam(value = "q", required = false) String q,
                                    @RequestParam(value = "limit", required = false) Integer limit,
                                    @RequestParam(value = "fuzzy", defaultValue = "true") boolean fuzzy) {
        return toResponse(queryService.search(q, limit, fuzzy));
    }

    @PostMapping("/filter")
    public TopicListResponse filter(@RequestBody(required = false) TopicFilterRequest request) {
        TopicFilterRequest body = request == null ? new TopicFilterRequest(null, null, null) : request;
        return toResponse(queryService.list(body.filters(), body.sort(), body.pagination()));
    }

    @GetMapping("/{id}")
    public TopicDetailResponse get(@PathVariable("id") String id) {
        long marketId;
        try {
            marketId = Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            throw new TopicNotFoundException(id);
        }
        return queryService.getById(marketId)
                .map(TopicDetailResponse::new)
                .orElseThrow(() -> new TopicNotFoundException(id));
    }

    private static TopicListResponse toResponse(TopicQueryService.Page page) {
        return new TopicListResponse(page.items(), page.total(), page.limit(), page.offset());
    }
}
