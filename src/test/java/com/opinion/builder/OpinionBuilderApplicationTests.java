package com.opinion.builder;

import com.opinion.builder.feed.ConnectionState;
import com.opinion.builder.feed.FeedConnection;
import com.opinion.builder.feed.MessageDispatcher;
import com.opinion.builder.service.FeedMetrics;
import com.opinion.builder.service.TopicQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "opinion.ws.enabled=false",
        "opinion.sdk.base-url=http://127.0.0.1:1"
})
class OpinionBuilderApplicationTests {

    @Autowired private FeedConnection connection;
    @Autowired private MessageDispatcher dispatcher;
    @Autowired private TopicQueryService queryService;
    @Autowired private FeedMetrics metrics;

    @Test
    void contextWiresWithoutStartingTheFeed() {
        assertEquals(ConnectionState.DISCONNECTED, connection.state());
        assertFalse(connection.isRunning());
        assertTrue(queryService.list(null, null, null).items().isEmpty());
        assertNotNull(dispatcher);
        assertEquals(0L, metrics.totals().get("messages_applied"));
    }
}
