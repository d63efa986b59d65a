package com.opinion.builder.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opinion.builder.entity.OutcomeSide;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.opinion.builder.feed.MalformedMessageException.Reason.INVALID_VALUE;
import static com.opinion.builder.feed.MalformedMessageException.Reason.MISSING_FIELD;
import static com.opinion.builder.feed.MalformedMessageException.Reason.UNKNOWN_TYPE;
import static com.opinion.builder.feed.MalformedMessageException.Reason.UNPARSEABLE;

/**
 * Turns raw JSON frames into {@link FeedMessage}s. Heartbeat replies and subscription acks
 * come back as empty; anything else that doesn't fit throws {@link MalformedMessageException}.
 */
@Component
public class FeedMessageParser {

    private static final Set<String> CONTROL_TYPES = Set.of("PONG", "HEARTBEAT");

    private final ObjectMapper om = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public Optional<FeedMessage> parse(String frame) {
        JsonNode root = readTree(frame);

        JsonNode type = root.get("msgType");
        if (type == null || type.isNull()) {
            // acks carry the echoed action or a status code instead of a msgType
            if (root.has("action") || root.has("code")) {
                return Optional.empty();
            }
            throw new MalformedMessageException(MISSING_FIELD, "missing msgType");
        }
        String msgType = type.asText();
        if (CONTROL_TYPES.contains(msgType.toUpperCase(Locale.ROOT))) {
            return Optional.empty();
        }
        FeedChannel channel = FeedChannel.fromWireName(msgType)
                .orElseThrow(() -> new MalformedMessageException(UNKNOWN_TYPE, "unknown msgType " + msgType));

        long marketId = requireLong(root, "marketId");
        String tokenId = requireText(root, "tokenId");
        OutcomeSide outcomeSide = requireSide(root);

        FeedMessage message = switch (channel) {
            case LAST_PRICE -> new FeedMessage.PriceUpdate(marketId, tokenId, outcomeSide,
                    requireDecimal(root, "price"));
            case LAST_TRADE -> new FeedMessage.TradeUpdate(marketId, tokenId, outcomeSide,
                    requireText(root, "side"),
                    requireDecimal(root, "price"),
                    requireDecimal(root, "shares"),
                    requireDecimal(root, "amount"));
            case DEPTH_DIFF -> new FeedMessage.DepthDiff(marketId, tokenId, outcomeSide,
                    requireText(root, "side"),
                    requireDecimal(root, "price"),
                    requireDecimal(root, "size"));
        };
        return Optional.of(message);
    }

    private JsonNode readTree(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new MalformedMessageException(UNPARSEABLE, "empty frame");
        }
        JsonNode root;
        try {
            root = om.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(UNPARSEABLE, "frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException(UNPARSEABLE, "frame is not a JSON object");
        }
        return root;
    }

    private static JsonNode require(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new MalformedMessageException(MISSING_FIELD, "missing " + field);
        }
        return node;
    }

    private static String requireText(JsonNode root, String field) {
        JsonNode node = require(root, field);
        if (!node.isValueNode() || node.asText().isBlank()) {
            throw new MalformedMessageException(INVALID_VALUE, field + " must be a non-empty value");
        }
        return node.asText();
    }

    private static long requireLong(JsonNode root, String field) {
        JsonNode node = require(root, field);
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedMessageException(INVALID_VALUE, field + " is not an integer: " + node.asText(), e);
            }
        }
        throw new MalformedMessageException(INVALID_VALUE, field + " is not an integer: " + node);
    }

    private static BigDecimal requireDecimal(JsonNode root, String field) {
        JsonNode node = require(root, field);
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedMessageException(INVALID_VALUE, field + " is not a number: " + node.asText(), e);
            }
        }
        throw new MalformedMessageException(INVALID_VALUE, field + " is not a number: " + node);
    }

    private static OutcomeSide requireSide(JsonNode root) {
        long code = requireLong(root, "outcomeSide");
        if (code < Integer.MIN_VALUE || code > Integer.MAX_VALUE) {
            throw new MalformedMessageException(INVALID_VALUE, "outcomeSide out of range: " + code);
        }
        try {
            return OutcomeSide.fromCode((int) code);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(INVALID_VALUE, e.getMessage(), e);
        }
    }
}
