package com.mirrortrader.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.enums.FeedEventType;
import com.mirrortrader.domain.enums.OrderSide;
import com.mirrortrader.domain.model.Fill;
import com.mirrortrader.exception.NormalizationException;
import com.mirrortrader.oms.ClientOrderIds;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw feed payloads into {@link FeedEvent}s.
 *
 * <p>Accepts both the canonical event names (OrderOpened, Filled, OrdersClosed) and the
 * venue's wire names (OrderCreated, Trade, OrdersCanceled), and both snake_case and the
 * venue's run-together field names ({@code order_id} / {@code orderid}).
 *
 * <p>Every required field is checked for presence and type. A missing or malformed field
 * raises {@link NormalizationException}; nothing is defaulted. Two kinds of well-formed
 * events are filtered out and reported as empty:
 * <ul>
 *   <li>events for markets outside the subscription set</li>
 *   <li>order openings not owned by a source wallet, and cancels owned by neither a source
 *       wallet nor our own wallet</li>
 *   <li>order openings in a blacklisted market; fills and cancels there still pass</li>
 * </ul>
 */
@Component
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    private static final Map<String, FeedEventType> EVENT_NAMES = Map.of(
            "orderopened", FeedEventType.ORDER_OPENED,
            "ordercreated", FeedEventType.ORDER_OPENED,
            "filled", FeedEventType.FILLED,
            "trade", FeedEventType.FILLED,
            "ordersclosed", FeedEventType.ORDERS_CLOSED,
            "orderscanceled", FeedEventType.ORDERS_CLOSED);

    private final MirrorConfig mirrorConfig;

    public EventNormalizer(MirrorConfig mirrorConfig) {
        this.mirrorConfig = mirrorConfig;
    }

    /**
     * Validates and converts one raw payload.
     *
     * @return the domain event, or empty if the event is well-formed but not of interest
     * @throws NormalizationException if the payload is malformed
     */
    public Optional<FeedEvent> normalize(RawFeedEvent raw) {
        Payload payload = new Payload(raw);
        FeedEventType type = payload.type();
        String market = payload.market();

        if (!mirrorConfig.isSubscribed(market)) {
            log.debug("Dropping event for unsubscribed market: market={}, type={}", market, type);
            return Optional.empty();
        }

        return switch (type) {
            case ORDER_OPENED -> orderOpened(payload, market);
            case FILLED -> Optional.of(filled(payload, market));
            case ORDERS_CLOSED -> ordersClosed(payload, market);
        };
    }

    private Optional<FeedEvent> orderOpened(Payload payload, String market) {
        String owner = payload.requiredText("owner", "owner");
        if (!mirrorConfig.isSourceWallet(owner)) {
            log.debug("Dropping order from non-source wallet: market={}, owner={}", market, owner);
            return Optional.empty();
        }
        if (mirrorConfig.isBlacklisted(market)) {
            log.debug("Dropping order in blacklisted market: market={}, owner={}", market, owner);
            return Optional.empty();
        }

        String clientOrderId = payload.optionalText("cloid", "client_order_id", "clientOrderId");
        if (clientOrderId != null && clientOrderId.length() > ClientOrderIds.MAX_LENGTH) {
            throw payload.error("client_order_id longer than " + ClientOrderIds.MAX_LENGTH + " characters");
        }

        return Optional.of(new OrderOpenedEvent(
                market,
                payload.requiredLong("order_id", "order_id", "orderid", "orderId"),
                owner.toLowerCase(Locale.ROOT),
                payload.side(),
                payload.positiveDecimal("price", "price"),
                payload.positiveDecimal("size", "size"),
                clientOrderId,
                payload.receivedAt()));
    }

    private FeedEvent filled(Payload payload, String market) {
        long sequenceMarker = payload.requiredLong("sequence_marker", "sequence", "blocknumber", "block_number");
        if (sequenceMarker < 0) {
            throw payload.error("sequence_marker must not be negative");
        }
        Fill fill = new Fill(
                payload.requiredLong("order_id", "orderid", "order_id", "orderId"),
                payload.positiveDecimal("filled_size", "filledsize", "filled_size", "filledSize"),
                payload.positiveDecimal("price", "price"),
                sequenceMarker,
                payload.observedAt());
        return new FilledEvent(market, fill);
    }

    private Optional<FeedEvent> ordersClosed(Payload payload, String market) {
        String owner = payload.requiredText("owner", "owner", "maker_address", "makeraddress");
        if (!mirrorConfig.isSourceWallet(owner) && !mirrorConfig.isOwnWallet(owner)) {
            log.debug("Dropping cancel from unrelated wallet: market={}, owner={}", market, owner);
            return Optional.empty();
        }
        return Optional.of(new OrdersClosedEvent(
                market,
                payload.orderIds(),
                owner.toLowerCase(Locale.ROOT),
                payload.optionalLong("sequence", "blocknumber", "block_number"),
                payload.receivedAt()));
    }

    /** Typed field access over one raw payload; every failure names the field and carries the payload. */
    private static final class Payload {

        private final RawFeedEvent raw;
        private final JsonNode node;

        Payload(RawFeedEvent raw) {
            this.raw = raw;
            if (raw == null || raw.payload() == null || !raw.payload().isObject()) {
                throw new NormalizationException(
                        raw != null ? raw.eventType() : null, "payload must be a JSON object", describe(raw));
            }
            this.node = raw.payload();
        }

        FeedEventType type() {
            String name = raw.eventType();
            FeedEventType type = name != null ? EVENT_NAMES.get(name.toLowerCase(Locale.ROOT)) : null;
            if (type == null) {
                throw error("unknown event type");
            }
            return type;
        }

        String market() {
            String market = optionalText("market_address", "market", "marketAddress");
            if (market == null) {
                market = raw.market();
            }
            if (market == null || market.isBlank()) {
                throw error("missing required field market");
            }
            return market.toLowerCase(Locale.ROOT);
        }

        OrderSide side() {
            JsonNode isBuy = field("is_buy", "isbuy", "isBuy");
            if (isBuy != null) {
                if (isBuy.isBoolean()) {
                    return OrderSide.fromBuyFlag(isBuy.booleanValue());
                }
                throw error("field is_buy must be a boolean");
            }
            String side = optionalText("side");
            if (side == null) {
                throw error("missing required field side");
            }
            try {
                return OrderSide.valueOf(side.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw error("field side must be BUY or SELL, was " + side);
            }
        }

        List<Long> orderIds() {
            JsonNode ids = field("order_ids", "orderids", "orderIds");
            if (ids == null) {
                throw error("missing required field order_ids");
            }
            if (!ids.isArray() || ids.isEmpty()) {
                throw error("field order_ids must be a non-empty array");
            }
            List<Long> result = new ArrayList<>(ids.size());
            for (JsonNode id : ids) {
                result.add(toLong("order_ids[]", id));
            }
            return result;
        }

        Instant receivedAt() {
            return raw.receivedAt() != null ? raw.receivedAt() : Instant.EPOCH;
        }

        /** Venue trigger time in epoch seconds when present, otherwise the receive time. */
        Instant observedAt() {
            Long triggerTime = optionalLong("triggertime", "trigger_time", "timestamp");
            return triggerTime != null ? Instant.ofEpochSecond(triggerTime) : receivedAt();
        }

        String requiredText(String label, String... names) {
            String value = optionalText(names);
            if (value == null) {
                throw error("missing required field " + label);
            }
            return value;
        }

        String optionalText(String... names) {
            JsonNode value = field(names);
            if (value == null) {
                return null;
            }
            if (!value.isTextual() || value.asText().isBlank()) {
                throw error("field " + names[0] + " must be a non-empty string");
            }
            return value.asText();
        }

        long requiredLong(String label, String... names) {
            JsonNode value = field(names);
            if (value == null) {
                throw error("missing required field " + label);
            }
            return toLong(label, value);
        }

        Long optionalLong(String... names) {
            JsonNode value = field(names);
            return value != null ? toLong(names[0], value) : null;
        }

        BigDecimal positiveDecimal(String label, String... names) {
            JsonNode value = field(names);
            if (value == null) {
                throw error("missing required field " + label);
            }
            BigDecimal decimal;
            if (value.isNumber()) {
                decimal = value.decimalValue();
            } else if (value.isTextual()) {
                try {
                    decimal = new BigDecimal(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw error("field " + label + " is not a decimal: " + value.asText());
                }
            } else {
                throw error("field " + label + " must be a number");
            }
            if (decimal.signum() <= 0) {
                throw error("field " + label + " must be positive, was " + decimal.toPlainString());
            }
            return decimal;
        }

        NormalizationException error(String message) {
            return new NormalizationException(raw.eventType(), message, describe(raw));
        }

        private long toLong(String label, JsonNode value) {
            if (value.isIntegralNumber() && value.canConvertToLong()) {
                return value.longValue();
            }
            if (value.isTextual()) {
                try {
                    return Long.parseLong(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw error("field " + label + " is not an integer: " + value.asText());
                }
            }
            throw error("field " + label + " must be an integer");
        }

        /** First present, non-null field among the aliases. */
        private JsonNode field(String... names) {
            for (String name : names) {
                JsonNode value = node.get(name);
                if (value != null && !value.isNull()) {
                    return value;
                }
            }
            return null;
        }

        private static String describe(RawFeedEvent raw) {
            if (raw == null) {
                return "null";
            }
            return "market=" + raw.market() + " type=" + raw.eventType() + " payload=" + raw.payload();
        }
    }
}
