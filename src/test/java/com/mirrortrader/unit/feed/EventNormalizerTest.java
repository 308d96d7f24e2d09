package com.mirrortrader.unit.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.enums.FeedEventType;
import com.mirrortrader.domain.enums.OrderSide;
import com.mirrortrader.exception.NormalizationException;
import com.mirrortrader.feed.EventNormalizer;
import com.mirrortrader.feed.FeedEvent;
import com.mirrortrader.feed.FilledEvent;
import com.mirrortrader.feed.OrderOpenedEvent;
import com.mirrortrader.feed.OrdersClosedEvent;
import com.mirrortrader.feed.RawFeedEvent;
import com.mirrortrader.unit.support.TestMirrorConfig;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EventNormalizer covering the three event kinds, venue field aliases,
 * market and wallet filtering, and rejection of malformed payloads.
 */
class EventNormalizerTest {

    private static final Instant RECEIVED = Instant.parse("2026-03-02T10:00:00Z");
    private static final String MARKET = TestMirrorConfig.MARKET;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EventNormalizer(TestMirrorConfig.defaults());
    }

    // ==============================
    // ORDER OPENED
    // ==============================

    @Nested
    @DisplayName("OrderOpened")
    class OrderOpened {

        @Test
        @DisplayName("Canonical payload from a source wallet becomes an OrderOpenedEvent")
        void canonicalPayload_normalized() {
            FeedEvent event = normalize(MARKET, "OrderOpened", """
                    {"order_id": 12, "owner": "0xSOURCE", "side": "buy", "price": "0.55", "size": 100}
                    """).orElseThrow();

            OrderOpenedEvent opened = (OrderOpenedEvent) event;
            assertThat(opened.type()).isEqualTo(FeedEventType.ORDER_OPENED);
            assertThat(opened.market()).isEqualTo(MARKET);
            assertThat(opened.sourceOrderId()).isEqualTo(12L);
            assertThat(opened.owner()).isEqualTo("0xsource");
            assertThat(opened.side()).isEqualTo(OrderSide.BUY);
            assertThat(opened.price()).isEqualByComparingTo("0.55");
            assertThat(opened.size()).isEqualByComparingTo("100");
            assertThat(opened.observedAt()).isEqualTo(RECEIVED);
        }

        @Test
        @DisplayName("Venue wire names and run-together fields are accepted")
        void venueAliases_normalized() {
            FeedEvent event = normalize(MARKET, "OrderCreated", """
                    {"orderid": "13", "owner": "0xsource", "isbuy": false, "price": 2, "size": "5",
                     "market_address": "0xMARKET-A"}
                    """).orElseThrow();

            OrderOpenedEvent opened = (OrderOpenedEvent) event;
            assertThat(opened.sourceOrderId()).isEqualTo(13L);
            assertThat(opened.side()).isEqualTo(OrderSide.SELL);
            assertThat(opened.market()).isEqualTo(MARKET);
        }

        @Test
        @DisplayName("Orders from wallets we do not follow are filtered out")
        void nonSourceWallet_filtered() {
            assertThat(normalize(MARKET, "OrderOpened", """
                    {"order_id": 12, "owner": "0xstranger", "side": "BUY", "price": 1, "size": 1}
                    """)).isEmpty();
        }

        @Test
        @DisplayName("Missing price is rejected with the field named")
        void missingPrice_rejected() {
            assertThatThrownBy(() -> normalize(MARKET, "OrderOpened", """
                            {"order_id": 12, "owner": "0xsource", "side": "BUY", "size": 1}
                            """))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("missing required field price");
        }

        @Test
        @DisplayName("Non-positive size is rejected")
        void zeroSize_rejected() {
            assertThatThrownBy(() -> normalize(MARKET, "OrderOpened", """
                            {"order_id": 12, "owner": "0xsource", "side": "BUY", "price": 1, "size": 0}
                            """))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("must be positive");
        }

        @Test
        @DisplayName("Unparseable side is rejected")
        void badSide_rejected() {
            assertThatThrownBy(() -> normalize(MARKET, "OrderOpened", """
                            {"order_id": 12, "owner": "0xsource", "side": "HOLD", "price": 1, "size": 1}
                            """))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("side");
        }

        @Test
        @DisplayName("Client order id over 36 characters is rejected")
        void longClientOrderId_rejected() {
            String cloid = "c".repeat(37);
            assertThatThrownBy(() -> normalize(MARKET, "OrderOpened", """
                            {"order_id": 12, "owner": "0xsource", "side": "BUY", "price": 1, "size": 1,
                             "cloid": "%s"}
                            """.formatted(cloid)))
                    .isInstanceOf(NormalizationException.class);
        }
    }

    // ==============================
    // FILLED
    // ==============================

    @Nested
    @DisplayName("Filled")
    class Filled {

        @Test
        @DisplayName("Trade payload becomes a FilledEvent with its sequence marker")
        void trade_normalized() {
            FeedEvent event = normalize(MARKET, "Trade", """
                    {"orderid": 501, "filledsize": "2.5", "price": "0.6", "blocknumber": 9001}
                    """).orElseThrow();

            FilledEvent filled = (FilledEvent) event;
            assertThat(filled.fill().orderId()).isEqualTo(501L);
            assertThat(filled.fill().filledSize()).isEqualByComparingTo("2.5");
            assertThat(filled.fill().price()).isEqualByComparingTo("0.6");
            assertThat(filled.fill().sequenceMarker()).isEqualTo(9001L);
            assertThat(filled.fill().dedupKey()).isEqualTo("501:9001");
        }

        @Test
        @DisplayName("Trigger time overrides the receive time when present")
        void triggerTime_usedAsObservedAt() {
            FeedEvent event = normalize(MARKET, "Filled", """
                    {"order_id": 501, "filled_size": 1, "price": 1, "sequence": 3, "triggertime": 1772445600}
                    """).orElseThrow();

            assertThat(((FilledEvent) event).fill().observedAt()).isEqualTo(Instant.ofEpochSecond(1772445600L));
        }

        @Test
        @DisplayName("Fill without a sequence marker is rejected")
        void missingSequence_rejected() {
            assertThatThrownBy(() -> normalize(MARKET, "Filled", """
                            {"order_id": 501, "filled_size": 1, "price": 1}
                            """))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("sequence_marker");
        }

        @Test
        @DisplayName("Non-numeric order id is rejected and the raw payload is kept")
        void badOrderId_rejected() {
            assertThatThrownBy(() -> normalize(MARKET, "Filled", """
                            {"order_id": "abc", "filled_size": 1, "price": 1, "sequence": 3}
                            """))
                    .isInstanceOfSatisfying(NormalizationException.class, e -> assertThat(e.getRawPayload())
                            .contains("abc"));
        }
    }

    // ==============================
    // ORDERS CLOSED
    // ==============================

    @Nested
    @DisplayName("OrdersClosed")
    class OrdersClosed {

        @Test
        @DisplayName("Cancel from a source wallet lists every order id")
        void sourceCancel_normalized() {
            FeedEvent event = normalize(MARKET, "OrdersCanceled", """
                    {"order_ids": [1, "2", 3], "maker_address": "0xsource", "blocknumber": 77}
                    """).orElseThrow();

            OrdersClosedEvent closed = (OrdersClosedEvent) event;
            assertThat(closed.orderIds()).containsExactly(1L, 2L, 3L);
            assertThat(closed.owner()).isEqualTo("0xsource");
            assertThat(closed.sequenceMarker()).isEqualTo(77L);
        }

        @Test
        @DisplayName("Cancel from our own wallet is kept")
        void ownCancel_kept() {
            assertThat(normalize(MARKET, "OrdersClosed", """
                    {"order_ids": [501], "owner": "0xMINE"}
                    """)).hasValueSatisfying(event -> assertThat(((OrdersClosedEvent) event).sequenceMarker())
                    .isNull());
        }

        @Test
        @DisplayName("Cancel from an unrelated wallet is filtered out")
        void unrelatedCancel_filtered() {
            assertThat(normalize(MARKET, "OrdersClosed", """
                    {"order_ids": [501], "owner": "0xstranger"}
                    """)).isEmpty();
        }

        @Test
        @DisplayName("Empty order id list is rejected")
        void emptyIds_rejected() {
            assertThatThrownBy(() -> normalize(MARKET, "OrdersClosed", """
                            {"order_ids": [], "owner": "0xsource"}
                            """))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("order_ids");
        }
    }

    // ==============================
    // ENVELOPE
    // ==============================

    @Nested
    @DisplayName("Envelope")
    class Envelope {

        @Test
        @DisplayName("Events for unsubscribed markets are filtered out")
        void unsubscribedMarket_filtered() {
            assertThat(normalize("0xelsewhere", "Trade", """
                    {"orderid": 501, "filledsize": 1, "price": 1, "blocknumber": 1}
                    """)).isEmpty();
        }

        @Test
        @DisplayName("Order openings in a blacklisted market are filtered; fills there still pass")
        void blacklistedMarket_filtersOpenings() {
            MirrorConfig config = TestMirrorConfig.defaults();
            config.setMarketBlacklist(Set.of(MARKET.toUpperCase(Locale.ROOT)));
            normalizer = new EventNormalizer(config);

            assertThat(normalize(MARKET, "OrderOpened", """
                    {"order_id": 12, "owner": "0xsource", "side": "buy", "price": "0.55", "size": 100}
                    """)).isEmpty();
            assertThat(normalize(MARKET, "Trade", """
                    {"orderid": 501, "filledsize": 1, "price": 1, "blocknumber": 1}
                    """)).isPresent();
        }

        @Test
        @DisplayName("Unknown event type is rejected")
        void unknownType_rejected() {
            assertThatThrownBy(() -> normalize(MARKET, "Liquidation", "{}"))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("unknown event type");
        }

        @Test
        @DisplayName("Non-object payload is rejected")
        void arrayPayload_rejected() {
            assertThatThrownBy(() -> normalize(MARKET, "Trade", "[1, 2]"))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("JSON object");
        }

        @Test
        @DisplayName("Missing market everywhere is rejected")
        void noMarket_rejected() {
            assertThatThrownBy(() -> normalize(null, "Trade", """
                            {"orderid": 501, "filledsize": 1, "price": 1, "blocknumber": 1}
                            """))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("market");
        }
    }

    private Optional<FeedEvent> normalize(String market, String eventType, String json) {
        try {
            JsonNode payload = objectMapper.readTree(json);
            return normalizer.normalize(new RawFeedEvent(market, eventType, payload, RECEIVED));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad test JSON: " + json, e);
        }
    }
}
