package com.mirrortrader.unit.retry;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.enums.OrderSide;
import com.mirrortrader.domain.model.MirrorAction;
import com.mirrortrader.retry.DeadLetterLog;
import com.mirrortrader.retry.DeadLetterRecord;
import com.mirrortrader.unit.support.TestMirrorConfig;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DeadLetterLogTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Records are kept in memory without a file configured")
    void inMemoryOnly() {
        DeadLetterLog deadLetterLog = new DeadLetterLog(TestMirrorConfig.defaults(), objectMapper);

        deadLetterLog.record(record("cid-1"));

        assertThat(deadLetterLog.size()).isEqualTo(1);
        assertThat(deadLetterLog.records().get(0).action().getClientOrderId()).isEqualTo("cid-1");
    }

    @Test
    @DisplayName("Each record is appended to the file as one JSON line")
    void appendsJsonLines() throws Exception {
        Path file = tempDir.resolve("dead/letters.jsonl");
        MirrorConfig config = TestMirrorConfig.defaults();
        config.setDeadLetterFile(file.toString());
        DeadLetterLog deadLetterLog = new DeadLetterLog(config, objectMapper);

        deadLetterLog.record(record("cid-1"));
        deadLetterLog.record(record("cid-2"));

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.path("action").path("client_order_id").asText()).isEqualTo("cid-1");
        assertThat(first.path("action").path("side").asText()).isEqualTo("SELL");
        assertThat(first.path("action").path("size").decimalValue()).isEqualByComparingTo("2.5");
        assertThat(first.path("attempts").asInt()).isEqualTo(4);
        assertThat(first.path("last_error").asText()).isEqualTo("TIMEOUT: no answer");
        assertThat(first.path("timestamp").asText()).isEqualTo("2026-03-02T10:00:00Z");
        assertThat(deadLetterLog.getWriteFailures()).isZero();
    }

    @Test
    @DisplayName("A failed write is counted and the record is still kept")
    void writeFailure_keepsRecord() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("not-a-dir"));
        MirrorConfig config = TestMirrorConfig.defaults();
        config.setDeadLetterFile(blocker.resolve("letters.jsonl").toString());
        DeadLetterLog deadLetterLog = new DeadLetterLog(config, objectMapper);

        deadLetterLog.record(record("cid-1"));

        assertThat(deadLetterLog.getWriteFailures()).isEqualTo(1);
        assertThat(deadLetterLog.size()).isEqualTo(1);
    }

    private static DeadLetterRecord record(String clientOrderId) {
        MirrorAction action = MirrorAction.builder()
                .clientOrderId(clientOrderId)
                .market(TestMirrorConfig.MARKET)
                .sourceOrderId(9L)
                .side(OrderSide.SELL)
                .price(new BigDecimal("0.42"))
                .size(new BigDecimal("2.5"))
                .build();
        return new DeadLetterRecord(action, 4, "TIMEOUT: no answer", NOW);
    }
}
