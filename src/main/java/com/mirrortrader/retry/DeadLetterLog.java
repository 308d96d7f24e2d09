package com.mirrortrader.retry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.model.MirrorAction;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Append-only record of submissions that were given up on.
 *
 * <p>Records are always kept in memory for the status API. When {@code mirror.dead-letter-file}
 * is set they are also appended to that file as one JSON object per line:
 * {@code {"action":{...},"attempts":3,"last_error":"...","timestamp":"..."}}. A failed
 * write is logged and counted; the in-memory record is kept either way.
 */
@Component
public class DeadLetterLog {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterLog.class);

    private final ObjectMapper objectMapper;
    private final Path file;
    private final List<DeadLetterRecord> records = new CopyOnWriteArrayList<>();
    private final AtomicLong writeFailures = new AtomicLong();

    public DeadLetterLog(MirrorConfig mirrorConfig, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        String configured = mirrorConfig.getDeadLetterFile();
        this.file = configured != null && !configured.isBlank() ? Path.of(configured) : null;
    }

    public void record(DeadLetterRecord deadLetter) {
        records.add(deadLetter);
        MirrorAction action = deadLetter.action();
        log.error(
                "Dead-lettered: clientOrderId={}, market={}, side={}, size={}, price={}, attempts={}, lastError={}",
                action.getClientOrderId(),
                action.getMarket(),
                action.getSide(),
                action.getSize().toPlainString(),
                action.getPrice().toPlainString(),
                deadLetter.attempts(),
                deadLetter.lastError());
        if (file != null) {
            append(deadLetter);
        }
    }

    public List<DeadLetterRecord> records() {
        return List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public long getWriteFailures() {
        return writeFailures.get();
    }

    private synchronized void append(DeadLetterRecord deadLetter) {
        try {
            String line = objectMapper.writeValueAsString(toJson(deadLetter)) + System.lineSeparator();
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            writeFailures.incrementAndGet();
            log.error("Could not serialize dead-letter record: clientOrderId={}",
                    deadLetter.action().getClientOrderId(), e);
        } catch (IOException e) {
            writeFailures.incrementAndGet();
            log.error("Could not append dead-letter record to {}: clientOrderId={}",
                    file, deadLetter.action().getClientOrderId(), e);
        }
    }

    private ObjectNode toJson(DeadLetterRecord deadLetter) {
        MirrorAction action = deadLetter.action();
        ObjectNode node = objectMapper.createObjectNode();
        ObjectNode actionNode = node.putObject("action");
        actionNode.put("client_order_id", action.getClientOrderId());
        actionNode.put("market", action.getMarket());
        actionNode.put("source_order_id", action.getSourceOrderId());
        actionNode.put("side", action.getSide().name());
        actionNode.put("price", action.getPrice());
        actionNode.put("size", action.getSize());
        node.put("attempts", deadLetter.attempts());
        node.put("last_error", deadLetter.lastError());
        node.put("timestamp", deadLetter.timestamp().toString());
        return node;
    }
}
