package com.updownbot.hft.controller.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbot.hft.controller.decision.Decision;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Per-cycle decision log: one {@link CycleRecord} line per cycle, never rewritten.
 * Filter counts are read from the file once and then kept current on every append.
 */
@Slf4j
public class DecisionLog {

    private final JsonLinesFile file;
    private final ObjectMapper objectMapper;

    private FlagCounts flagCounts;

    public DecisionLog(JsonLinesFile file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public synchronized void append(CycleRecord record) {
        file.append(record);
        if (flagCounts != null) {
            flagCounts = flagCounts.plus(FlagCounts.of(record));
        }
    }

    /**
     * Highest cycle number on file, or 0 for a fresh log. Used to continue numbering after a restart.
     */
    public long lastCycle() {
        AtomicLong max = new AtomicLong();
        file.forEachNode(node -> max.accumulateAndGet(node.path("cycle").asLong(0), Math::max));
        return max.get();
    }

    /**
     * Replays the log into the ring buffer so the snapshot history survives restarts.
     */
    public void reseed(DecisionRingBuffer ring) {
        forEachDecision(node -> {
            try {
                ring.add(node.get("symbol").asText(), objectMapper.treeToValue(node, RingEntry.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.debug("ring reseed skipped a decision: {}", e.getMessage());
            }
        });
    }

    public synchronized FlagCounts flagCounts() {
        if (flagCounts == null) {
            long[] counts = new long[2];
            forEachDecision(node -> {
                if (node.path("volFloorHit").asBoolean(false)) {
                    counts[0]++;
                }
                if (node.path("zClamped").asBoolean(false)) {
                    counts[1]++;
                }
            });
            flagCounts = new FlagCounts(counts[0], counts[1]);
        }
        return flagCounts;
    }

    private void forEachDecision(Consumer<JsonNode> consumer) {
        file.forEachNode(line -> {
            if (!line.hasNonNull("cycle")) {
                return;
            }
            for (JsonNode decision : line.path("decisions")) {
                if (decision.hasNonNull("symbol")) {
                    consumer.accept(decision);
                }
            }
        });
    }

    public record FlagCounts(long volFloorHit, long zClamped) {

        static FlagCounts of(CycleRecord record) {
            long vol = 0;
            long clamp = 0;
            for (Decision d : record.decisions()) {
                if (d.volFloorHit()) {
                    vol++;
                }
                if (d.zClamped()) {
                    clamp++;
                }
            }
            return new FlagCounts(vol, clamp);
        }

        FlagCounts plus(FlagCounts other) {
            return new FlagCounts(volFloorHit + other.volFloorHit, zClamped + other.zClamped);
        }
    }
}
