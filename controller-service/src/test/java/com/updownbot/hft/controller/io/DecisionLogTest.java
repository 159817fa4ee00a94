package com.updownbot.hft.controller.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbot.hft.controller.config.DecisionConfig;
import com.updownbot.hft.controller.decision.Counterfactuals;
import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.decision.DecisionEngine;
import com.updownbot.hft.controller.decision.DecisionInput;
import com.updownbot.hft.controller.decision.DecisionType;
import com.updownbot.hft.controller.decision.PersistenceState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static com.updownbot.hft.controller.ControllerFixtures.cheapUpMarket;
import static com.updownbot.hft.controller.ControllerFixtures.features;
import static com.updownbot.hft.controller.ControllerFixtures.input;
import static com.updownbot.hft.controller.ControllerFixtures.objectMapper;
import static com.updownbot.hft.controller.ControllerFixtures.proposeUp;
import static com.updownbot.hft.controller.ControllerFixtures.secondsIntoWindow;
import static org.assertj.core.api.Assertions.assertThat;

class DecisionLogTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = objectMapper();
    private final DecisionEngine engine = new DecisionEngine(DecisionConfig.defaults());

    @Test
    void appendsOneLinePerCycleWithEveryDecision() throws Exception {
        Path file = dir.resolve("nested/decisions.jsonl");
        DecisionLog log = new DecisionLog(new JsonLinesFile(file, mapper), mapper);

        log.append(cycle(4, proposeUp(4), Decision.noMarket(4, secondsIntoWindow(60), "ETH", "no active market", null, 2)));
        log.append(cycle(5, Decision.noMarket(5, secondsIntoWindow(120), "ETH", "no active market", null, 2)));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.get("cycle").asLong()).isEqualTo(4);
        assertThat(first.get("timestamp").asText()).isEqualTo("2026-02-24T09:31:00Z");
        assertThat(first.get("feedConnected").asBoolean()).isTrue();
        assertThat(first.get("shadowMode").asBoolean()).isTrue();
        assertThat(first.get("decisions")).hasSize(2);
        JsonNode btc = first.get("decisions").get(0);
        assertThat(btc.get("symbol").asText()).isEqualTo("BTC");
        assertThat(btc.get("decision").asText()).isEqualTo("PROPOSE_UP");
        assertThat(btc.get("slug").asText()).isEqualTo("btc-updown-15m-1771925400");
        assertThat(btc.has("counterfactuals")).isTrue();
        assertThat(btc.get("gates")).hasSize(5);
        assertThat(first.get("decisions").get(1).get("dominantBlocker").asText()).isEqualTo("NO_MARKET");
        assertThat(log.lastCycle()).isEqualTo(5);
    }

    @Test
    void freshLogStartsAtCycleZero() {
        DecisionLog log = new DecisionLog(new JsonLinesFile(dir.resolve("missing.jsonl"), mapper), mapper);

        assertThat(log.lastCycle()).isZero();
        assertThat(log.flagCounts()).isEqualTo(new DecisionLog.FlagCounts(0, 0));
    }

    @Test
    void reseedsRingSkippingCorruptLines() throws Exception {
        Path file = dir.resolve("decisions.jsonl");
        DecisionLog log = new DecisionLog(new JsonLinesFile(file, mapper), mapper);
        log.append(cycle(1, proposeUp(1)));
        Files.writeString(file, "{truncated\n{\"note\":\"not a cycle\"}\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        log.append(cycle(2, proposeUp(2)));

        DecisionRingBuffer ring = new DecisionRingBuffer(10);
        log.reseed(ring);

        assertThat(ring.size("BTC")).isEqualTo(2);
        assertThat(ring.snapshot().get("BTC")).extracting(RingEntry::decision)
                .containsExactly(DecisionType.PROPOSE_UP, DecisionType.PROPOSE_UP);
        assertThat(log.lastCycle()).isEqualTo(2);
    }

    @Test
    void flagCountsAreReadOnceThenKeptCurrent() throws Exception {
        Path file = dir.resolve("decisions.jsonl");
        DecisionInput quiet = input(cheapUpMarket(), features(0.002, 0.0001), 60);
        Decision filtered = Decision.of(1, quiet, engine.evaluate(quiet, PersistenceState.NONE), Counterfactuals.NONE);
        new DecisionLog(new JsonLinesFile(file, mapper), mapper).append(cycle(1, filtered, proposeUp(1)));

        DecisionLog log = new DecisionLog(new JsonLinesFile(file, mapper), mapper);
        assertThat(log.flagCounts()).isEqualTo(new DecisionLog.FlagCounts(1, 1));

        Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
        log.append(cycle(2, filtered));

        assertThat(log.flagCounts()).isEqualTo(new DecisionLog.FlagCounts(2, 2));
    }

    private static CycleRecord cycle(long cycle, Decision... decisions) {
        return new CycleRecord(cycle, secondsIntoWindow(60), true, true, List.of(decisions));
    }

    @Test
    void readAllSkipsLinesThatDoNotBind() throws Exception {
        Path file = dir.resolve("entries.jsonl");
        JsonLinesFile lines = new JsonLinesFile(file, mapper);
        lines.append(RingEntry.of(proposeUp(1)));
        Files.writeString(file, "[1,2]\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        List<RingEntry> read = lines.readAll(RingEntry.class);
        List<JsonNode> nodes = new ArrayList<>();
        lines.forEachNode(nodes::add);

        assertThat(read).hasSize(1);
        assertThat(nodes).hasSize(2);
    }
}
