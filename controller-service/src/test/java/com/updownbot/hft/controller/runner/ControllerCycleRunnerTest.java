package com.updownbot.hft.controller.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbot.hft.controller.config.DecisionConfig;
import com.updownbot.hft.controller.decision.Blocker;
import com.updownbot.hft.controller.decision.CounterfactualAnalyzer;
import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.decision.DecisionEngine;
import com.updownbot.hft.controller.decision.DecisionType;
import com.updownbot.hft.controller.decision.PersistenceState;
import com.updownbot.hft.controller.feed.FeedBuffer;
import com.updownbot.hft.controller.io.ControllerSnapshotWriter;
import com.updownbot.hft.controller.io.DecisionLog;
import com.updownbot.hft.controller.io.JsonLinesFile;
import com.updownbot.hft.controller.shadow.ShadowLedger;
import com.updownbot.hft.controller.shadow.ShadowLog;
import com.updownbot.hft.market.MarketResolver;
import com.updownbot.hft.outcome.OutcomeResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.updownbot.hft.controller.ControllerFixtures.cheapUpMarket;
import static com.updownbot.hft.controller.ControllerFixtures.objectMapper;
import static com.updownbot.hft.controller.ControllerFixtures.secondsIntoWindow;
import static com.updownbot.hft.controller.ControllerFixtures.strongUp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ControllerCycleRunnerTest {

    @TempDir
    Path dir;

    @Mock
    private MarketResolver marketResolver;

    @Mock
    private FeedBuffer feedBuffer;

    @Mock
    private OutcomeResolver outcomeResolver;

    private final ObjectMapper mapper = objectMapper();
    private final Clock clock = Clock.fixed(secondsIntoWindow(60), ZoneOffset.UTC);
    private final AtomicBoolean feedConnected = new AtomicBoolean(true);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private ControllerContext context;
    private ShadowLedger shadowLedger;
    private ControllerCycleRunner runner;

    @BeforeEach
    void setUp() {
        DecisionEngine engine = new DecisionEngine(DecisionConfig.defaults());
        DecisionLog decisionLog = new DecisionLog(new JsonLinesFile(dir.resolve("decisions.jsonl"), mapper), mapper);
        shadowLedger = new ShadowLedger(new ShadowLog(new JsonLinesFile(dir.resolve("shadow.jsonl"), mapper)),
                decisionLog, outcomeResolver, clock, 30);
        context = new ControllerContext(50);
        runner = new ControllerCycleRunner(
                List.of("BTC", "ETH"),
                marketResolver,
                feedBuffer,
                feedConnected::get,
                engine,
                new CounterfactualAnalyzer(engine, 0.0, 0.10),
                shadowLedger,
                true,
                decisionLog,
                new ControllerSnapshotWriter(dir.resolve("controller_state.json"), mapper),
                context,
                new ControllerMetrics(meterRegistry, context),
                clock,
                60_000
        );
        when(feedBuffer.features(anyString(), anyLong())).thenReturn(strongUp());
    }

    @Test
    void escalatesAcrossCyclesAndOpensShadowProposal() throws Exception {
        when(marketResolver.resolve(eq("BTC"), any())).thenReturn(Optional.of(cheapUpMarket()));
        when(marketResolver.resolve(eq("ETH"), any())).thenReturn(Optional.empty());

        CycleResult first = runner.runCycle();
        CycleResult second = runner.runCycle();

        assertThat(first.cycle()).isEqualTo(1);
        assertThat(first.decisions()).extracting(Decision::decision)
                .containsExactly(DecisionType.CANDIDATE_UP, DecisionType.DO_NOTHING);
        assertThat(first.decisions().get(1).dominantBlocker()).isEqualTo(Blocker.NO_MARKET);

        Decision proposal = second.decisions().get(0);
        assertThat(proposal.decision()).isEqualTo(DecisionType.PROPOSE_UP);
        assertThat(proposal.shadowId()).startsWith("shadow-");
        assertThat(shadowLedger.pendingCount()).isEqualTo(1);

        List<String> lines = Files.readAllLines(dir.resolve("decisions.jsonl"), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode secondLine = mapper.readTree(lines.get(1));
        assertThat(secondLine.get("cycle").asLong()).isEqualTo(2);
        assertThat(secondLine.get("feedConnected").asBoolean()).isTrue();
        assertThat(secondLine.get("decisions")).hasSize(2);
        assertThat(secondLine.get("decisions").get(0).get("shadowId").asText()).isEqualTo(proposal.shadowId());
        JsonNode snapshot = mapper.readTree(dir.resolve("controller_state.json").toFile());
        assertThat(snapshot.get("cycle").asLong()).isEqualTo(2);
        assertThat(snapshot.get("pendingShadowProposals").asInt()).isEqualTo(1);
        assertThat(snapshot.get("latestDecisions").get("BTC").get("decision").asText()).isEqualTo("PROPOSE_UP");
        assertThat(snapshot.get("history").get("BTC")).hasSize(2);

        assertThat(context.latestSnapshot().decisionCounts()).containsEntry(DecisionType.PROPOSE_UP, 1L);
        assertThat(meterRegistry.get("controller.decisions").tag("type", "PROPOSE_UP").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("controller.shadow.opened").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("controller.shadow.pending").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void resolverFailureYieldsNoMarketAndResetsPersistence() {
        when(marketResolver.resolve(eq("BTC"), any()))
                .thenReturn(Optional.of(cheapUpMarket()))
                .thenThrow(new IllegalStateException("gamma timeout"));
        when(marketResolver.resolve(eq("ETH"), any())).thenReturn(Optional.empty());

        runner.runCycle();
        assertThat(context.persistence().current("BTC").consecutiveCount()).isEqualTo(1);

        Decision btc = runner.runCycle().decisions().get(0);

        assertThat(btc.decision()).isEqualTo(DecisionType.DO_NOTHING);
        assertThat(btc.dominantBlocker()).isEqualTo(Blocker.NO_MARKET);
        assertThat(btc.reason()).contains("gamma timeout");
        assertThat(context.persistence().current("BTC")).isEqualTo(PersistenceState.NONE);
    }

    @Test
    void evaluationFailureIsReportedAsErrorAndOtherSymbolsStillRun() throws Exception {
        when(feedBuffer.features(eq("ETH"), anyLong())).thenThrow(new IllegalStateException("buffer corrupted"));
        when(marketResolver.resolve(eq("BTC"), any())).thenReturn(Optional.of(cheapUpMarket()));

        CycleResult result = runner.runCycle();

        assertThat(result.decisions()).extracting(Decision::dominantBlocker)
                .containsExactly(Blocker.PERSISTENCE, Blocker.EVALUATION_ERROR);
        assertThat(result.decisions().get(1).reason()).contains("buffer corrupted");
        JsonNode line = mapper.readTree(Files.readAllLines(dir.resolve("decisions.jsonl"), StandardCharsets.UTF_8).get(0));
        assertThat(line.get("decisions").get(1).get("dominantBlocker").asText()).isEqualTo("EVALUATION_ERROR");
    }

    @Test
    void disconnectedFeedBlocksEverySymbol() {
        feedConnected.set(false);
        when(marketResolver.resolve(anyString(), any())).thenReturn(Optional.of(cheapUpMarket()));

        CycleResult result = runner.runCycle();

        assertThat(result.decisions()).extracting(Decision::dominantBlocker)
                .containsExactly(Blocker.NO_CEX_FEED, Blocker.NO_CEX_FEED);
        assertThat(context.latestSnapshot().feedConnected()).isFalse();
    }

    @Test
    void continuesNumberingAfterRestart() {
        when(marketResolver.resolve(anyString(), any())).thenReturn(Optional.empty());
        context.resumeAfter(41);

        assertThat(runner.runCycle().cycle()).isEqualTo(42);
    }
}
