package com.updownbot.hft.controller.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbot.hft.config.HftProperties;
import com.updownbot.hft.controller.cost.CostModel;
import com.updownbot.hft.controller.cost.FeeCurveSelfCheck;
import com.updownbot.hft.controller.decision.CounterfactualAnalyzer;
import com.updownbot.hft.controller.decision.DecisionEngine;
import com.updownbot.hft.controller.feed.BinanceTradeMessageParser;
import com.updownbot.hft.controller.feed.FeedBuffer;
import com.updownbot.hft.controller.feed.FeedTransport;
import com.updownbot.hft.controller.feed.JdkWebSocketFeedTransport;
import com.updownbot.hft.controller.feed.ReconnectBackoff;
import com.updownbot.hft.controller.feed.ReferencePriceFeed;
import com.updownbot.hft.controller.io.ControllerSnapshotWriter;
import com.updownbot.hft.controller.io.DecisionLog;
import com.updownbot.hft.controller.io.JsonLinesFile;
import com.updownbot.hft.controller.runner.ControllerContext;
import com.updownbot.hft.controller.runner.ControllerCycleRunner;
import com.updownbot.hft.controller.runner.ControllerLoop;
import com.updownbot.hft.controller.runner.ControllerMetrics;
import com.updownbot.hft.controller.runner.ControllerRunner;
import com.updownbot.hft.controller.runner.TradingModeGuard;
import com.updownbot.hft.controller.shadow.ShadowLedger;
import com.updownbot.hft.controller.shadow.ShadowLog;
import com.updownbot.hft.market.MarketResolver;
import com.updownbot.hft.outcome.OutcomeResolver;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the shadow controller: reference feed, decision pipeline, durable logs and the loop.
 */
@Slf4j
@Configuration
public class ControllerConfiguration {

    @Bean
    public TradingModeGuard tradingModeGuard(HftProperties properties) {
        return new TradingModeGuard(properties);
    }

    @Bean
    public DecisionConfig decisionConfig(HftProperties properties) {
        DecisionConfig config = DecisionConfig.from(properties.controller());
        log.info("decision config: threshold={} buffer={} minNetEdge={} persistence={} volFloor={}x{} zClamp={} maxSpread={} minDepth={}",
                config.proposalThreshold(), config.buffer(), config.minNetEdge(), config.requiredCount(),
                config.signal().volFloor(), config.signal().volMultiplier(), config.signal().zClamp(),
                config.gates().maxSpread(), config.gates().minDepth());
        return config;
    }

    @Bean
    public CostModel costModel(DecisionConfig config) {
        return new CostModel(config.cost());
    }

    @Bean
    public FeeCurveSelfCheck feeCurveSelfCheck(CostModel costModel) {
        return new FeeCurveSelfCheck(costModel);
    }

    @Bean
    @DependsOn("feeCurveSelfCheck")
    public DecisionEngine decisionEngine(DecisionConfig config) {
        return new DecisionEngine(config);
    }

    @Bean
    public CounterfactualAnalyzer counterfactualAnalyzer(DecisionEngine engine, HftProperties properties) {
        HftProperties.Counterfactual cf = properties.controller().counterfactual();
        return new CounterfactualAnalyzer(engine, cf.relaxedMinNetEdge(), cf.relaxedMaxSpread());
    }

    @Bean
    public FeedBuffer feedBuffer(HftProperties properties) {
        HftProperties.Feed feed = properties.feed();
        return new FeedBuffer(feed.bufferSeconds(), feed.windowSeconds(), feed.minBuckets());
    }

    @Bean
    public FeedTransport feedTransport(HttpClient httpClient, HftProperties properties) {
        return new JdkWebSocketFeedTransport(httpClient, Duration.ofMillis(properties.feed().connectTimeoutMillis()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService referenceFeedScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reference-feed");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "stop")
    public ReferencePriceFeed referencePriceFeed(
            HftProperties properties,
            FeedBuffer feedBuffer,
            FeedTransport feedTransport,
            ObjectMapper objectMapper,
            ScheduledExecutorService referenceFeedScheduler,
            Clock clock
    ) {
        HftProperties.Feed feed = properties.feed();
        return new ReferencePriceFeed(
                feedBuffer,
                feedTransport,
                new BinanceTradeMessageParser(objectMapper, feed.symbols()),
                referenceFeedScheduler,
                clock,
                feed.streamUrl(),
                feed.symbols(),
                new ReconnectBackoff(feed.initialReconnectDelayMillis(), feed.maxReconnectDelayMillis()),
                feed.healthCheckIntervalMillis(),
                feed.staleThresholdMillis()
        );
    }

    @Bean
    public DecisionLog decisionLog(HftProperties properties, ObjectMapper objectMapper) {
        HftProperties.Controller c = properties.controller();
        return new DecisionLog(new JsonLinesFile(Path.of(c.outputDir(), c.decisionLogFile()), objectMapper), objectMapper);
    }

    @Bean
    public ShadowLedger shadowLedger(
            HftProperties properties,
            ObjectMapper objectMapper,
            DecisionLog decisionLog,
            OutcomeResolver outcomeResolver,
            Clock clock
    ) {
        HftProperties.Controller c = properties.controller();
        ShadowLog shadowLog = new ShadowLog(new JsonLinesFile(Path.of(c.outputDir(), c.shadowLogFile()), objectMapper));
        ShadowLedger ledger = new ShadowLedger(shadowLog, decisionLog, outcomeResolver, clock,
                c.shadow().maxResolutionAttempts());
        if (c.shadow().enabled()) {
            ledger.recover();
        } else {
            log.info("shadow tracking disabled");
        }
        return ledger;
    }

    @Bean
    public ControllerSnapshotWriter controllerSnapshotWriter(HftProperties properties, ObjectMapper objectMapper) {
        HftProperties.Controller c = properties.controller();
        return new ControllerSnapshotWriter(Path.of(c.outputDir(), c.snapshotFile()), objectMapper);
    }

    @Bean
    public ControllerContext controllerContext(HftProperties properties, DecisionLog decisionLog) {
        ControllerContext context = new ControllerContext(properties.controller().ringBufferSize());
        context.resumeAfter(decisionLog.lastCycle());
        decisionLog.reseed(context.ring());
        if (context.cycle() > 0) {
            log.info("resuming after cycle {} from decision log", context.cycle());
        }
        return context;
    }

    @Bean
    public ControllerMetrics controllerMetrics(MeterRegistry meterRegistry, ControllerContext context) {
        return new ControllerMetrics(meterRegistry, context);
    }

    @Bean
    public ControllerCycleRunner controllerCycleRunner(
            HftProperties properties,
            MarketResolver marketResolver,
            FeedBuffer feedBuffer,
            ReferencePriceFeed referencePriceFeed,
            DecisionEngine decisionEngine,
            CounterfactualAnalyzer counterfactualAnalyzer,
            ShadowLedger shadowLedger,
            DecisionLog decisionLog,
            ControllerSnapshotWriter snapshotWriter,
            ControllerContext context,
            ControllerMetrics metrics,
            Clock clock
    ) {
        HftProperties.Controller c = properties.controller();
        return new ControllerCycleRunner(
                List.copyOf(properties.feed().symbols().keySet()),
                marketResolver,
                feedBuffer,
                referencePriceFeed::isConnected,
                decisionEngine,
                counterfactualAnalyzer,
                shadowLedger,
                c.shadow().enabled(),
                decisionLog,
                snapshotWriter,
                context,
                metrics,
                clock,
                c.intervalMillis()
        );
    }

    @Bean(destroyMethod = "shutdown")
    public ControllerLoop controllerLoop(ControllerCycleRunner cycleRunner, ControllerMetrics metrics) {
        return new ControllerLoop(cycleRunner, metrics);
    }

    @Bean
    public ControllerRunner controllerRunner(HftProperties properties, ReferencePriceFeed feed, ControllerLoop loop) {
        return new ControllerRunner(properties, feed, loop);
    }
}
