package com.updownbot.hft.controller.runner;

import com.updownbot.hft.config.HftProperties;
import com.updownbot.hft.controller.feed.ReferencePriceFeed;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Starts the reference feed, waits for the warmup, then runs either one cycle ({@code --once}) or the
 * loop for the configured duration. Never throws; the outcome is reported through {@link #getExitCode()}.
 */
@Slf4j
@RequiredArgsConstructor
public class ControllerRunner implements ApplicationRunner, ExitCodeGenerator {

    private final @NonNull HftProperties properties;
    private final @NonNull ReferencePriceFeed feed;
    private final @NonNull ControllerLoop loop;

    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        HftProperties.Controller cfg = properties.controller();
        boolean once = args.containsOption(ControllerCommandLine.ONCE);
        try {
            feed.start();
            long warmup = properties.feed().warmupMillis();
            if (warmup > 0) {
                log.info("warming up reference feed for {} ms", warmup);
                Thread.sleep(warmup);
            }
            if (once) {
                CycleResult result = loop.runOnce();
                log.info("single cycle {} complete ({} decisions)", result.cycle(), result.decisions().size());
            } else {
                log.info("controller loop starting: interval={}ms duration={}ms", cfg.intervalMillis(),
                        cfg.durationMillis() == 0 ? "unbounded" : cfg.durationMillis());
                loop.runFor(cfg.intervalMillis(), cfg.durationMillis());
            }
            exitCode = 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("controller interrupted");
            exitCode = 0;
        } catch (Exception e) {
            log.error("controller failed", e);
            exitCode = 1;
        } finally {
            loop.shutdown();
            feed.stop();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
