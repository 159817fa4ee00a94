package com.updownbot.hft.controller.runner;

import com.updownbot.hft.config.HftProperties;
import com.updownbot.hft.controller.feed.ReferencePriceFeed;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ControllerRunnerTest {

    private static final HftProperties NO_WARMUP = new HftProperties(null, null,
            new HftProperties.Feed(null, null, null, null, null, null, null, null, null, 0L, null), null);

    @Mock
    private ReferencePriceFeed feed;

    @Mock
    private ControllerLoop loop;

    @Test
    void onceRunsSingleCycleAndExitsZero() throws Exception {
        when(loop.runOnce()).thenReturn(new CycleResult(1, Instant.EPOCH, List.of(), List.of()));
        ControllerRunner runner = new ControllerRunner(NO_WARMUP, feed, loop);

        runner.run(new DefaultApplicationArguments("--once"));

        InOrder order = inOrder(feed, loop);
        order.verify(feed).start();
        order.verify(loop).runOnce();
        order.verify(loop).shutdown();
        order.verify(feed).stop();
        verify(loop, never()).runFor(60_000, 3_600_000);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void loopsForConfiguredDuration() throws Exception {
        ControllerRunner runner = new ControllerRunner(NO_WARMUP, feed, loop);

        runner.run(new DefaultApplicationArguments());

        verify(loop).runFor(60_000, 3_600_000);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void fatalErrorExitsOne() throws Exception {
        when(loop.runOnce()).thenThrow(new IllegalStateException("disk full"));
        ControllerRunner runner = new ControllerRunner(NO_WARMUP, feed, loop);

        runner.run(new DefaultApplicationArguments("--once"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        verify(feed).stop();
    }

    @Test
    void liveModeIsRejected() {
        HftProperties live = new HftProperties(HftProperties.TradingMode.LIVE, null, null, null);

        assertThatThrownBy(() -> new TradingModeGuard(live).check())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("LIVE");
    }
}
