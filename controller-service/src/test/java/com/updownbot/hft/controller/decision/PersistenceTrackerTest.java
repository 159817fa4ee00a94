package com.updownbot.hft.controller.decision;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PersistenceTrackerTest {

    @Test
    void sameSideExtendsFlipRestartsNoneClears() {
        PersistenceState s = PersistenceTracker.advance(PersistenceState.NONE, Side.UP);
        assertThat(s).isEqualTo(new PersistenceState(Side.UP, 1));

        s = PersistenceTracker.advance(s, Side.UP);
        assertThat(s.consecutiveCount()).isEqualTo(2);
        assertThat(s.isPersisted(2)).isTrue();
        assertThat(s.isPersisted(3)).isFalse();

        s = PersistenceTracker.advance(s, Side.DOWN);
        assertThat(s).isEqualTo(new PersistenceState(Side.DOWN, 1));

        assertThat(PersistenceTracker.advance(s, null)).isEqualTo(PersistenceState.NONE);
        assertThat(PersistenceState.NONE.isPersisted(0)).isFalse();
    }

    @Test
    void tracksStatePerSymbol() {
        PersistenceTracker tracker = new PersistenceTracker();
        tracker.store("BTC", new PersistenceState(Side.UP, 3));
        tracker.store("ETH", new PersistenceState(Side.DOWN, 1));

        tracker.reset("ETH");

        assertThat(tracker.current("BTC").consecutiveCount()).isEqualTo(3);
        assertThat(tracker.current("ETH")).isEqualTo(PersistenceState.NONE);
        assertThat(tracker.current("SOL")).isEqualTo(PersistenceState.NONE);
        assertThat(tracker.snapshot()).containsOnlyKeys("BTC");
    }
}
