package com.rebenew.stageParty.syncserver.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlaybackSnapshotTest {

    private static final long T0 = 1_000_000L;

    @Test
    void playingSnapshotAdvancesWithSpeed() {
        PlaybackSnapshot snapshot = new PlaybackSnapshot(10.0, true, 1.5, T0);

        assertThat(snapshot.positionAt(T0 + 4_000)).isCloseTo(16.0, within(1e-9));
        assertThat(snapshot.positionAt(T0 - 4_000)).isEqualTo(10.0);
    }

    @Test
    void extrapolateKeepsMeaning() {
        PlaybackSnapshot snapshot = new PlaybackSnapshot(10.0, true, 1.0, T0);

        PlaybackSnapshot moved = snapshot.extrapolate(T0 + 3_000);

        assertThat(moved.capturedAt()).isEqualTo(T0 + 3_000);
        assertThat(moved.positionAt(T0 + 5_000)).isCloseTo(snapshot.positionAt(T0 + 5_000), within(1e-9));
    }

    @Test
    void negativePositionIsClampedAndBadSpeedRejected() {
        assertThat(new PlaybackSnapshot(-3.0, false, 1.0, T0).positionSeconds()).isZero();
        assertThatThrownBy(() -> new PlaybackSnapshot(0.0, true, 0.0, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PlaybackSnapshot(0.0, true, -1.0, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clampOnlyAppliesToKnownDuration() {
        PlaybackSnapshot past = new PlaybackSnapshot(200.0, true, 1.0, T0);

        assertThat(past.clampTo(180.0).positionSeconds()).isEqualTo(180.0);
        assertThat(past.clampTo(null)).isSameAs(past);
        assertThat(past.clampTo(0.0)).isSameAs(past);
    }
}
