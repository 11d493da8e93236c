package com.rebenew.stageParty.syncserver.client;

import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DriftCorrectorTest {

    private static final long T0 = 1_700_000_000_000L;

    private final DriftCorrector corrector = new DriftCorrector();

    @Test
    void farBehindSnapsToExtrapolatedPosition() {
        PlaybackSnapshot afterSeek = new PlaybackSnapshot(120.0, true, 1.0, T0);

        DriftCorrection correction = corrector.evaluate(afterSeek, 100.0, T0 + 2_500, null);

        assertThat(correction.action()).isEqualTo(DriftCorrection.Action.SNAP);
        assertThat(correction.targetSeconds()).isCloseTo(122.5, within(1e-9));
        assertThat(correction.driftSeconds()).isCloseTo(22.5, within(1e-9));
    }

    @Test
    void smallDriftIsLeftAlone() {
        PlaybackSnapshot snapshot = new PlaybackSnapshot(30.0, true, 1.0, T0);

        DriftCorrection correction = corrector.evaluate(snapshot, 31.2, T0 + 1_000, null);

        assertThat(correction.action()).isEqualTo(DriftCorrection.Action.NONE);
        assertThat(correction.needsSeek()).isFalse();
    }

    @Test
    void driftBetweenThresholdsSeeks() {
        PlaybackSnapshot snapshot = new PlaybackSnapshot(30.0, true, 1.0, T0);

        DriftCorrection correction = corrector.evaluate(snapshot, 31.5, T0 + 1_000, null);

        assertThat(correction.action()).isEqualTo(DriftCorrection.Action.SEEK);
        assertThat(correction.targetSeconds()).isCloseTo(31.0, within(1e-9));
    }

    @Test
    void speedScalesElapsedTime() {
        PlaybackSnapshot snapshot = new PlaybackSnapshot(10.0, true, 2.0, T0);

        DriftCorrection correction = corrector.evaluate(snapshot, 14.0, T0 + 2_000, null);

        assertThat(correction.targetSeconds()).isCloseTo(14.0, within(1e-9));
        assertThat(correction.action()).isEqualTo(DriftCorrection.Action.NONE);
        assertThat(correction.speedMultiplier()).isEqualTo(2.0);
    }

    @Test
    void pausedSnapshotDoesNotAdvance() {
        PlaybackSnapshot paused = new PlaybackSnapshot(50.0, false, 1.0, T0);

        DriftCorrection correction = corrector.evaluate(paused, 50.0, T0 + 60_000, null);

        assertThat(correction.targetSeconds()).isEqualTo(50.0);
        assertThat(correction.isPlaying()).isFalse();
    }

    @Test
    void targetIsClampedToKnownDuration() {
        PlaybackSnapshot snapshot = new PlaybackSnapshot(178.0, true, 1.0, T0);

        DriftCorrection correction = corrector.evaluate(snapshot, 100.0, T0 + 10_000, 180.0);

        assertThat(correction.targetSeconds()).isEqualTo(180.0);
    }

    @Test
    void thresholdsAreConfigurable() {
        DriftCorrector strict = new DriftCorrector(0.05, 0.2);
        PlaybackSnapshot snapshot = new PlaybackSnapshot(30.0, true, 1.0, T0);

        assertThat(strict.evaluate(snapshot, 30.1, T0, null).action()).isEqualTo(DriftCorrection.Action.SEEK);
        assertThatThrownBy(() -> new DriftCorrector(1.0, 0.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
