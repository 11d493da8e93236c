package com.rebenew.stageParty.syncserver.client;

import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;

/**
 * Calcula cuánto se aleja un reproductor de la audiencia del host y qué hacer al respecto.
 * Pura: solo lee un snapshot y el reloj local.
 */
public class DriftCorrector {

    public static final double DEFAULT_SOFT_THRESHOLD_SECONDS = 0.3;
    public static final double DEFAULT_HARD_THRESHOLD_SECONDS = 1.0;

    private final double softThresholdSeconds;
    private final double hardThresholdSeconds;

    public DriftCorrector() {
        this(DEFAULT_SOFT_THRESHOLD_SECONDS, DEFAULT_HARD_THRESHOLD_SECONDS);
    }

    public DriftCorrector(double softThresholdSeconds, double hardThresholdSeconds) {
        if (softThresholdSeconds < 0 || hardThresholdSeconds < softThresholdSeconds) {
            throw new IllegalArgumentException("Need 0 <= soft <= hard, got " + softThresholdSeconds
                    + " / " + hardThresholdSeconds);
        }
        this.softThresholdSeconds = softThresholdSeconds;
        this.hardThresholdSeconds = hardThresholdSeconds;
    }

    public double getSoftThresholdSeconds() {
        return softThresholdSeconds;
    }

    public double getHardThresholdSeconds() {
        return hardThresholdSeconds;
    }

    /**
     * @param durationSeconds duración local de la pista, null si se desconoce
     */
    public DriftCorrection evaluate(PlaybackSnapshot snapshot, double localPositionSeconds, long nowMillis,
                                    Double durationSeconds) {
        double target = Math.max(0.0, snapshot.positionAt(nowMillis));
        if (durationSeconds != null && durationSeconds > 0) {
            target = Math.min(target, durationSeconds);
        }
        double drift = Math.abs(localPositionSeconds - target);

        DriftCorrection.Action action;
        if (drift > hardThresholdSeconds) {
            action = DriftCorrection.Action.SNAP;
        } else if (drift > softThresholdSeconds) {
            action = DriftCorrection.Action.SEEK;
        } else {
            action = DriftCorrection.Action.NONE;
        }
        return new DriftCorrection(action, target, drift, snapshot.isPlaying(), snapshot.speedMultiplier());
    }
}
