package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Estado de reproducción "as-of" capturedAt (epoch ms del reloj del servidor).
 * Es la base que usa la audiencia para extrapolar la posición del host.
 */
public record PlaybackSnapshot(
        double positionSeconds,
        @JsonProperty("isPlaying") boolean isPlaying,
        double speedMultiplier,
        long capturedAt
) {
    public PlaybackSnapshot {
        if (!(speedMultiplier > 0) || Double.isInfinite(speedMultiplier)) {
            throw new IllegalArgumentException("speedMultiplier must be > 0, was " + speedMultiplier);
        }
        if (Double.isNaN(positionSeconds) || positionSeconds < 0) {
            positionSeconds = 0.0;
        }
    }

    public static PlaybackSnapshot initial(long now) {
        return new PlaybackSnapshot(0.0, false, 1.0, now);
    }

    // Posición esperada en el instante "now" (ms)
    public double positionAt(long now) {
        if (!isPlaying) {
            return positionSeconds;
        }
        double elapsedSeconds = Math.max(0L, now - capturedAt) / 1000.0;
        return positionSeconds + elapsedSeconds * speedMultiplier;
    }

    // Re-captura el snapshot en "now" sin cambiar su significado
    public PlaybackSnapshot extrapolate(long now) {
        return new PlaybackSnapshot(positionAt(now), isPlaying, speedMultiplier, now);
    }

    public PlaybackSnapshot clampTo(Double durationSeconds) {
        if (durationSeconds == null || durationSeconds <= 0 || positionSeconds <= durationSeconds) {
            return this;
        }
        return new PlaybackSnapshot(durationSeconds, isPlaying, speedMultiplier, capturedAt);
    }
}
