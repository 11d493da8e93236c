package com.rebenew.stageParty.syncserver.model;

/**
 * Últimos parámetros visuales elegidos por el host, reenviados a quien llega tarde.
 */
public record VisualizerSnapshot(
        String shape,
        String environment,
        Tuning audioTuning,
        Tuning playbackTuning
) {
    public static final String DEFAULT_SHAPE = "sphere";
    public static final String DEFAULT_ENVIRONMENT = "none";

    public static VisualizerSnapshot defaults() {
        return new VisualizerSnapshot(DEFAULT_SHAPE, DEFAULT_ENVIRONMENT, Tuning.neutral(), Tuning.neutral());
    }

    public VisualizerSnapshot withShape(String newShape) {
        return new VisualizerSnapshot(newShape, environment, audioTuning, playbackTuning);
    }

    public VisualizerSnapshot withEnvironment(String newEnvironment) {
        return new VisualizerSnapshot(shape, newEnvironment, audioTuning, playbackTuning);
    }

    public VisualizerSnapshot withTunings(Tuning newAudioTuning, Tuning newPlaybackTuning) {
        return new VisualizerSnapshot(shape, environment,
                newAudioTuning != null ? newAudioTuning : audioTuning,
                newPlaybackTuning != null ? newPlaybackTuning : playbackTuning);
    }

    // Ganancias por banda, 1.0 = neutro
    public record Tuning(double bass, double mid, double treble, double sensitivity) {
        public static Tuning neutral() {
            return new Tuning(1.0, 1.0, 1.0, 1.0);
        }
    }
}
