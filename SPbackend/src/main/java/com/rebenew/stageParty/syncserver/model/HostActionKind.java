package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum HostActionKind {
    @JsonProperty("play")
    PLAY,
    @JsonProperty("pause")
    PAUSE,
    @JsonProperty("seek")
    SEEK,
    @JsonProperty("speed_change")
    SPEED_CHANGE,
    @JsonProperty("shape_change")
    SHAPE_CHANGE,
    @JsonProperty("environment_change")
    ENVIRONMENT_CHANGE,
    @JsonProperty("eq_change")
    EQ_CHANGE,
    @JsonProperty("reset")
    RESET;

    // Acciones que cambian el reloj de reproducción (y disparan un sync_snapshot)
    public boolean affectsPlayback() {
        return this == PLAY || this == PAUSE || this == SEEK || this == SPEED_CHANGE;
    }
}
