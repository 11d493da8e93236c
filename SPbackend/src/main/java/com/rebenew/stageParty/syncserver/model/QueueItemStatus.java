package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QueueItemStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("analyzing")
    ANALYZING,
    @JsonProperty("ready")
    READY,
    @JsonProperty("playing")
    PLAYING,
    @JsonProperty("played")
    PLAYED;

    // Estados que el host puede fijar manualmente (el resto los gestiona la cola)
    public boolean isAnalysisState() {
        return this == PENDING || this == ANALYZING || this == READY;
    }
}
