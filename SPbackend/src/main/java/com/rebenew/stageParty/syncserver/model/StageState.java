package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

//Estados posibles de un stage.

public enum StageState {
    @JsonProperty("live")
    LIVE,      // Host presente y emitiendo
    @JsonProperty("host_away")
    HOST_AWAY, // Host desconectado, en el menú o visitando otro stage
    @JsonProperty("closed")
    CLOSED     // Stage terminado
}
