package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConnectionState {
    @JsonProperty("connecting")
    CONNECTING,
    @JsonProperty("connected")
    CONNECTED,
    @JsonProperty("disconnected")
    DISCONNECTED
}
