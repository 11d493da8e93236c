package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

// Rol de un miembro dentro de un stage concreto.
public enum MemberRole {
    @JsonProperty("host")
    HOST,
    @JsonProperty("audience")
    AUDIENCE
}
