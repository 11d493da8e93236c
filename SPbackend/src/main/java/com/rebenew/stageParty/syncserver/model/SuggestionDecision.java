package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SuggestionDecision {
    @JsonProperty("approve")
    APPROVE,
    @JsonProperty("reject")
    REJECT;

    public SuggestionStatus resultingStatus() {
        return this == APPROVE ? SuggestionStatus.APPROVED : SuggestionStatus.REJECTED;
    }
}
