package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatMessage(
        String id,
        String memberId,
        String displayName,
        String text,
        long timestamp,
        @JsonProperty("isHost") boolean isHost,
        @JsonProperty("isSystem") boolean isSystem
) {
    public static final String SYSTEM_ID = "system";

    public static ChatMessage system(String id, String text, long timestamp) {
        return new ChatMessage(id, SYSTEM_ID, "System", text, timestamp, false, true);
    }
}
