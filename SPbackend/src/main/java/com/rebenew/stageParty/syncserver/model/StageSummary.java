package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO para el directorio público y para el resumen del stage propio del host.
 */
public record StageSummary(
        String id,
        String name,
        String hostName,
        int audienceCount,
        TrackInfo nowPlaying,
        @JsonProperty("isPublic") boolean isPublic,
        long createdAt
) {
}
