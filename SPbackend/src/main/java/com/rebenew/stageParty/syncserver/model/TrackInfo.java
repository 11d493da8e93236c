package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// Metadatos de "now playing" que se muestran en el directorio público
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackInfo(
        String title,
        String artist,
        String source,
        String url
) {
}
