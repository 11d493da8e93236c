package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * De dónde carga la audiencia el audio del stage (archivo subido o pista externa).
 * durationSeconds es null hasta que el reproductor del host la conoce.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AudioSource(
        String kind,
        String url,
        String title,
        Double durationSeconds
) {
}
