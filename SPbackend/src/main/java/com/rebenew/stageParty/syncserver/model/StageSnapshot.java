package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Copia completa del estado de un stage, enviada al crear, unirse o volver.
 */
public record StageSnapshot(
        String id,
        String name,
        String hostMemberId,
        String hostName,
        @JsonProperty("isPublic") boolean isPublic,
        StageState state,
        long createdAt,
        TrackInfo nowPlaying,
        PlaybackSnapshot playbackSnapshot,
        VisualizerSnapshot visualizerSnapshot,
        AudioSource audioSource,
        JsonNode analysisResult,
        List<QueueItem> queue,
        List<Suggestion> suggestions,
        int audienceCount
) {
    public StageSnapshot {
        queue = queue != null ? List.copyOf(queue) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public StageSnapshot withPlayback(PlaybackSnapshot snapshot) {
        return new StageSnapshot(id, name, hostMemberId, hostName, isPublic, state, createdAt, nowPlaying,
                snapshot, visualizerSnapshot, audioSource, analysisResult, queue, suggestions, audienceCount);
    }

    public StageSnapshot withAudio(AudioSource source, JsonNode analysis) {
        return new StageSnapshot(id, name, hostMemberId, hostName, isPublic, state, createdAt, nowPlaying,
                playbackSnapshot, visualizerSnapshot, source, analysis, queue, suggestions, audienceCount);
    }

    public StageSnapshot withQueue(List<QueueItem> newQueue, List<Suggestion> newSuggestions) {
        return new StageSnapshot(id, name, hostMemberId, hostName, isPublic, state, createdAt, nowPlaying,
                playbackSnapshot, visualizerSnapshot, audioSource, analysisResult, newQueue, newSuggestions,
                audienceCount);
    }

    public StageSnapshot withVisualizer(VisualizerSnapshot visualizer) {
        return new StageSnapshot(id, name, hostMemberId, hostName, isPublic, state, createdAt, nowPlaying,
                playbackSnapshot, visualizer, audioSource, analysisResult, queue, suggestions, audienceCount);
    }
}
