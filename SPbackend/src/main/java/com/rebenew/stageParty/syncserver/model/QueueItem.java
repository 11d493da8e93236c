package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Una canción en la cola de un stage.
 */
public record QueueItem(
        String id,
        String title,
        String source,
        String url,
        QueueItemStatus status,
        String addedByMemberId,
        String addedByName,
        int position,
        JsonNode analysisResult
) {
    public QueueItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("queue item id must not be blank");
        }
        if (title == null || title.isBlank()) {
            title = "Unknown Track";
        }
        if (status == null) {
            status = QueueItemStatus.PENDING;
        }
    }

    public QueueItem withStatus(QueueItemStatus newStatus) {
        return new QueueItem(id, title, source, url, newStatus, addedByMemberId, addedByName, position, analysisResult);
    }

    public QueueItem withPosition(int newPosition) {
        return new QueueItem(id, title, source, url, status, addedByMemberId, addedByName, newPosition, analysisResult);
    }

    public QueueItem withAnalysisResult(JsonNode result) {
        return new QueueItem(id, title, source, url, status, addedByMemberId, addedByName, position, result);
    }
}
