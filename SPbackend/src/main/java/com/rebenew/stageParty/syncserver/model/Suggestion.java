package com.rebenew.stageParty.syncserver.model;

/**
 * Canción propuesta por un miembro de la audiencia, pendiente de respuesta del host.
 */
public record Suggestion(
        String id,
        String title,
        String source,
        String url,
        String proposerMemberId,
        String proposerName,
        SuggestionStatus status
) {
    public Suggestion {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("suggestion id must not be blank");
        }
        if (proposerMemberId == null || proposerMemberId.isBlank()) {
            throw new IllegalArgumentException("proposerMemberId must not be blank");
        }
        if (title == null || title.isBlank()) {
            title = "Unknown Track";
        }
        if (status == null) {
            status = SuggestionStatus.PENDING;
        }
    }

    public Suggestion withStatus(SuggestionStatus newStatus) {
        return new Suggestion(id, title, source, url, proposerMemberId, proposerName, newStatus);
    }

    public boolean isPending() {
        return status == SuggestionStatus.PENDING;
    }
}
