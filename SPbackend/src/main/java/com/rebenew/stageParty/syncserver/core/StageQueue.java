package com.rebenew.stageParty.syncserver.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.model.QueueItem;
import com.rebenew.stageParty.syncserver.model.QueueItemStatus;
import com.rebenew.stageParty.syncserver.model.Suggestion;
import com.rebenew.stageParty.syncserver.model.SuggestionDecision;
import com.rebenew.stageParty.syncserver.model.SuggestionStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cola de dos tramos más las sugerencias pendientes de un stage.
 * <p>
 * Los items van en orden de reproducción y nunca incluyen los ya reproducidos. La cabeza
 * bloqueada es el item que suena (si hay, siempre en la posición 0) más los siguientes
 * {@code lockedHeadSize} items: su orden solo cambia al añadir, quitar o avanzar. El
 * resto es la cola libre, que el host puede permutar a su gusto.
 * <p>
 * No es thread-safe; toda llamada ocurre bajo el monitor del {@link Stage} dueño.
 * Toda validación ocurre antes de la primera mutación: una llamada rechazada no cambia nada.
 */
public class StageQueue {

    private final int lockedHeadSize;
    private final List<QueueItem> items = new ArrayList<>();
    private final Map<String, Suggestion> suggestions = new LinkedHashMap<>();

    public StageQueue(int lockedHeadSize) {
        if (lockedHeadSize < 0) {
            throw new IllegalArgumentException("lockedHeadSize must be >= 0, was " + lockedHeadSize);
        }
        this.lockedHeadSize = lockedHeadSize;
    }

    // ==================== COLA ====================

    public QueueItem enqueue(String title, String source, String url, String memberId, String memberName) {
        QueueItem item = new QueueItem(StageIds.next(), title, source, url, QueueItemStatus.PENDING,
                memberId, memberName, items.size(), null);
        items.add(item);
        return item;
    }

    /**
     * Reemplaza el orden de la cola libre. {@code newTailOrder} debe ser una permutación de sus ids.
     */
    public void reorderTail(List<String> newTailOrder) {
        if (newTailOrder == null) {
            throw StageException.invalidOrder("tailOrder is required");
        }
        List<QueueItem> tail = tail();
        if (newTailOrder.size() != tail.size()) {
            throw StageException.invalidOrder("Expected " + tail.size() + " tail items, got " + newTailOrder.size());
        }

        Map<String, QueueItem> byId = new HashMap<>();
        for (QueueItem item : tail) {
            byId.put(item.id(), item);
        }
        Set<String> seen = new HashSet<>();
        List<QueueItem> reordered = new ArrayList<>(tail.size());
        for (String itemId : newTailOrder) {
            QueueItem item = byId.get(itemId);
            if (item == null || !seen.add(itemId)) {
                throw StageException.invalidOrder("Item " + itemId + " is not a movable tail item");
            }
            reordered.add(item);
        }

        int offset = items.size() - tail.size();
        for (int i = 0; i < reordered.size(); i++) {
            items.set(offset + i, reordered.get(i));
        }
        renumber();
    }

    /**
     * Quita un item de cualquiera de los dos tramos.
     *
     * @return el item quitado, con el estado que tenía
     */
    public QueueItem remove(String itemId) {
        int index = indexOf(itemId);
        if (index < 0) {
            throw StageException.notFound("Queue item " + itemId + " not found");
        }
        QueueItem removed = items.remove(index);
        renumber();
        return removed;
    }

    /**
     * Termina el item que suena (si hay) y arranca el siguiente.
     *
     * @return el nuevo item en reproducción, vacío si la cola se acabó
     */
    public Optional<QueueItem> advance() {
        if (!items.isEmpty() && items.get(0).status() == QueueItemStatus.PLAYING) {
            items.remove(0);
            renumber();
        }
        return startNext();
    }

    // Arranca el primer item si no hay ninguno sonando
    public Optional<QueueItem> startNext() {
        if (items.isEmpty()) {
            return Optional.empty();
        }
        QueueItem first = items.get(0);
        if (first.status() != QueueItemStatus.PLAYING) {
            first = first.withStatus(QueueItemStatus.PLAYING);
            items.set(0, first);
        }
        return Optional.of(first);
    }

    /**
     * Actualiza el progreso de análisis de un item. Playing/played los gestiona la propia cola:
     * un item que suena conserva su estado y solo toma el resultado del análisis.
     */
    public QueueItem updateItem(String itemId, QueueItemStatus status, JsonNode analysisResult) {
        if (status != null && !status.isAnalysisState()) {
            throw StageException.invalidCommand("Status " + status + " cannot be set directly");
        }
        int index = indexOf(itemId);
        if (index < 0) {
            throw StageException.notFound("Queue item " + itemId + " not found");
        }
        QueueItem item = items.get(index);
        if (status != null && item.status() != QueueItemStatus.PLAYING) {
            item = item.withStatus(status);
        }
        if (analysisResult != null && !analysisResult.isNull()) {
            item = item.withAnalysisResult(analysisResult);
        }
        items.set(index, item);
        return item;
    }

    public Optional<QueueItem> playing() {
        if (!items.isEmpty() && items.get(0).status() == QueueItemStatus.PLAYING) {
            return Optional.of(items.get(0));
        }
        return Optional.empty();
    }

    public List<QueueItem> head() {
        return List.copyOf(items.subList(0, headEnd()));
    }

    public List<QueueItem> tail() {
        return List.copyOf(items.subList(headEnd(), items.size()));
    }

    // El item en reproducción no cuenta dentro de los K bloqueados
    private int headEnd() {
        int locked = playing().isPresent() ? lockedHeadSize + 1 : lockedHeadSize;
        return Math.min(locked, items.size());
    }

    public List<QueueItem> items() {
        return List.copyOf(items);
    }

    // ==================== SUGERENCIAS ====================

    /**
     * Registra una sugerencia. Cada miembro puede tener como mucho una pendiente.
     */
    public Suggestion suggest(String memberId, String memberName, String title, String source, String url) {
        boolean alreadyPending = suggestions.values().stream()
                .anyMatch(s -> s.isPending() && s.proposerMemberId().equals(memberId));
        if (alreadyPending) {
            throw StageException.duplicatePending("You already have a pending suggestion");
        }
        Suggestion suggestion = new Suggestion(StageIds.next(), title, source, url, memberId, memberName,
                SuggestionStatus.PENDING);
        suggestions.put(suggestion.id(), suggestion);
        return suggestion;
    }

    /**
     * Resuelve y borra una sugerencia; al aprobarla se añade a la cola a nombre de quien la propuso.
     */
    public Resolution respond(String suggestionId, SuggestionDecision decision) {
        if (decision == null) {
            throw StageException.invalidCommand("decision is required");
        }
        Suggestion suggestion = suggestions.get(suggestionId);
        if (suggestion == null) {
            throw StageException.notFound("Suggestion " + suggestionId + " not found");
        }
        suggestions.remove(suggestionId);
        QueueItem queued = null;
        if (decision == SuggestionDecision.APPROVE) {
            queued = enqueue(suggestion.title(), suggestion.source(), suggestion.url(),
                    suggestion.proposerMemberId(), suggestion.proposerName());
        }
        return new Resolution(suggestion.withStatus(decision.resultingStatus()), queued);
    }

    public List<Suggestion> dropSuggestionsBy(String memberId) {
        List<Suggestion> dropped = new ArrayList<>();
        suggestions.values().removeIf(s -> {
            if (s.proposerMemberId().equals(memberId)) {
                dropped.add(s);
                return true;
            }
            return false;
        });
        return dropped;
    }

    public List<Suggestion> suggestions() {
        return List.copyOf(suggestions.values());
    }

    public int getLockedHeadSize() {
        return lockedHeadSize;
    }

    private int indexOf(String itemId) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).id().equals(itemId)) {
                return i;
            }
        }
        return -1;
    }

    private void renumber() {
        for (int i = 0; i < items.size(); i++) {
            QueueItem item = items.get(i);
            if (item.position() != i) {
                items.set(i, item.withPosition(i));
            }
        }
    }

    /**
     * @param queuedItem el item creado al aprobar, null al rechazar
     */
    public record Resolution(Suggestion suggestion, QueueItem queuedItem) {
    }
}
