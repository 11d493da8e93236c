package com.rebenew.stageParty.syncserver.core;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Se publica tras confirmar un cambio en un stage, fuera de su monitor.
 * Los listeners mantienen al día el estado derivado (directorio público, heartbeat de respaldo).
 */
@Getter
public class StageLifecycleEvent extends ApplicationEvent {

    public enum Action {
        CREATED,          // Stage nuevo
        UPDATED,          // Nombre, visibilidad, now playing o nombre del host
        AUDIENCE_CHANGED, // Alguien entró o salió
        HOST_AWAY,        // Host en el menú, visitando o desconectado
        HOST_RETURNED,    // Host de vuelta al mando
        CLOSED            // Stage terminado
    }

    private final String stageId;
    private final Action action;
    // Si el cambio debe reflejarse en el directorio público
    private final boolean directoryRelevant;

    public StageLifecycleEvent(Object source, String stageId, Action action, boolean directoryRelevant) {
        super(source);
        this.stageId = stageId;
        this.action = action;
        this.directoryRelevant = directoryRelevant;
    }

    public static StageLifecycleEvent created(Object source, Stage stage) {
        return new StageLifecycleEvent(source, stage.getId(), Action.CREATED, stage.isPublic());
    }

    public static StageLifecycleEvent updated(Object source, Stage stage) {
        return new StageLifecycleEvent(source, stage.getId(), Action.UPDATED, stage.isPublic());
    }

    // Un cambio de visibilidad siempre afecta al directorio
    public static StageLifecycleEvent visibilityChanged(Object source, Stage stage) {
        return new StageLifecycleEvent(source, stage.getId(), Action.UPDATED, true);
    }

    public static StageLifecycleEvent audienceChanged(Object source, Stage stage) {
        return new StageLifecycleEvent(source, stage.getId(), Action.AUDIENCE_CHANGED, stage.isPublic());
    }

    public static StageLifecycleEvent hostAway(Object source, Stage stage) {
        return new StageLifecycleEvent(source, stage.getId(), Action.HOST_AWAY, false);
    }

    public static StageLifecycleEvent hostReturned(Object source, Stage stage) {
        return new StageLifecycleEvent(source, stage.getId(), Action.HOST_RETURNED, false);
    }

    public static StageLifecycleEvent closed(Object source, Stage stage) {
        return new StageLifecycleEvent(source, stage.getId(), Action.CLOSED, stage.isPublic());
    }

    @Override
    public String toString() {
        return "StageLifecycleEvent{" +
                "stageId='" + stageId + '\'' +
                ", action=" + action +
                ", directoryRelevant=" + directoryRelevant +
                '}';
    }
}
