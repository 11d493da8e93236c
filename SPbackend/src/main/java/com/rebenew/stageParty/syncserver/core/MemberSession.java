package com.rebenew.stageParty.syncserver.core;

import com.rebenew.stageParty.syncserver.model.ConnectionState;
import com.rebenew.stageParty.syncserver.model.MemberPhase;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identidad de un miembro a nivel de conexión. Sobrevive a cada WebSocket para que un
 * cliente que reconecta con su memberId recupere su sitio.
 */
public class MemberSession {

    private static final Logger logger = LoggerFactory.getLogger(MemberSession.class);

    private final String memberId;
    private volatile Outbox outbox;
    private volatile String displayName = NameRules.DEFAULT_DISPLAY_NAME;
    private volatile ConnectionState connectionState = ConnectionState.CONNECTED;
    private volatile String currentStageId;
    private volatile String ownedStageId;

    public MemberSession(String memberId, Outbox outbox) {
        this.memberId = memberId;
        this.outbox = outbox;
    }

    public void send(ServerEvent event) {
        Outbox current = outbox;
        if (current == null || connectionState != ConnectionState.CONNECTED) {
            logger.debug("Dropping {} for offline member {}", event.getClass().getSimpleName(), memberId);
            return;
        }
        current.send(event);
    }

    // ==================== CONEXIÓN ====================

    /**
     * Asocia una conexión nueva y cierra la anterior si sigue abierta.
     */
    public synchronized void attach(Outbox newOutbox) {
        Outbox previous = this.outbox;
        this.outbox = newOutbox;
        this.connectionState = ConnectionState.CONNECTED;
        if (previous != null && previous != newOutbox && previous.isOpen()) {
            previous.close();
        }
    }

    /**
     * @return false si {@code closedOutbox} ya no es la conexión de este miembro
     */
    public synchronized boolean detach(Outbox closedOutbox) {
        if (this.outbox != closedOutbox) {
            return false;
        }
        this.connectionState = ConnectionState.DISCONNECTED;
        return true;
    }

    public boolean isConnected() {
        return connectionState == ConnectionState.CONNECTED;
    }

    // ==================== UBICACIÓN ====================

    public MemberPhase getPhase() {
        String current = currentStageId;
        String owned = ownedStageId;
        if (owned == null) {
            return current == null ? MemberPhase.LOBBY : MemberPhase.AUDIENCE;
        }
        if (current == null) {
            return MemberPhase.ON_MENU;
        }
        return current.equals(owned) ? MemberPhase.HOSTING : MemberPhase.VISITING;
    }

    public synchronized void takeOwnership(String stageId) {
        this.ownedStageId = stageId;
        this.currentStageId = stageId;
    }

    public synchronized void enterStage(String stageId) {
        this.currentStageId = stageId;
    }

    public synchronized void leaveCurrentStage() {
        this.currentStageId = null;
    }

    // Limpia cualquier referencia a un stage que ya no existe
    public synchronized void stageClosed(String stageId) {
        if (stageId == null) {
            return;
        }
        if (stageId.equals(currentStageId)) {
            currentStageId = null;
        }
        if (stageId.equals(ownedStageId)) {
            ownedStageId = null;
        }
    }

    public boolean isVisitor() {
        String current = currentStageId;
        return current != null && !current.equals(ownedStageId);
    }

    // ==================== GETTERS / SETTERS ====================

    public String getMemberId() {
        return memberId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    public String getCurrentStageId() {
        return currentStageId;
    }

    public String getOwnedStageId() {
        return ownedStageId;
    }

    @Override
    public String toString() {
        return "MemberSession{" +
                "memberId='" + memberId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", phase=" + getPhase() +
                ", connectionState=" + connectionState +
                '}';
    }
}
