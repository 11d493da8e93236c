package com.rebenew.stageParty.syncserver.client;

import com.rebenew.stageParty.syncserver.model.ChatMessage;
import com.rebenew.stageParty.syncserver.model.Member;
import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;
import com.rebenew.stageParty.syncserver.model.QueueItem;
import com.rebenew.stageParty.syncserver.model.StageSnapshot;
import com.rebenew.stageParty.syncserver.model.StageSummary;
import com.rebenew.stageParty.syncserver.model.Suggestion;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Todo lo que sabe un cliente: la última copia autoritativa de cada parte del estado.
 * {@link #apply} incorpora un evento del servidor; nada más lo modifica.
 */
public class ClientStageState implements ServerEvent.Handler {

    private static final int MAX_CHAT = 200;

    private String memberId;
    private String displayName;
    private List<StageSummary> publicSessions = List.of();
    private StageSnapshot session;
    private List<Member> members = List.of();
    private List<ChatMessage> chatLog = new ArrayList<>();
    private StageSummary ownedSession;
    private PlaybackSnapshot lastSnapshot;
    private Suggestion pendingSuggestion;
    private QueueItem nextToPlay;
    private ServerEvent.HostActionBroadcast lastHostAction;
    private ServerEvent.ErrorNotice lastError;

    public synchronized void apply(ServerEvent event) {
        event.dispatch(this);
    }

    // ==================== CONEXIÓN ====================

    @Override
    public void on(ServerEvent.Connected event) {
        memberId = event.memberId();
        publicSessions = copy(event.publicSessions());
    }

    @Override
    public void on(ServerEvent.DisplayNameSet event) {
        displayName = event.name();
    }

    @Override
    public void on(ServerEvent.PublicSessions event) {
        publicSessions = copy(event.list());
    }

    @Override
    public void on(ServerEvent.ErrorNotice event) {
        lastError = event;
    }

    // ==================== CICLO DE VIDA ====================

    @Override
    public void on(ServerEvent.SessionCreated event) {
        enter(event.session(), event.members(), List.of());
        ownedSession = summaryOf(event.session());
    }

    @Override
    public void on(ServerEvent.SessionJoined event) {
        enter(event.session(), event.members(), event.chatLog());
        ownedSession = event.ownedSessionSummary();
    }

    @Override
    public void on(ServerEvent.ReturnedToSession event) {
        enter(event.session(), event.members(), event.chatLog());
        ownedSession = summaryOf(event.session());
    }

    @Override
    public void on(ServerEvent.SessionUpdated event) {
        if (session == null || !session.id().equals(event.session().id())) {
            return;
        }
        session = event.session();
        acceptSnapshot(event.session().playbackSnapshot());
    }

    @Override
    public void on(ServerEvent.SessionClosed event) {
        if (session != null && session.id().equals(event.sessionId())) {
            leave();
        }
        if (ownedSession != null && ownedSession.id().equals(event.sessionId())) {
            ownedSession = null;
        }
    }

    @Override
    public void on(ServerEvent.LeftSession event) {
        leave();
    }

    @Override
    public void on(ServerEvent.WentToMenu event) {
        leave();
        ownedSession = event.ownedSessionSummary();
    }

    // ==================== MIEMBROS Y CHAT ====================

    @Override
    public void on(ServerEvent.MemberJoined event) {
        members = copy(event.members());
        appendChat(event.systemMessage());
    }

    @Override
    public void on(ServerEvent.MemberLeft event) {
        members = copy(event.members());
        appendChat(event.systemMessage());
    }

    @Override
    public void on(ServerEvent.MemberRenamed event) {
        members = copy(event.members());
    }

    @Override
    public void on(ServerEvent.ChatPosted event) {
        appendChat(event.message());
    }

    // ==================== PLAYBACK ====================

    @Override
    public void on(ServerEvent.AudioSourceChanged event) {
        if (session != null) {
            session = session.withAudio(event.audioSource(), event.analysisResult());
        }
    }

    @Override
    public void on(ServerEvent.SyncSnapshot event) {
        acceptSnapshot(event.toPlaybackSnapshot());
    }

    @Override
    public void on(ServerEvent.HostActionBroadcast event) {
        lastHostAction = event;
    }

    // ==================== COLA ====================

    @Override
    public void on(ServerEvent.QueueUpdated event) {
        if (session != null) {
            session = session.withQueue(event.queue(), event.suggestions());
        }
    }

    @Override
    public void on(ServerEvent.QueuePlayNext event) {
        nextToPlay = event.item();
    }

    @Override
    public void on(ServerEvent.SuggestionCreated event) {
        // llega también en queue_updated
    }

    @Override
    public void on(ServerEvent.SuggestionSent event) {
        pendingSuggestion = event.suggestion();
    }

    @Override
    public void on(ServerEvent.SuggestionResolved event) {
        if (pendingSuggestion != null && pendingSuggestion.id().equals(event.suggestionId())) {
            pendingSuggestion = null;
        }
    }

    // ==================== UTILIDADES ====================

    private void enter(StageSnapshot snapshot, List<Member> newMembers, List<ChatMessage> backlog) {
        session = snapshot;
        members = copy(newMembers);
        chatLog = new ArrayList<>(copy(backlog));
        lastSnapshot = snapshot != null ? snapshot.playbackSnapshot() : null;
        pendingSuggestion = null;
        nextToPlay = null;
        lastHostAction = null;
    }

    private void leave() {
        session = null;
        members = List.of();
        chatLog = new ArrayList<>();
        lastSnapshot = null;
        pendingSuggestion = null;
        nextToPlay = null;
        lastHostAction = null;
    }

    // Solo avanza: un snapshot más viejo que el actual se ignora
    private void acceptSnapshot(PlaybackSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        if (lastSnapshot == null || snapshot.capturedAt() >= lastSnapshot.capturedAt()) {
            lastSnapshot = snapshot;
            if (session != null) {
                session = session.withPlayback(snapshot);
            }
        }
    }

    private void appendChat(ChatMessage message) {
        if (message == null) {
            return;
        }
        chatLog.add(message);
        if (chatLog.size() > MAX_CHAT) {
            chatLog.subList(0, chatLog.size() - MAX_CHAT).clear();
        }
    }

    private static StageSummary summaryOf(StageSnapshot snapshot) {
        return new StageSummary(snapshot.id(), snapshot.name(), snapshot.hostName(), snapshot.audienceCount(),
                snapshot.nowPlaying(), snapshot.isPublic(), snapshot.createdAt());
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    // ==================== GETTERS ====================

    public synchronized String getMemberId() {
        return memberId;
    }

    public synchronized String getDisplayName() {
        return displayName;
    }

    public synchronized List<StageSummary> getPublicSessions() {
        return publicSessions;
    }

    public synchronized StageSnapshot getSession() {
        return session;
    }

    public synchronized boolean isInSession() {
        return session != null;
    }

    public synchronized List<Member> getMembers() {
        return members;
    }

    public synchronized List<ChatMessage> getChatLog() {
        return List.copyOf(chatLog);
    }

    public synchronized StageSummary getOwnedSession() {
        return ownedSession;
    }

    public synchronized PlaybackSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    public synchronized Suggestion getPendingSuggestion() {
        return pendingSuggestion;
    }

    public synchronized QueueItem getNextToPlay() {
        return nextToPlay;
    }

    public synchronized ServerEvent.HostActionBroadcast getLastHostAction() {
        return lastHostAction;
    }

    public synchronized ServerEvent.ErrorNotice getLastError() {
        return lastError;
    }
}
