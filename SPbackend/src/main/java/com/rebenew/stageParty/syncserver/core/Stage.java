package com.rebenew.stageParty.syncserver.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.stageParty.syncserver.config.StageProperties;
import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.model.AudioSource;
import com.rebenew.stageParty.syncserver.model.ChatMessage;
import com.rebenew.stageParty.syncserver.model.ConnectionState;
import com.rebenew.stageParty.syncserver.model.HostActionKind;
import com.rebenew.stageParty.syncserver.model.Member;
import com.rebenew.stageParty.syncserver.model.MemberRole;
import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;
import com.rebenew.stageParty.syncserver.model.QueueItem;
import com.rebenew.stageParty.syncserver.model.QueueItemStatus;
import com.rebenew.stageParty.syncserver.model.StageSnapshot;
import com.rebenew.stageParty.syncserver.model.StageState;
import com.rebenew.stageParty.syncserver.model.StageSummary;
import com.rebenew.stageParty.syncserver.model.Suggestion;
import com.rebenew.stageParty.syncserver.model.SuggestionDecision;
import com.rebenew.stageParty.syncserver.model.TrackInfo;
import com.rebenew.stageParty.syncserver.model.VisualizerSnapshot;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Un stage: el único punto de serialización de todo lo que ocurre dentro.
 * <p>
 * Cada método público corre bajo el monitor de este objeto. Los comandos validan primero
 * y mutan después, así que una {@link StageException} deja el stage intacto. Los eventos
 * pasan al {@link StageEventSink}, que no bloquea: el orden de eventos del stage es el
 * orden de las mutaciones sin mantener el lock durante la I/O.
 * <p>
 * Mientras el host está fuera (en el menú, visitando otro stage o desconectado) no recibe
 * tráfico del stage; al volver recibe una copia nueva del estado.
 */
public class Stage {

    private static final Logger logger = LoggerFactory.getLogger(Stage.class);

    private final String id;
    private final String hostMemberId;
    private final long createdAt;
    private final StageProperties properties;
    private final Clock clock;
    private final StageEventSink sink;
    private final StageQueue queue;

    private final Map<String, Member> members = new LinkedHashMap<>();
    private final List<ChatMessage> chatLog = new ArrayList<>();

    private String name;
    private String hostName;
    private boolean isPublic = false;
    private StageState state = StageState.LIVE;
    private TrackInfo nowPlaying;
    private PlaybackSnapshot playbackSnapshot;
    private VisualizerSnapshot visualizerSnapshot = VisualizerSnapshot.defaults();
    private AudioSource audioSource;
    private JsonNode analysisResult;

    public Stage(String id, Member host, String requestedName, StageProperties properties,
                 Clock clock, StageEventSink sink) {
        this.id = id;
        this.hostMemberId = host.id();
        this.hostName = host.displayName();
        this.properties = properties;
        this.clock = clock;
        this.sink = sink;
        this.createdAt = clock.millis();
        this.name = NameRules.stageName(requestedName, hostName, properties.getNames().getStageMax());
        this.playbackSnapshot = PlaybackSnapshot.initial(createdAt);
        this.queue = new StageQueue(properties.getLockedHeadSize());
        this.members.put(hostMemberId, Member.host(hostMemberId, hostName));
        logger.info("🎤 Stage created: {} ('{}') host={}", id, name, hostMemberId);
    }

    // ==================== MEMBRESÍA ====================

    /**
     * Falla con NOT_FOUND si está cerrado y con FORBIDDEN si es privado (salvo para el host).
     */
    public synchronized void checkJoinable(String memberId) {
        requireOpen();
        if (!isPublic && !hostMemberId.equals(memberId)) {
            throw StageException.forbidden("Stage is private");
        }
    }

    /**
     * Añade un miembro a la audiencia y le envía el estado completo dentro de la misma
     * sección crítica: nada emitido después puede adelantar a su {@code session_joined}.
     */
    public synchronized void join(String memberId, String displayName, StageSummary ownedSummary) {
        checkJoinable(memberId);
        if (hostMemberId.equals(memberId)) {
            throw StageException.invalidCommand("Use return_to_session to go back to your own stage");
        }

        boolean rejoin = members.containsKey(memberId);
        members.put(memberId, Member.audience(memberId, displayName));
        if (!rejoin) {
            ChatMessage systemMessage = appendSystemMessage(displayName + " joined the stage");
            broadcastExcept(memberId, new ServerEvent.MemberJoined(memberList(), systemMessage));
        }
        sink.deliver(memberId, new ServerEvent.SessionJoined(snapshot(), memberList(), chatBacklog(), ownedSummary));
        logger.info("👤 {} joined stage {} (audience={})", memberId, id, getAudienceCount());
    }

    /**
     * Reenvía el estado actual a un miembro que ya está en el stage (reconexión).
     */
    public synchronized void resync(String memberId, StageSummary ownedSummary) {
        requireOpen();
        Member member = members.get(memberId);
        if (member == null || member.isHost()) {
            throw StageException.notFound("You are no longer in this stage");
        }
        members.put(memberId, member.withConnectionState(ConnectionState.CONNECTED));
        sink.deliver(memberId, new ServerEvent.SessionJoined(snapshot(), memberList(), chatBacklog(), ownedSummary));
        logger.debug("Resynced {} in stage {}", memberId, id);
    }

    /**
     * Quita a un miembro de la audiencia junto con su sugerencia pendiente, si la tenía.
     *
     * @return false si el miembro no estaba en este stage
     */
    public synchronized boolean leave(String memberId) {
        if (hostMemberId.equals(memberId)) {
            throw StageException.invalidCommand("The host cannot leave its own stage, end it instead");
        }
        Member removed = members.remove(memberId);
        if (removed == null) {
            return false;
        }
        List<Suggestion> dropped = queue.dropSuggestionsBy(memberId);
        ChatMessage systemMessage = appendSystemMessage(removed.displayName() + " left the stage");
        broadcast(new ServerEvent.MemberLeft(memberList(), systemMessage));
        if (!dropped.isEmpty()) {
            broadcast(queueUpdated());
        }
        logger.info("👋 {} left stage {} (audience={})", memberId, id, getAudienceCount());
        return true;
    }

    // Presencia conservada durante el periodo de gracia
    public synchronized void markDisconnected(String memberId) {
        Member member = members.get(memberId);
        if (member != null) {
            members.put(memberId, member.withConnectionState(ConnectionState.DISCONNECTED));
        }
    }

    public synchronized void renameMember(String memberId, String displayName) {
        Member member = members.get(memberId);
        if (member == null) {
            return;
        }
        members.put(memberId, member.withDisplayName(displayName));
        if (member.isHost()) {
            hostName = displayName;
        }
        broadcast(new ServerEvent.MemberRenamed(memberId, memberList()));
    }

    // ==================== PRESENCIA DEL HOST ====================

    /**
     * El host se fue al menú o a otro stage. El stage sigue funcionando solo.
     */
    public synchronized void hostStepAway() {
        if (state != StageState.LIVE) {
            return;
        }
        state = StageState.HOST_AWAY;
        playbackSnapshot = currentPlayback();
        broadcast(new ServerEvent.SessionUpdated(snapshot()));
        logger.info("🚶 Host of stage {} stepped away", id);
    }

    public synchronized void hostDisconnected() {
        Member host = members.get(hostMemberId);
        if (host != null) {
            members.put(hostMemberId, host.withConnectionState(ConnectionState.DISCONNECTED));
        }
        hostStepAway();
    }

    // Host reconectado pero sigue fuera (menú o visitando): el stage sigue HOST_AWAY
    public synchronized void hostReconnected() {
        Member host = members.get(hostMemberId);
        if (host != null) {
            members.put(hostMemberId, host.withConnectionState(ConnectionState.CONNECTED));
        }
    }

    /**
     * Devuelve el control al host y le envía todo lo necesario para rehacer la reproducción local.
     */
    public synchronized void hostReturned() {
        requireOpen();
        hostReconnected();
        state = StageState.LIVE;
        playbackSnapshot = currentPlayback();
        sink.deliver(hostMemberId, new ServerEvent.ReturnedToSession(snapshot(), memberList(), chatBacklog(),
                audioSource != null));
        broadcast(new ServerEvent.SessionUpdated(snapshot()));
        broadcastAudience(ServerEvent.SyncSnapshot.of(playbackSnapshot));
        logger.info("👑 Host returned to stage {}", id);
    }

    /**
     * Cierra el stage y avisa a todos los miembros, host incluido.
     *
     * @return ids de los miembros que estaban en el stage
     */
    public synchronized List<String> close(String reason) {
        if (state == StageState.CLOSED) {
            return List.of();
        }
        state = StageState.CLOSED;
        List<String> memberIds = new ArrayList<>(members.keySet());
        ServerEvent closed = new ServerEvent.SessionClosed(id, reason);
        for (String memberId : memberIds) {
            sink.deliver(memberId, closed);
        }
        members.clear();
        return memberIds;
    }

    // ==================== AJUSTES DEL STAGE ====================

    public synchronized void rename(String memberId, String requestedName) {
        requireHost(memberId);
        String newName = NameRules.truncate(requestedName, properties.getNames().getStageMax());
        if (newName.isEmpty()) {
            throw StageException.invalidCommand("Stage name must not be blank");
        }
        name = newName;
        broadcast(new ServerEvent.SessionUpdated(snapshot()));
    }

    public synchronized boolean togglePublic(String memberId) {
        requireHost(memberId);
        isPublic = !isPublic;
        broadcast(new ServerEvent.SessionUpdated(snapshot()));
        logger.info("🌐 Stage {} is now {}", id, isPublic ? "public" : "private");
        return isPublic;
    }

    public synchronized void updateNowPlaying(String memberId, TrackInfo track) {
        requireHost(memberId);
        nowPlaying = track;
        broadcast(new ServerEvent.SessionUpdated(snapshot()));
    }

    /**
     * Añade un mensaje de chat de cualquier miembro. El texto vacío se ignora.
     */
    public synchronized void postChat(String memberId, String rawText) {
        requireOpen();
        Member member = members.get(memberId);
        if (member == null) {
            throw StageException.notFound("You are not in this stage");
        }
        String text = NameRules.truncate(rawText, properties.getChat().getMaxLength());
        if (text.isEmpty()) {
            return;
        }
        ChatMessage message = new ChatMessage(StageIds.next(), memberId, member.displayName(), text,
                clock.millis(), member.isHost(), false);
        appendChat(message);
        broadcast(new ServerEvent.ChatPosted(message));
    }

    // ==================== PLAYBACK ====================

    /**
     * Audio nuevo para el stage. La reproducción vuelve a cero, en pausa.
     */
    public synchronized void setAudioSource(String memberId, AudioSource source, JsonNode analysis) {
        requireHost(memberId);
        if (source == null) {
            throw StageException.invalidCommand("audioSource is required");
        }
        audioSource = source;
        analysisResult = analysis;
        playbackSnapshot = PlaybackSnapshot.initial(clock.millis());
        broadcastAudience(new ServerEvent.AudioSourceChanged(audioSource, analysisResult));
        broadcastAudience(ServerEvent.SyncSnapshot.of(playbackSnapshot));
        logger.info("🎵 Stage {} audio source set: {}", id, source.title());
    }

    /**
     * Guarda la posición que reporta el host, sellada con el reloj del servidor, y la reenvía.
     */
    public synchronized PlaybackSnapshot applyHeartbeat(String memberId, Double positionSeconds,
                                                        Boolean playing, Double speedMultiplier) {
        requireHost(memberId);
        if (positionSeconds == null || playing == null || speedMultiplier == null) {
            throw StageException.invalidCommand("positionSeconds, isPlaying and speedMultiplier are required");
        }
        PlaybackSnapshot next = newSnapshot(positionSeconds, playing, speedMultiplier);
        playbackSnapshot = next;
        broadcastAudience(ServerEvent.SyncSnapshot.of(next));
        logger.debug("💓 Stage {} heartbeat pos={} playing={}", id, next.positionSeconds(), next.isPlaying());
        return next;
    }

    /**
     * Aplica una acción puntual del host y la reenvía a la audiencia. Las acciones de
     * transporte también mueven el reloj y van seguidas de un {@code sync_snapshot}.
     */
    public synchronized void applyHostAction(String memberId, HostActionKind kind, JsonNode payload) {
        requireHost(memberId);
        if (kind == null) {
            throw StageException.invalidCommand("host_action kind is required");
        }

        PlaybackSnapshot current = currentPlayback();
        PlaybackSnapshot nextPlayback = playbackSnapshot;
        VisualizerSnapshot nextVisualizer = visualizerSnapshot;
        Double position = HostActionPayloads.number(payload, "positionSeconds", "position", "time");

        switch (kind) {
            case PLAY:
                nextPlayback = newSnapshot(position != null ? position : current.positionSeconds(), true,
                        current.speedMultiplier());
                break;
            case PAUSE:
                nextPlayback = newSnapshot(position != null ? position : current.positionSeconds(), false,
                        current.speedMultiplier());
                break;
            case SEEK:
                if (position == null) {
                    throw StageException.invalidCommand("seek requires positionSeconds");
                }
                nextPlayback = newSnapshot(position, current.isPlaying(), current.speedMultiplier());
                break;
            case SPEED_CHANGE:
                Double speed = HostActionPayloads.number(payload, "speedMultiplier", "speed", "rate");
                if (speed == null) {
                    throw StageException.invalidCommand("speed_change requires speedMultiplier");
                }
                nextPlayback = newSnapshot(current.positionSeconds(), current.isPlaying(), speed);
                break;
            case SHAPE_CHANGE:
                nextVisualizer = visualizerSnapshot.withShape(
                        HostActionPayloads.text(payload, visualizerSnapshot.shape(), "shape"));
                break;
            case ENVIRONMENT_CHANGE:
                nextVisualizer = visualizerSnapshot.withEnvironment(
                        HostActionPayloads.text(payload, visualizerSnapshot.environment(), "environment"));
                break;
            case EQ_CHANGE:
                nextVisualizer = visualizerSnapshot.withTunings(
                        HostActionPayloads.tuning(payload, "audioTuning", visualizerSnapshot.audioTuning()),
                        HostActionPayloads.tuning(payload, "playbackTuning", visualizerSnapshot.playbackTuning()));
                break;
            case RESET:
                nextVisualizer = VisualizerSnapshot.defaults();
                break;
            default:
                throw StageException.invalidCommand("Unsupported host action " + kind);
        }

        playbackSnapshot = nextPlayback;
        visualizerSnapshot = nextVisualizer;
        broadcastAudience(new ServerEvent.HostActionBroadcast(kind, payload));
        if (kind.affectsPlayback()) {
            broadcastAudience(ServerEvent.SyncSnapshot.of(playbackSnapshot));
        }
        logger.debug("🎛️ Stage {} host action {}", id, kind);
    }

    /**
     * Reloj de respaldo con el host fuera: reenvía el snapshot guardado extrapolado a ahora.
     * No hace nada salvo en HOST_AWAY y sonando.
     *
     * @return true si se envió un snapshot
     */
    public synchronized boolean emitFallbackHeartbeat() {
        if (state != StageState.HOST_AWAY || !playbackSnapshot.isPlaying()) {
            return false;
        }
        playbackSnapshot = currentPlayback();
        broadcastAudience(ServerEvent.SyncSnapshot.of(playbackSnapshot));
        return true;
    }

    // ==================== COLA ====================

    public synchronized QueueItem enqueue(String memberId, String title, String source, String url) {
        Member host = requireHost(memberId);
        QueueItem item = queue.enqueue(title, source, url, memberId, host.displayName());
        broadcast(queueUpdated());
        return item;
    }

    /**
     * Quitar el item que suena arranca el siguiente.
     */
    public synchronized QueueItem removeItem(String memberId, String itemId) {
        requireHost(memberId);
        QueueItem removed = queue.remove(itemId);
        Optional<QueueItem> next = removed.status() == QueueItemStatus.PLAYING
                ? queue.startNext()
                : Optional.empty();
        broadcast(queueUpdated());
        next.ifPresent(item -> broadcast(new ServerEvent.QueuePlayNext(item)));
        return removed;
    }

    public synchronized void reorderQueue(String memberId, List<String> tailOrder) {
        requireHost(memberId);
        queue.reorderTail(tailOrder);
        broadcast(queueUpdated());
    }

    public synchronized Optional<QueueItem> advanceQueue(String memberId) {
        requireHost(memberId);
        Optional<QueueItem> next = queue.advance();
        broadcast(queueUpdated());
        next.ifPresent(item -> broadcast(new ServerEvent.QueuePlayNext(item)));
        return next;
    }

    public synchronized QueueItem updateQueueItem(String memberId, String itemId, QueueItemStatus status,
                                                  JsonNode analysis) {
        requireHost(memberId);
        QueueItem updated = queue.updateItem(itemId, status, analysis);
        broadcast(queueUpdated());
        return updated;
    }

    /**
     * Solo audiencia: el host añade canciones directamente.
     */
    public synchronized Suggestion suggest(String memberId, String title, String source, String url) {
        requireOpen();
        Member member = members.get(memberId);
        if (member == null) {
            throw StageException.notFound("You are not in this stage");
        }
        if (member.isHost()) {
            throw StageException.forbidden("Hosts add songs to the queue directly");
        }
        Suggestion suggestion = queue.suggest(memberId, member.displayName(), title, source, url);
        if (receivesTraffic(hostMemberId)) {
            sink.deliver(hostMemberId, new ServerEvent.SuggestionCreated(suggestion));
        }
        sink.deliver(memberId, new ServerEvent.SuggestionSent(suggestion));
        broadcast(queueUpdated());
        logger.info("💡 {} suggested '{}' in stage {}", memberId, suggestion.title(), id);
        return suggestion;
    }

    public synchronized StageQueue.Resolution respondToSuggestion(String memberId, String suggestionId,
                                                                  SuggestionDecision decision) {
        requireHost(memberId);
        StageQueue.Resolution resolution = queue.respond(suggestionId, decision);
        sink.deliver(resolution.suggestion().proposerMemberId(),
                new ServerEvent.SuggestionResolved(suggestionId, decision));
        broadcast(queueUpdated());
        logger.info("✅ Suggestion {} in stage {}: {}", suggestionId, id, decision);
        return resolution;
    }

    // ==================== LECTURA ====================

    public synchronized StageSnapshot snapshot() {
        return new StageSnapshot(id, name, hostMemberId, hostName, isPublic, state, createdAt, nowPlaying,
                playbackSnapshot, visualizerSnapshot, audioSource, analysisResult, queue.items(),
                queue.suggestions(), getAudienceCount());
    }

    public synchronized StageSummary summary() {
        return new StageSummary(id, name, hostName, getAudienceCount(), nowPlaying, isPublic, createdAt);
    }

    public synchronized List<Member> getMembers() {
        return memberList();
    }

    public synchronized List<ChatMessage> getChatLog() {
        return List.copyOf(chatLog);
    }

    public synchronized boolean hasMember(String memberId) {
        return members.containsKey(memberId);
    }

    public synchronized int getAudienceCount() {
        int count = 0;
        for (Member member : members.values()) {
            if (member.role() == MemberRole.AUDIENCE) {
                count++;
            }
        }
        return count;
    }

    public synchronized boolean isPublic() {
        return isPublic;
    }

    public synchronized StageState getState() {
        return state;
    }

    public synchronized String getName() {
        return name;
    }

    public synchronized PlaybackSnapshot getPlaybackSnapshot() {
        return playbackSnapshot;
    }

    public synchronized VisualizerSnapshot getVisualizerSnapshot() {
        return visualizerSnapshot;
    }

    public String getId() {
        return id;
    }

    public String getHostMemberId() {
        return hostMemberId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    // ==================== UTILIDADES ====================

    private void requireOpen() {
        if (state == StageState.CLOSED) {
            throw StageException.notFound("Stage " + id + " no longer exists");
        }
    }

    private Member requireHost(String memberId) {
        requireOpen();
        if (!hostMemberId.equals(memberId)) {
            throw StageException.forbidden("Only the host can do that");
        }
        return members.get(hostMemberId);
    }

    private PlaybackSnapshot currentPlayback() {
        return playbackSnapshot.extrapolate(clock.millis()).clampTo(knownDuration());
    }

    private PlaybackSnapshot newSnapshot(double positionSeconds, boolean playing, double speedMultiplier) {
        if (Double.isNaN(positionSeconds) || Double.isInfinite(positionSeconds)) {
            throw StageException.invalidCommand("positionSeconds must be a finite number");
        }
        if (!(speedMultiplier > 0) || Double.isInfinite(speedMultiplier)) {
            throw StageException.invalidCommand("speedMultiplier must be greater than 0");
        }
        return new PlaybackSnapshot(positionSeconds, playing, speedMultiplier, clock.millis()).clampTo(knownDuration());
    }

    private Double knownDuration() {
        return audioSource != null ? audioSource.durationSeconds() : null;
    }

    private ChatMessage appendSystemMessage(String text) {
        ChatMessage message = ChatMessage.system(StageIds.next(), text, clock.millis());
        appendChat(message);
        return message;
    }

    private void appendChat(ChatMessage message) {
        chatLog.add(message);
        StageProperties.Chat limits = properties.getChat();
        if (chatLog.size() > limits.getHistoryLimit()) {
            chatLog.subList(0, chatLog.size() - limits.getHistoryTrimTo()).clear();
        }
    }

    private List<ChatMessage> chatBacklog() {
        int backlog = properties.getChat().getJoinBacklog();
        int from = Math.max(0, chatLog.size() - backlog);
        return List.copyOf(chatLog.subList(from, chatLog.size()));
    }

    private List<Member> memberList() {
        return List.copyOf(members.values());
    }

    private ServerEvent.QueueUpdated queueUpdated() {
        return new ServerEvent.QueueUpdated(queue.items(), queue.suggestions());
    }

    // Con el host fuera, su tráfico se corta: al volver recibe el estado completo
    private boolean receivesTraffic(String memberId) {
        return state == StageState.LIVE || !hostMemberId.equals(memberId);
    }

    private void broadcast(ServerEvent event) {
        for (String memberId : members.keySet()) {
            if (receivesTraffic(memberId)) {
                sink.deliver(memberId, event);
            }
        }
    }

    private void broadcastExcept(String excludedMemberId, ServerEvent event) {
        for (String memberId : members.keySet()) {
            if (!memberId.equals(excludedMemberId) && receivesTraffic(memberId)) {
                sink.deliver(memberId, event);
            }
        }
    }

    // Nunca al host: la audiencia sigue su reloj, no al revés
    private void broadcastAudience(ServerEvent event) {
        for (String memberId : members.keySet()) {
            if (!hostMemberId.equals(memberId)) {
                sink.deliver(memberId, event);
            }
        }
    }

    @Override
    public String toString() {
        return "Stage{" +
                "id='" + id + '\'' +
                ", hostMemberId='" + hostMemberId + '\'' +
                '}';
    }
}
