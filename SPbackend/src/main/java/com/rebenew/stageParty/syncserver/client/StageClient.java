package com.rebenew.stageParty.syncserver.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.stageParty.syncserver.config.StageProperties;
import com.rebenew.stageParty.syncserver.exception.StageErrorCode;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Extremo cliente del protocolo de stages.
 * <p>
 * Reconecta {@code reconnectDelay} después de cada cierre, sin límite, hasta {@link #close()}.
 * Cada reconexión presenta el último memberId para que el servidor devuelva al miembro a su
 * sitio, y cada apertura reenvía el último nombre. Los comandos no esperan respuesta: con
 * el socket caído se descartan.
 * <p>
 * Un cierre inesperado o un envío fallido se notifica a los listeners como
 * {@link StageErrorCode#CONNECTION_LOST}; no es terminal, el bucle de reconexión sigue.
 */
public class StageClient {
    private static final Logger logger = LoggerFactory.getLogger(StageClient.class);

    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(3);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(2);

    private final URI endpoint;
    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final LocalPlayer player;
    private final DriftCorrector driftCorrector;
    private final Clock clock;
    private final Duration reconnectDelay;
    private final Duration heartbeatInterval;

    private final ClientStageState state = new ClientStageState();
    private final List<Consumer<ServerEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Object sendLock = new Object();

    private volatile WebSocketSession session;
    private volatile String displayName;
    private volatile boolean stopped;
    private volatile PlaybackMode playbackMode;
    private ScheduledFuture<?> reconnectTask;

    public StageClient(URI endpoint, WebSocketClient webSocketClient, ObjectMapper objectMapper,
                       ScheduledExecutorService scheduler, LocalPlayer player, DriftCorrector driftCorrector,
                       Clock clock, Duration reconnectDelay, Duration heartbeatInterval) {
        this.endpoint = endpoint;
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.player = player;
        this.driftCorrector = driftCorrector;
        this.clock = clock;
        this.reconnectDelay = reconnectDelay;
        this.heartbeatInterval = heartbeatInterval;
    }

    public StageClient(URI endpoint, WebSocketClient webSocketClient, ObjectMapper objectMapper,
                       ScheduledExecutorService scheduler, LocalPlayer player) {
        this(endpoint, webSocketClient, objectMapper, scheduler, player, new DriftCorrector(), Clock.systemUTC(),
                DEFAULT_RECONNECT_DELAY, DEFAULT_HEARTBEAT_INTERVAL);
    }

    /**
     * Cliente con los umbrales de deriva, la espera de reconexión y el periodo de heartbeat de
     * {@code stage.*}.
     */
    public static StageClient fromProperties(URI endpoint, WebSocketClient webSocketClient, ObjectMapper objectMapper,
                                             ScheduledExecutorService scheduler, LocalPlayer player,
                                             StageProperties properties) {
        StageProperties.Drift drift = properties.getDrift();
        return new StageClient(endpoint, webSocketClient, objectMapper, scheduler, player,
                new DriftCorrector(drift.getSoftThresholdSeconds(), drift.getHardThresholdSeconds()),
                Clock.systemUTC(), properties.getReconnectDelay(), properties.getHeartbeatInterval());
    }

    // ==================== CONEXIÓN ====================

    public void connect() {
        if (stopped) {
            return;
        }
        URI uri = endpointFor(state.getMemberId());
        logger.debug("Connecting to {}", uri);
        webSocketClient.execute(new ConnectionHandler(), new WebSocketHttpHeaders(), uri)
                .whenComplete((connected, error) -> {
                    if (error != null) {
                        logger.warn("🔌 Connection to {} failed: {}", endpoint, error.getMessage());
                        scheduleReconnect();
                    }
                });
    }

    URI endpointFor(String memberId) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUri(endpoint);
        if (memberId != null) {
            builder.replaceQueryParam("memberId", memberId);
        }
        return builder.build().toUri();
    }

    private synchronized void scheduleReconnect() {
        if (stopped) {
            return;
        }
        if (reconnectTask != null && !reconnectTask.isDone()) {
            return;
        }
        reconnectTask = scheduler.schedule(this::connect, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void close() {
        stopped = true;
        synchronized (this) {
            if (reconnectTask != null) {
                reconnectTask.cancel(false);
                reconnectTask = null;
            }
        }
        switchMode(null);
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                logger.debug("Error closing session: {}", e.getMessage());
            }
        }
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    // ==================== COMANDOS ====================

    /**
     * @return false si el comando no se pudo entregar a una conexión abierta
     */
    public boolean send(ClientCommand command) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            logger.debug("Not connected, dropping {}", command.getClass().getSimpleName());
            return false;
        }
        try {
            String json = objectMapper.writeValueAsString(command);
            synchronized (sendLock) {
                current.sendMessage(new TextMessage(json));
            }
            return true;
        } catch (IOException e) {
            logger.warn("Send failed: {}", e.getMessage());
            reportConnectionLost("Send failed: " + e.getMessage());
            return false;
        }
    }

    public void setDisplayName(String name) {
        this.displayName = name;
        send(new ClientCommand.SetDisplayName(name));
    }

    // ==================== EVENTOS ====================

    public void addListener(Consumer<ServerEvent> listener) {
        listeners.add(listener);
    }

    void onEvent(ServerEvent event) {
        state.apply(event);
        updatePlaybackMode(event);
        for (Consumer<ServerEvent> listener : listeners) {
            listener.accept(event);
        }
    }

    private void reportConnectionLost(String detail) {
        onEvent(new ServerEvent.ErrorNotice(StageErrorCode.CONNECTION_LOST, detail));
    }

    // El modo se elige al crear, unirse o volver; el resto de eventos solo lo alimenta
    private void updatePlaybackMode(ServerEvent event) {
        if (event instanceof ServerEvent.SessionCreated || event instanceof ServerEvent.ReturnedToSession) {
            HostPlaybackMode hostMode = new HostPlaybackMode(player, this::send, scheduler, heartbeatInterval);
            switchMode(hostMode);
            hostMode.start();
        } else if (event instanceof ServerEvent.SessionJoined) {
            AudiencePlaybackMode audienceMode = new AudiencePlaybackMode(player, driftCorrector);
            audienceMode.onSnapshot(state.getLastSnapshot());
            switchMode(audienceMode);
        } else if (event instanceof ServerEvent.SyncSnapshot) {
            PlaybackMode mode = playbackMode;
            if (mode != null) {
                mode.onSnapshot(((ServerEvent.SyncSnapshot) event).toPlaybackSnapshot());
            }
        } else if (!state.isInSession()) {
            switchMode(null);
        }
    }

    private void switchMode(PlaybackMode next) {
        PlaybackMode previous = playbackMode;
        playbackMode = next;
        if (previous != null && previous != next) {
            previous.stop();
        }
    }

    /**
     * Ejecuta la corrección de deriva; llamar una vez por frame.
     */
    public void tick() {
        PlaybackMode mode = playbackMode;
        if (mode != null) {
            mode.onTick(clock.millis());
        }
    }

    public ClientStageState getState() {
        return state;
    }

    public PlaybackMode getPlaybackMode() {
        return playbackMode;
    }

    DriftCorrector getDriftCorrector() {
        return driftCorrector;
    }

    // ==================== HANDLER DEL SOCKET ====================

    private class ConnectionHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(@NonNull WebSocketSession newSession) {
            session = newSession;
            logger.info("🔄 Connected to {}", endpoint);
            String name = displayName;
            if (name != null) {
                send(new ClientCommand.SetDisplayName(name));
            }
        }

        @Override
        protected void handleTextMessage(@NonNull WebSocketSession wsSession, @NonNull TextMessage message) {
            ServerEvent event;
            try {
                event = objectMapper.readValue(message.getPayload(), ServerEvent.class);
            } catch (JsonProcessingException e) {
                logger.warn("Ignoring unreadable frame: {}", e.getOriginalMessage());
                return;
            }
            onEvent(event);
        }

        @Override
        public void afterConnectionClosed(@NonNull WebSocketSession wsSession, @NonNull CloseStatus status) {
            if (session == wsSession) {
                session = null;
            }
            // Sin conexión no hay heartbeat; al volver el servidor reenvía el estado
            PlaybackMode mode = playbackMode;
            if (mode instanceof HostPlaybackMode) {
                mode.stop();
            }
            if (stopped) {
                return;
            }
            logger.info("🔌 Disconnected ({}), retrying in {} ms", status, reconnectDelay.toMillis());
            reportConnectionLost("Connection closed: " + status);
            scheduleReconnect();
        }

        @Override
        public void handleTransportError(@NonNull WebSocketSession wsSession, @NonNull Throwable exception) {
            logger.warn("🚨 Transport error: {}", exception.getMessage());
        }
    }
}
