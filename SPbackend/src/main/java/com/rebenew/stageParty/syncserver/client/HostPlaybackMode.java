package com.rebenew.stageParty.syncserver.client;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rebenew.stageParty.syncserver.model.HostActionKind;
import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * El reproductor del host es el reloj. Cada cambio de transporte sale enseguida como
 * {@code host_action} más un {@code sync_heartbeat}; mientras suena, además sale un
 * heartbeat en cada intervalo.
 */
public class HostPlaybackMode implements PlaybackMode {
    private static final Logger logger = LoggerFactory.getLogger(HostPlaybackMode.class);

    private final LocalPlayer player;
    private final Consumer<ClientCommand> sender;
    private final ScheduledExecutorService scheduler;
    private final Duration heartbeatInterval;

    private ScheduledFuture<?> heartbeatTask;

    public HostPlaybackMode(LocalPlayer player, Consumer<ClientCommand> sender, ScheduledExecutorService scheduler,
                            Duration heartbeatInterval) {
        this.player = player;
        this.sender = sender;
        this.scheduler = scheduler;
        this.heartbeatInterval = heartbeatInterval;
    }

    public synchronized void start() {
        if (heartbeatTask != null) {
            return;
        }
        long periodMs = heartbeatInterval.toMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(this::safeHeartbeat, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    // ==================== TRANSPORTE ====================

    public void play() {
        player.play();
        announce(HostActionKind.PLAY, positionPayload());
    }

    public void pause() {
        player.pause();
        announce(HostActionKind.PAUSE, positionPayload());
    }

    public void seek(double positionSeconds) {
        player.seek(positionSeconds);
        announce(HostActionKind.SEEK, positionPayload());
    }

    public void changeSpeed(double speedMultiplier) {
        if (!(speedMultiplier > 0)) {
            throw new IllegalArgumentException("speedMultiplier must be > 0");
        }
        player.setSpeed(speedMultiplier);
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("speedMultiplier", speedMultiplier);
        announce(HostActionKind.SPEED_CHANGE, payload);
    }

    /**
     * Envía la posición actual. Los latidos programados solo salen mientras suena.
     */
    public void heartbeat() {
        if (player.isPlaying()) {
            sendHeartbeat();
        }
    }

    private void announce(HostActionKind kind, ObjectNode payload) {
        sender.accept(new ClientCommand.HostAction(kind, payload));
        sendHeartbeat();
    }

    private void sendHeartbeat() {
        sender.accept(new ClientCommand.SyncHeartbeat(player.getPositionSeconds(), player.isPlaying(),
                player.getSpeed()));
    }

    private ObjectNode positionPayload() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("positionSeconds", player.getPositionSeconds());
        return payload;
    }

    private void safeHeartbeat() {
        try {
            heartbeat();
        } catch (RuntimeException e) {
            logger.warn("Heartbeat failed: {}", e.getMessage());
        }
    }

    // ==================== MODO DE REPRODUCCIÓN ====================

    @Override
    public void onSnapshot(PlaybackSnapshot snapshot) {
        // el host es la referencia, no sigue a nadie
    }

    @Override
    public void onTick(long nowMillis) {
        // nada: el reloj es el propio reproductor
    }

    @Override
    public synchronized void stop() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    public synchronized boolean isRunning() {
        return heartbeatTask != null;
    }
}
