package com.rebenew.stageParty.syncserver.service;

import com.rebenew.stageParty.syncserver.config.StageProperties;
import com.rebenew.stageParty.syncserver.core.Stage;
import com.rebenew.stageParty.syncserver.core.StageLifecycleEvent;
import com.rebenew.stageParty.syncserver.core.StageRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Mantiene el reloj de la audiencia mientras el host está fuera: un ticker por stage en
 * HOST_AWAY que reenvía el snapshot guardado extrapolado a ahora.
 */
@Service
public class HostAwayHeartbeat {
    private static final Logger logger = LoggerFactory.getLogger(HostAwayHeartbeat.class);

    private final StageRegistry stageRegistry;
    private final ScheduledExecutorService scheduler;
    private final StageProperties properties;

    private final Map<String, ScheduledFuture<?>> tickers = new ConcurrentHashMap<>();

    public HostAwayHeartbeat(StageRegistry stageRegistry, ScheduledExecutorService scheduler,
                             StageProperties properties) {
        this.stageRegistry = stageRegistry;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @EventListener
    public void onStageEvent(StageLifecycleEvent event) {
        switch (event.getAction()) {
            case HOST_AWAY:
                start(event.getStageId());
                break;
            case HOST_RETURNED:
            case CLOSED:
                stop(event.getStageId());
                break;
            default:
                break;
        }
    }

    public boolean isTicking(String stageId) {
        return tickers.containsKey(stageId);
    }

    /**
     * Un latido de respaldo para un stage. Para el ticker si el stage ya no existe.
     */
    public void tick(String stageId) {
        Optional<Stage> stage = stageRegistry.find(stageId);
        if (stage.isEmpty()) {
            stop(stageId);
            return;
        }
        if (stage.get().emitFallbackHeartbeat()) {
            logger.trace("💓 Fallback heartbeat for stage {}", stageId);
        }
    }

    private void start(String stageId) {
        long periodMs = properties.getHeartbeatInterval().toMillis();
        tickers.computeIfAbsent(stageId, id -> {
            logger.debug("Fallback heartbeat started for stage {}", id);
            return scheduler.scheduleAtFixedRate(() -> safeTick(id), periodMs, periodMs, TimeUnit.MILLISECONDS);
        });
    }

    private void stop(String stageId) {
        ScheduledFuture<?> ticker = tickers.remove(stageId);
        if (ticker != null) {
            ticker.cancel(false);
            logger.debug("Fallback heartbeat stopped for stage {}", stageId);
        }
    }

    // Una excepción cancelaría el scheduleAtFixedRate en silencio
    private void safeTick(String stageId) {
        try {
            tick(stageId);
        } catch (RuntimeException e) {
            logger.error("❌ Fallback heartbeat failed for stage {}", stageId, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        tickers.values().forEach(ticker -> ticker.cancel(false));
        tickers.clear();
    }
}
