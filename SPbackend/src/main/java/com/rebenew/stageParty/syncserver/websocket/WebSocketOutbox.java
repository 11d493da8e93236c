package com.rebenew.stageParty.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.stageParty.syncserver.core.Outbox;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Buffer de envío ordenado y acotado de una conexión WebSocket.
 * <p>
 * {@link #send} serializa, encola y vuelve. Por conexión corre como mucho una tarea de
 * vaciado en el executor compartido: los frames salen en orden y un cliente lento solo
 * se retrasa a sí mismo. Con el buffer lleno se descarta el evento más nuevo; el cliente
 * se recupera con el siguiente snapshot o al reconectar.
 */
public class WebSocketOutbox implements Outbox {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketOutbox.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final int maxQueuedMessages;

    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public WebSocketOutbox(WebSocketSession session, ObjectMapper objectMapper, Executor executor,
                           int maxQueuedMessages) {
        this.session = session;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.maxQueuedMessages = maxQueuedMessages;
    }

    @Override
    public void send(ServerEvent event) {
        if (!session.isOpen()) {
            logger.debug("Connection {} closed, dropping {}", session.getId(), event.getClass().getSimpleName());
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("❌ Could not serialize {} for {}", event.getClass().getSimpleName(), session.getId(), e);
            return;
        }
        if (queued.incrementAndGet() > maxQueuedMessages) {
            queued.decrementAndGet();
            logger.warn("⚠️ Outbound buffer full for {}, dropping {}", session.getId(),
                    event.getClass().getSimpleName());
            return;
        }
        pending.add(json);
        scheduleDrain();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.NORMAL.withReason("Replaced by a newer connection"));
        } catch (IOException e) {
            logger.debug("Error closing {}: {}", session.getId(), e.getMessage());
        }
    }

    public int getQueuedCount() {
        return queued.get();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            String json;
            while ((json = pending.poll()) != null) {
                queued.decrementAndGet();
                if (!session.isOpen()) {
                    continue;
                }
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException | IllegalStateException e) {
            logger.warn("🚨 Send failed for {}: {}", session.getId(), e.getMessage());
        } finally {
            draining.set(false);
        }
        // Un send() pudo encolar entre el último poll y el reset del flag
        if (!pending.isEmpty()) {
            scheduleDrain();
        }
    }
}
