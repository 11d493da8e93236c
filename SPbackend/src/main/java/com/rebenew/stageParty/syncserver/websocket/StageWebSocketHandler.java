package com.rebenew.stageParty.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.stageParty.syncserver.config.StageProperties;
import com.rebenew.stageParty.syncserver.core.MemberSession;
import com.rebenew.stageParty.syncserver.core.StageSessionManager;
import com.rebenew.stageParty.syncserver.exception.StageErrorCode;
import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import com.rebenew.stageParty.syncserver.view.SessionViews;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

@Component
public class StageWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(StageWebSocketHandler.class);

    private final StageSessionManager sessionManager;
    private final SessionViews sessionViews;
    private final ObjectMapper objectMapper;
    private final Executor outboundExecutor;
    private final StageProperties properties;

    // Conexión WebSocket -> miembro y su buffer de salida
    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();

    public StageWebSocketHandler(StageSessionManager sessionManager, SessionViews sessionViews,
                                 ObjectMapper objectMapper,
                                 @Qualifier("outboundExecutor") Executor outboundExecutor,
                                 StageProperties properties) {
        this.sessionManager = sessionManager;
        this.sessionViews = sessionViews;
        this.objectMapper = objectMapper;
        this.outboundExecutor = outboundExecutor;
        this.properties = properties;
    }

    // ==================== CICLO DE VIDA WEBSOCKET ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        String requestedMemberId = (String) session.getAttributes().get(MemberHandshakeInterceptor.MEMBER_ID_ATTRIBUTE);
        WebSocketOutbox outbox = new WebSocketOutbox(session, objectMapper, outboundExecutor,
                properties.getOutbound().getMaxQueuedMessages());
        MemberSession member = sessionManager.connect(requestedMemberId, outbox);
        connections.put(session.getId(), new Connection(member, outbox));
        logger.info("🔄 New connection {} -> member {}", session.getId(), member.getMemberId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        Connection connection = connections.get(session.getId());
        if (connection == null) {
            logger.warn("Message on unknown connection {}", session.getId());
            return;
        }
        MemberSession member = connection.member();

        ClientCommand command;
        try {
            command = objectMapper.readValue(message.getPayload(), ClientCommand.class);
        } catch (JsonProcessingException e) {
            logger.warn("⚠️ Malformed frame from {}: {}", member.getMemberId(), e.getOriginalMessage());
            member.send(new ServerEvent.ErrorNotice(StageErrorCode.INVALID_COMMAND, "Unknown or malformed message"));
            return;
        }

        try {
            command.dispatch(sessionViews.viewFor(member), member);
        } catch (StageException e) {
            logger.warn("⚠️ {} rejected for {}: {} ({})", command.getClass().getSimpleName(), member.getMemberId(),
                    e.getMessage(), e.getCode());
            member.send(new ServerEvent.ErrorNotice(e.getCode(), e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("❌ Error processing {} from {}", command.getClass().getSimpleName(), member.getMemberId(), e);
            member.send(new ServerEvent.ErrorNotice(StageErrorCode.INVALID_COMMAND, "Could not process message"));
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        Connection connection = connections.remove(session.getId());
        if (connection == null) {
            logger.info("🔌 Connection closed: {}", session.getId());
            return;
        }
        logger.info("🔌 Connection closed: {} (member {}, {})", session.getId(),
                connection.member().getMemberId(), status);
        sessionManager.disconnect(connection.member(), connection.outbox());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 Transport error on {}: {}", session.getId(), exception.getMessage());
    }

    public int getConnectionCount() {
        return connections.size();
    }

    private record Connection(MemberSession member, WebSocketOutbox outbox) {
    }
}
