package com.rebenew.stageParty.syncserver.websocket;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Copia el parámetro opcional {@code memberId} a los atributos de la sesión, para que
 * un cliente que reconecta recupere su identidad anterior.
 */
public class MemberHandshakeInterceptor implements HandshakeInterceptor {

    public static final String MEMBER_ID_ATTRIBUTE = "memberId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String memberId = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst(MEMBER_ID_ATTRIBUTE);
        if (memberId != null && !memberId.isBlank()) {
            attributes.put(MEMBER_ID_ATTRIBUTE, memberId.trim());
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nada que hacer
    }
}
