package com.rebenew.stageParty.syncserver.config;

import com.rebenew.stageParty.syncserver.websocket.MemberHandshakeInterceptor;
import com.rebenew.stageParty.syncserver.websocket.StageWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String STAGE_WS_PATH = "/rooms/ws";

    private final StageWebSocketHandler stageWebSocketHandler;
    private final StageProperties properties;

    public WebSocketConfig(StageWebSocketHandler stageWebSocketHandler, StageProperties properties) {
        this.stageWebSocketHandler = stageWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(stageWebSocketHandler, STAGE_WS_PATH)
                .addInterceptors(new MemberHandshakeInterceptor())
                .setAllowedOriginPatterns(properties.getAllowedOriginPatterns().toArray(new String[0]));
    }
}
