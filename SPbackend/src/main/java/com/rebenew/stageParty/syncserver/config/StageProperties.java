package com.rebenew.stageParty.syncserver.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Parámetros de stages, sincronización y conexiones, enlazados desde {@code stage.*}.
 * Los valores por defecto son los que esperan los clientes sin configuración.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "stage")
public class StageProperties {

    // Periodo del heartbeat del host y del ticker de respaldo del servidor
    private Duration heartbeatInterval = Duration.ofSeconds(2);

    // K: tamaño de la cabeza bloqueada de la cola
    private int lockedHeadSize = 3;

    private Duration hostAwayTimeout = Duration.ofSeconds(120);

    private Duration memberGracePeriod = Duration.ofSeconds(20);

    private Duration reconnectDelay = Duration.ofSeconds(3);

    // Orígenes permitidos para REST (CORS) y WebSocket
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of(
            "http://localhost:5173",
            "http://localhost:3000",
            "http://localhost:8080"));

    private Drift drift = new Drift();

    private Chat chat = new Chat();

    private Names names = new Names();

    private Outbound outbound = new Outbound();

    private Uploads uploads = new Uploads();

    @Getter
    @Setter
    public static class Drift {
        private double softThresholdSeconds = 0.3;
        private double hardThresholdSeconds = 1.0;
    }

    @Getter
    @Setter
    public static class Chat {
        private int historyLimit = 200;
        private int historyTrimTo = 100;
        private int joinBacklog = 50;
        private int maxLength = 500;
    }

    @Getter
    @Setter
    public static class Names {
        private int displayMax = 30;
        private int stageMax = 50;
    }

    @Getter
    @Setter
    public static class Outbound {
        private int maxQueuedMessages = 256;
    }

    @Getter
    @Setter
    public static class Uploads {
        private Path directory = Path.of(System.getProperty("java.io.tmpdir"), "stage-uploads");
        private long maxBytes = 50L * 1024 * 1024;
    }
}
