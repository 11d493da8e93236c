package com.rebenew.stageParty.syncserver.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.stageParty.syncserver.model.VisualizerSnapshot;

/**
 * Lectores tolerantes del payload opaco de {@code host_action}. El payload se reenvía
 * intacto; estos solo extraen lo que el stage necesita para su propio estado.
 */
final class HostActionPayloads {

    private HostActionPayloads() {
    }

    // Primer campo numérico encontrado; un payload numérico suelto también vale
    static Double number(JsonNode payload, String... fields) {
        if (payload == null || payload.isNull()) {
            return null;
        }
        if (payload.isNumber()) {
            return payload.asDouble();
        }
        for (String field : fields) {
            JsonNode value = payload.get(field);
            if (value != null && value.isNumber()) {
                return value.asDouble();
            }
        }
        return null;
    }

    static String text(JsonNode payload, String fallback, String field) {
        if (payload == null || payload.isNull()) {
            return fallback;
        }
        if (payload.isTextual()) {
            return payload.asText();
        }
        JsonNode value = payload.get(field);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }

    static VisualizerSnapshot.Tuning tuning(JsonNode payload, String field, VisualizerSnapshot.Tuning fallback) {
        if (payload == null || !payload.isObject()) {
            return fallback;
        }
        JsonNode node = payload.get(field);
        if (node == null || !node.isObject()) {
            return fallback;
        }
        return new VisualizerSnapshot.Tuning(
                node.path("bass").asDouble(fallback.bass()),
                node.path("mid").asDouble(fallback.mid()),
                node.path("treble").asDouble(fallback.treble()),
                node.path("sensitivity").asDouble(fallback.sensitivity()));
    }
}
