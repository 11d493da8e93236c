package com.rebenew.stageParty.syncserver.core;

/**
 * Normalización de nombres de miembro y de stage.
 */
public final class NameRules {

    public static final String DEFAULT_DISPLAY_NAME = "Anon";

    private NameRules() {
    }

    // Recorta, limita a maxLength y usa "Anon" si queda vacío
    public static String displayName(String raw, int maxLength) {
        String trimmed = truncate(raw, maxLength);
        return trimmed.isEmpty() ? DEFAULT_DISPLAY_NAME : trimmed;
    }

    public static String stageName(String raw, String hostName, int maxLength) {
        String trimmed = truncate(raw, maxLength);
        if (!trimmed.isEmpty()) {
            return trimmed;
        }
        return truncate(defaultStageName(hostName), maxLength);
    }

    public static String defaultStageName(String hostName) {
        return hostName + "'s Stage";
    }

    public static String truncate(String raw, int maxLength) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        if (trimmed.length() > maxLength) {
            trimmed = trimmed.substring(0, maxLength).trim();
        }
        return trimmed;
    }
}
