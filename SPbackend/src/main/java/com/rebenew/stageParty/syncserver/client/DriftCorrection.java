package com.rebenew.stageParty.syncserver.client;

/**
 * Resultado de una comprobación de deriva.
 *
 * @param targetSeconds dónde debería estar ahora el reproductor local
 * @param driftSeconds  distancia absoluta entre la posición local y el objetivo
 */
public record DriftCorrection(
        Action action,
        double targetSeconds,
        double driftSeconds,
        boolean isPlaying,
        double speedMultiplier
) {
    public enum Action {
        NONE, // dentro de tolerancia
        SEEK, // corrección suave
        SNAP  // salto inmediato
    }

    public boolean needsSeek() {
        return action != Action.NONE;
    }
}
