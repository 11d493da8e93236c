package com.rebenew.stageParty.syncserver.core;

import java.util.UUID;

// Ids cortos para stages, miembros, items de cola, sugerencias y mensajes
public final class StageIds {

    private static final int LENGTH = 12;

    private StageIds() {
    }

    public static String next() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, LENGTH);
    }
}
