package com.rebenew.stageParty.syncserver.model;

/**
 * Dónde está ahora un miembro, según su stage actual y el propio.
 * Sobrevive a una desconexión para poder devolverlo a su sitio.
 *
 * LOBBY -> HOSTING | AUDIENCE; HOSTING -> VISITING | ON_MENU; VISITING | ON_MENU -> HOSTING.
 * VISITING y ON_MENU mantienen vivo el stage propio mientras el host está en otra parte.
 */
public enum MemberPhase {
    LOBBY,
    HOSTING,
    AUDIENCE,
    VISITING,
    ON_MENU;

    public boolean ownsStage() {
        return this == HOSTING || this == VISITING || this == ON_MENU;
    }

    public boolean inStage() {
        return this == HOSTING || this == AUDIENCE || this == VISITING;
    }
}
