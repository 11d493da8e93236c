package com.rebenew.stageParty.syncserver.client;

import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;

/**
 * Cómo trata un cliente su reproductor local: como reloj (host) o como seguidor (audiencia).
 */
public interface PlaybackMode {

    void onSnapshot(PlaybackSnapshot snapshot);

    // Llamado una vez por frame de render
    void onTick(long nowMillis);

    void stop();
}
