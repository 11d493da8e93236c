package com.rebenew.stageParty.syncserver.client;

/**
 * El elemento de audio que controla un cliente. Render y decodificación quedan detrás.
 */
public interface LocalPlayer {

    double getPositionSeconds();

    void seek(double positionSeconds);

    boolean isPlaying();

    void play();

    void pause();

    double getSpeed();

    void setSpeed(double speedMultiplier);

    // null mientras no se conozca
    Double getDurationSeconds();
}
