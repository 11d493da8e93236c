package com.rebenew.stageParty.syncserver.client;

import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sigue al host: en cada tick compara el reproductor local con el último snapshot
 * y lo corrige. El snapshot de la unión se trata como cualquier heartbeat.
 */
public class AudiencePlaybackMode implements PlaybackMode {
    private static final Logger logger = LoggerFactory.getLogger(AudiencePlaybackMode.class);

    private final LocalPlayer player;
    private final DriftCorrector driftCorrector;

    private volatile PlaybackSnapshot lastSnapshot;

    public AudiencePlaybackMode(LocalPlayer player, DriftCorrector driftCorrector) {
        this.player = player;
        this.driftCorrector = driftCorrector;
    }

    @Override
    public void onSnapshot(PlaybackSnapshot snapshot) {
        if (snapshot != null) {
            lastSnapshot = snapshot;
        }
    }

    @Override
    public void onTick(long nowMillis) {
        tick(nowMillis);
    }

    /**
     * @return la corrección aplicada, null si todavía no llegó ningún snapshot
     */
    public DriftCorrection tick(long nowMillis) {
        PlaybackSnapshot snapshot = lastSnapshot;
        if (snapshot == null) {
            return null;
        }
        DriftCorrection correction = driftCorrector.evaluate(snapshot, player.getPositionSeconds(), nowMillis,
                player.getDurationSeconds());

        if (player.getSpeed() != correction.speedMultiplier()) {
            player.setSpeed(correction.speedMultiplier());
        }
        if (correction.needsSeek()) {
            logger.debug("{} to {}s (drift {}s)", correction.action(), correction.targetSeconds(),
                    correction.driftSeconds());
            player.seek(correction.targetSeconds());
        }
        if (correction.isPlaying() && !player.isPlaying()) {
            player.play();
        } else if (!correction.isPlaying() && player.isPlaying()) {
            player.pause();
        }
        return correction;
    }

    public PlaybackSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    @Override
    public void stop() {
        lastSnapshot = null;
    }
}
