package com.rebenew.stageParty.syncserver.service;

import com.rebenew.stageParty.syncserver.core.MemberSession;
import com.rebenew.stageParty.syncserver.core.Stage;
import com.rebenew.stageParty.syncserver.core.StageSessionManager;
import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lado servidor del reloj de reproducción: heartbeats del host y acciones de transporte o visuales.
 */
@Service
public class PlaybackSyncService {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackSyncService.class);

    private final StageSessionManager sessionManager;

    public PlaybackSyncService(StageSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    public void setAudioSource(MemberSession member, ClientCommand.SetAudioSource command) {
        Stage stage = sessionManager.currentStage(member);
        stage.setAudioSource(member.getMemberId(), command.audioSource(), command.analysisResult());
    }

    public PlaybackSnapshot applyHeartbeat(MemberSession member, ClientCommand.SyncHeartbeat command) {
        Stage stage = sessionManager.currentStage(member);
        return stage.applyHeartbeat(member.getMemberId(), command.positionSeconds(), command.isPlaying(),
                command.speedMultiplier());
    }

    public void applyHostAction(MemberSession member, ClientCommand.HostAction command) {
        Stage stage = sessionManager.currentStage(member);
        stage.applyHostAction(member.getMemberId(), command.kind(), command.payload());
        logger.debug("🎛️ {} applied {} in stage {}", member.getMemberId(), command.kind(), stage.getId());
    }
}
