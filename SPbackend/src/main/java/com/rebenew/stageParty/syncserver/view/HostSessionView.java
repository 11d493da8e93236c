package com.rebenew.stageParty.syncserver.view;

import com.rebenew.stageParty.syncserver.core.MemberSession;
import com.rebenew.stageParty.syncserver.core.StageSessionManager;
import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;
import com.rebenew.stageParty.syncserver.service.PlaybackSyncService;
import com.rebenew.stageParty.syncserver.service.QueueService;
import org.springframework.stereotype.Component;

/**
 * Un miembro dentro de su propio stage: controla reproducción, ajustes y cola.
 */
@Component
public class HostSessionView extends BaseSessionView {

    private final PlaybackSyncService playbackSyncService;
    private final QueueService queueService;

    public HostSessionView(StageSessionManager sessionManager, PlaybackSyncService playbackSyncService,
                           QueueService queueService) {
        super(sessionManager);
        this.playbackSyncService = playbackSyncService;
        this.queueService = queueService;
    }

    // ==================== AJUSTES ====================

    @Override
    public void handle(MemberSession member, ClientCommand.RenameSession command) {
        sessionManager.renameStage(member, command.name());
    }

    @Override
    public void handle(MemberSession member, ClientCommand.TogglePublic command) {
        sessionManager.togglePublic(member);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.UpdateNowPlaying command) {
        sessionManager.updateNowPlaying(member, command.track());
    }

    // ==================== PLAYBACK ====================

    @Override
    public void handle(MemberSession member, ClientCommand.SetAudioSource command) {
        playbackSyncService.setAudioSource(member, command);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SyncHeartbeat command) {
        playbackSyncService.applyHeartbeat(member, command);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.HostAction command) {
        playbackSyncService.applyHostAction(member, command);
    }

    // ==================== COLA ====================

    @Override
    public void handle(MemberSession member, ClientCommand.QueueAdd command) {
        queueService.addTrack(member, command);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueRemove command) {
        queueService.removeTrack(member, command);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueReorder command) {
        queueService.reorderTail(member, command);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueAdvance command) {
        queueService.advance(member);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueUpdateItem command) {
        queueService.updateItem(member, command);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.RespondSuggestion command) {
        queueService.respond(member, command);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SuggestSong command) {
        throw StageException.forbidden("Hosts add songs to the queue directly");
    }
}
