package com.rebenew.stageParty.syncserver.view;

import com.rebenew.stageParty.syncserver.core.MemberSession;
import com.rebenew.stageParty.syncserver.core.StageSessionManager;
import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;
import com.rebenew.stageParty.syncserver.service.QueueService;
import org.springframework.stereotype.Component;

/**
 * Un miembro que mira el stage de otro (también un host de visita en otro stage).
 * Puede chatear y sugerir; todo lo que controla el stage es del host.
 */
@Component
public class AudienceSessionView extends BaseSessionView {

    private final QueueService queueService;

    public AudienceSessionView(StageSessionManager sessionManager, QueueService queueService) {
        super(sessionManager);
        this.queueService = queueService;
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SuggestSong command) {
        queueService.suggest(member, command);
    }

    // ==================== SOLO HOST ====================

    @Override
    public void handle(MemberSession member, ClientCommand.RenameSession command) {
        throw hostOnly("rename the stage");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.TogglePublic command) {
        throw hostOnly("change stage visibility");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.UpdateNowPlaying command) {
        throw hostOnly("set now playing");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SetAudioSource command) {
        throw hostOnly("change the audio source");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SyncHeartbeat command) {
        throw hostOnly("drive playback");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.HostAction command) {
        throw hostOnly("drive playback");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueAdd command) {
        throw hostOnly("add to the queue, suggest a song instead");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueRemove command) {
        throw hostOnly("edit the queue");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueReorder command) {
        throw hostOnly("edit the queue");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueAdvance command) {
        throw hostOnly("edit the queue");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueUpdateItem command) {
        throw hostOnly("edit the queue");
    }

    @Override
    public void handle(MemberSession member, ClientCommand.RespondSuggestion command) {
        throw hostOnly("answer suggestions");
    }

    private static StageException hostOnly(String what) {
        return StageException.forbidden("Only the host can " + what);
    }
}
