package com.rebenew.stageParty.syncserver.view;

import com.rebenew.stageParty.syncserver.core.MemberSession;
import com.rebenew.stageParty.syncserver.core.StageSessionManager;
import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;
import org.springframework.stereotype.Component;

/**
 * Fuera de cualquier stage (lobby, o host en el menú): solo tiene sentido navegar.
 */
@Component
public class LobbyView extends BaseSessionView {

    public LobbyView(StageSessionManager sessionManager) {
        super(sessionManager);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.RenameSession command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.TogglePublic command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.UpdateNowPlaying command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SendChat command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SetAudioSource command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SyncHeartbeat command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.HostAction command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueAdd command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueRemove command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueReorder command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueAdvance command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.QueueUpdateItem command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SuggestSong command) {
        throw notOnStage();
    }

    @Override
    public void handle(MemberSession member, ClientCommand.RespondSuggestion command) {
        throw notOnStage();
    }

    private static StageException notOnStage() {
        return StageException.notFound("You are not on a stage");
    }
}
