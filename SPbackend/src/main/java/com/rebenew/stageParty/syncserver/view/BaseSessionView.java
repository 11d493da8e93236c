package com.rebenew.stageParty.syncserver.view;

import com.rebenew.stageParty.syncserver.core.MemberSession;
import com.rebenew.stageParty.syncserver.core.StageSessionManager;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;

/**
 * Navegación y chat funcionan igual para todos los roles.
 */
public abstract class BaseSessionView implements SessionView {

    protected final StageSessionManager sessionManager;

    protected BaseSessionView(StageSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public void handle(MemberSession member, ClientCommand.CreateSession command) {
        sessionManager.createStage(member, command.name());
    }

    @Override
    public void handle(MemberSession member, ClientCommand.JoinSession command) {
        sessionManager.joinStage(member, command.sessionId());
    }

    @Override
    public void handle(MemberSession member, ClientCommand.LeaveSession command) {
        sessionManager.leaveStage(member);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SetDisplayName command) {
        sessionManager.setDisplayName(member, command.name());
    }

    @Override
    public void handle(MemberSession member, ClientCommand.SendChat command) {
        sessionManager.postChat(member, command.text());
    }

    @Override
    public void handle(MemberSession member, ClientCommand.GoToMenu command) {
        sessionManager.goToMenu(member);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.ReturnToSession command) {
        sessionManager.returnToStage(member);
    }

    @Override
    public void handle(MemberSession member, ClientCommand.EndSession command) {
        sessionManager.endStage(member);
    }
}
