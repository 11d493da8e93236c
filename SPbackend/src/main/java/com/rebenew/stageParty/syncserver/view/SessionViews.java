package com.rebenew.stageParty.syncserver.view;

import com.rebenew.stageParty.syncserver.core.MemberSession;
import org.springframework.stereotype.Component;

// Vista según la fase que fijaron create/join/return
@Component
public class SessionViews {

    private final LobbyView lobbyView;
    private final HostSessionView hostView;
    private final AudienceSessionView audienceView;

    public SessionViews(LobbyView lobbyView, HostSessionView hostView, AudienceSessionView audienceView) {
        this.lobbyView = lobbyView;
        this.hostView = hostView;
        this.audienceView = audienceView;
    }

    public SessionView viewFor(MemberSession member) {
        switch (member.getPhase()) {
            case HOSTING:
                return hostView;
            case AUDIENCE:
            case VISITING:
                return audienceView;
            case LOBBY:
            case ON_MENU:
            default:
                return lobbyView;
        }
    }
}
