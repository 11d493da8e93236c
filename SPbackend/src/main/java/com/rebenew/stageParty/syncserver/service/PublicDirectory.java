package com.rebenew.stageParty.syncserver.service;

import com.rebenew.stageParty.syncserver.core.MemberRegistry;
import com.rebenew.stageParty.syncserver.core.StageLifecycleEvent;
import com.rebenew.stageParty.syncserver.core.StageRegistry;
import com.rebenew.stageParty.syncserver.model.StageSummary;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Proyección de solo lectura de los stages públicos, servida por REST y enviada a todos
 * los miembros conectados cada vez que cambia un stage público.
 */
@Service
public class PublicDirectory {
    private static final Logger logger = LoggerFactory.getLogger(PublicDirectory.class);

    private final StageRegistry stageRegistry;
    private final MemberRegistry memberRegistry;

    public PublicDirectory(StageRegistry stageRegistry, MemberRegistry memberRegistry) {
        this.stageRegistry = stageRegistry;
        this.memberRegistry = memberRegistry;
    }

    public List<StageSummary> list() {
        return stageRegistry.publicSummaries();
    }

    @EventListener
    public void onStageEvent(StageLifecycleEvent event) {
        if (!event.isDirectoryRelevant()) {
            return;
        }
        List<StageSummary> list = list();
        memberRegistry.broadcastAll(new ServerEvent.PublicSessions(list));
        logger.debug("📣 Public directory pushed after {} of {} ({} public)", event.getAction(),
                event.getStageId(), list.size());
    }
}
