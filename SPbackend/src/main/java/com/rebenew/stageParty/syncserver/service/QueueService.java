package com.rebenew.stageParty.syncserver.service;

import com.rebenew.stageParty.syncserver.core.MemberSession;
import com.rebenew.stageParty.syncserver.core.Stage;
import com.rebenew.stageParty.syncserver.core.StageQueue;
import com.rebenew.stageParty.syncserver.core.StageSessionManager;
import com.rebenew.stageParty.syncserver.model.QueueItem;
import com.rebenew.stageParty.syncserver.model.Suggestion;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class QueueService {
    private static final Logger logger = LoggerFactory.getLogger(QueueService.class);

    private final StageSessionManager sessionManager;

    public QueueService(StageSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    public QueueItem addTrack(MemberSession member, ClientCommand.QueueAdd command) {
        Stage stage = sessionManager.currentStage(member);
        QueueItem item = stage.enqueue(member.getMemberId(), command.title(), command.source(), command.url());
        logger.debug("🎵 Track added to stage {}: '{}'", stage.getId(), item.title());
        return item;
    }

    public QueueItem removeTrack(MemberSession member, ClientCommand.QueueRemove command) {
        Stage stage = sessionManager.currentStage(member);
        QueueItem removed = stage.removeItem(member.getMemberId(), command.itemId());
        logger.debug("🗑️ Track removed from stage {}: '{}'", stage.getId(), removed.title());
        return removed;
    }

    public void reorderTail(MemberSession member, ClientCommand.QueueReorder command) {
        Stage stage = sessionManager.currentStage(member);
        stage.reorderQueue(member.getMemberId(), command.tailOrder());
        logger.debug("🔀 Queue tail reordered in stage {}", stage.getId());
    }

    public Optional<QueueItem> advance(MemberSession member) {
        Stage stage = sessionManager.currentStage(member);
        Optional<QueueItem> next = stage.advanceQueue(member.getMemberId());
        logger.debug("⏭️ Stage {} advanced, now playing: {}", stage.getId(),
                next.map(QueueItem::title).orElse("nothing"));
        return next;
    }

    public QueueItem updateItem(MemberSession member, ClientCommand.QueueUpdateItem command) {
        Stage stage = sessionManager.currentStage(member);
        return stage.updateQueueItem(member.getMemberId(), command.itemId(), command.status(),
                command.analysisResult());
    }

    public Suggestion suggest(MemberSession member, ClientCommand.SuggestSong command) {
        Stage stage = sessionManager.currentStage(member);
        return stage.suggest(member.getMemberId(), command.title(), command.source(), command.url());
    }

    public StageQueue.Resolution respond(MemberSession member, ClientCommand.RespondSuggestion command) {
        Stage stage = sessionManager.currentStage(member);
        return stage.respondToSuggestion(member.getMemberId(), command.suggestionId(), command.decision());
    }
}
