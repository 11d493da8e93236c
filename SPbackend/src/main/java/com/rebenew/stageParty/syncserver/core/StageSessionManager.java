package com.rebenew.stageParty.syncserver.core;

import com.rebenew.stageParty.syncserver.config.StageProperties;
import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.model.Member;
import com.rebenew.stageParty.syncserver.model.MemberPhase;
import com.rebenew.stageParty.syncserver.model.StageSummary;
import com.rebenew.stageParty.syncserver.model.TrackInfo;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Mueve a los miembros entre el lobby, su propio stage y otros stages, y gestiona los
 * timers que deciden cuándo se da por perdido a un miembro desconectado o a un host ausente.
 * <p>
 * Orden de locks: stage antes que miembro. Los métodos de Stage nunca llaman aquí.
 */
@Service
public class StageSessionManager {

    private static final Logger logger = LoggerFactory.getLogger(StageSessionManager.class);

    static final String REASON_HOST_ENDED = "Host ended the stage";
    static final String REASON_HOST_TIMEOUT = "Host left the stage";
    static final String REASON_REPLACED = "Host started a new stage";
    static final String REASON_SHUTDOWN = "Server shutting down";

    private final StageRegistry stages;
    private final MemberRegistry members;
    private final StageProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ApplicationEventPublisher events;

    private final Map<String, ScheduledFuture<?>> hostExpiries = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> memberExpiries = new ConcurrentHashMap<>();

    public StageSessionManager(StageRegistry stages, MemberRegistry members, StageProperties properties,
                               Clock clock, ScheduledExecutorService scheduler,
                               ApplicationEventPublisher events) {
        this.stages = stages;
        this.members = members;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
        this.events = events;
    }

    // ==================== CONEXIONES ====================

    /**
     * Registra una conexión nueva. Un {@code requestedMemberId} conocido recupera su identidad,
     * sus stages y sus timers; cualquier otro recibe un miembro nuevo.
     */
    public MemberSession connect(String requestedMemberId, Outbox outbox) {
        if (requestedMemberId != null && !requestedMemberId.isBlank()) {
            Optional<MemberSession> resumed = members.resume(requestedMemberId, outbox);
            if (resumed.isPresent()) {
                MemberSession member = resumed.get();
                cancel(memberExpiries, member.getMemberId());
                logger.info("🔄 Member {} resumed ({})", member.getMemberId(), member.getPhase());
                member.send(new ServerEvent.Connected(member.getMemberId(), stages.publicSummaries(), true));
                restore(member);
                return member;
            }
            logger.debug("Unknown memberId {} presented, issuing a new one", requestedMemberId);
        }
        MemberSession member = members.register(outbox);
        member.send(new ServerEvent.Connected(member.getMemberId(), stages.publicSummaries(), false));
        return member;
    }

    private void restore(MemberSession member) {
        String ownedId = member.getOwnedStageId();
        if (ownedId != null) {
            Optional<Stage> owned = stages.find(ownedId);
            if (owned.isEmpty()) {
                member.stageClosed(ownedId);
            } else {
                cancel(hostExpiries, ownedId);
                if (member.getPhase() == MemberPhase.HOSTING) {
                    owned.get().hostReturned();
                    events.publishEvent(StageLifecycleEvent.hostReturned(this, owned.get()));
                } else {
                    owned.get().hostReconnected();
                }
            }
        }

        if (member.isVisitor()) {
            String visitedId = member.getCurrentStageId();
            try {
                stages.require(visitedId).resync(member.getMemberId(), ownedSummary(member));
            } catch (StageException e) {
                logger.info("Member {} lost its place in stage {}: {}", member.getMemberId(), visitedId, e.getMessage());
                member.leaveCurrentStage();
                member.send(new ServerEvent.LeftSession());
            }
        }

        if (member.getPhase() == MemberPhase.ON_MENU) {
            member.send(new ServerEvent.WentToMenu(ownedSummary(member)));
        }
    }

    /**
     * Gestiona una conexión cerrada. Se ignora si el miembro ya pasó a una conexión más nueva.
     */
    public void disconnect(MemberSession member, Outbox outbox) {
        if (!member.detach(outbox)) {
            logger.debug("Stale close for member {}, already on a newer connection", member.getMemberId());
            return;
        }
        logger.info("🔌 Member {} disconnected ({})", member.getMemberId(), member.getPhase());

        String ownedId = member.getOwnedStageId();
        if (ownedId != null) {
            stages.find(ownedId).ifPresent(stage -> {
                stage.hostDisconnected();
                scheduleHostExpiry(ownedId);
                events.publishEvent(StageLifecycleEvent.hostAway(this, stage));
            });
        }
        if (member.isVisitor()) {
            stages.find(member.getCurrentStageId())
                    .ifPresent(stage -> stage.markDisconnected(member.getMemberId()));
        }
        scheduleMemberExpiry(member.getMemberId());
    }

    /**
     * Venció el periodo de gracia: saca al miembro del stage que estaba viendo. El registro
     * se borra salvo que siga siendo dueño de un stage que espera a su host.
     */
    public void expireMember(String memberId) {
        memberExpiries.remove(memberId);
        MemberSession member = members.find(memberId).orElse(null);
        if (member == null || member.isConnected()) {
            return;
        }
        if (member.isVisitor()) {
            leaveVisitedStage(member);
        }
        if (member.getOwnedStageId() == null) {
            members.remove(memberId);
            logger.info("🧹 Member {} expired", memberId);
        }
    }

    /**
     * Venció la espera del host: cierra el stage salvo que el host haya vuelto.
     */
    public void expireHostAway(String stageId) {
        hostExpiries.remove(stageId);
        Stage stage = stages.find(stageId).orElse(null);
        if (stage == null) {
            return;
        }
        Optional<MemberSession> host = members.find(stage.getHostMemberId());
        if (host.isPresent() && host.get().isConnected()) {
            return;
        }
        logger.warn("⏰ Host of stage {} did not come back, closing", stageId);
        closeStage(stage, REASON_HOST_TIMEOUT);
        host.ifPresent(h -> {
            if (!h.isConnected() && h.getCurrentStageId() == null) {
                members.remove(h.getMemberId());
            }
        });
    }

    // ==================== LOBBY ====================

    public void setDisplayName(MemberSession member, String requestedName) {
        String name = NameRules.displayName(requestedName, properties.getNames().getDisplayMax());
        member.setDisplayName(name);
        member.send(new ServerEvent.DisplayNameSet(name));

        Set<String> stageIds = new LinkedHashSet<>();
        if (member.getCurrentStageId() != null) {
            stageIds.add(member.getCurrentStageId());
        }
        if (member.getOwnedStageId() != null) {
            stageIds.add(member.getOwnedStageId());
        }
        for (String stageId : stageIds) {
            stages.find(stageId).ifPresent(stage -> {
                stage.renameMember(member.getMemberId(), name);
                if (stage.getHostMemberId().equals(member.getMemberId())) {
                    events.publishEvent(StageLifecycleEvent.updated(this, stage));
                }
            });
        }
    }

    /**
     * Crea un stage cuyo dueño es {@code member}. Si ya tenía uno, primero lo termina.
     */
    public Stage createStage(MemberSession member, String requestedName) {
        if (member.isVisitor()) {
            leaveVisitedStage(member);
        }
        String previousOwnedId = member.getOwnedStageId();
        if (previousOwnedId != null) {
            stages.find(previousOwnedId).ifPresent(owned -> closeStage(owned, REASON_REPLACED));
            member.stageClosed(previousOwnedId);
        }

        Stage stage = new Stage(StageIds.next(), Member.host(member.getMemberId(), member.getDisplayName()),
                requestedName, properties, clock, members);
        stages.register(stage);
        member.takeOwnership(stage.getId());
        member.send(new ServerEvent.SessionCreated(stage.snapshot(), stage.getMembers()));
        events.publishEvent(StageLifecycleEvent.created(this, stage));
        return stage;
    }

    public void joinStage(MemberSession member, String stageId) {
        if (stageId == null || stageId.isBlank()) {
            throw StageException.invalidCommand("sessionId is required");
        }
        if (stageId.equals(member.getOwnedStageId())) {
            returnToStage(member);
            return;
        }
        Stage target = stages.require(stageId);
        if (stageId.equals(member.getCurrentStageId())) {
            target.resync(member.getMemberId(), ownedSummary(member));
            return;
        }
        target.checkJoinable(member.getMemberId());

        stepOut(member);
        try {
            target.join(member.getMemberId(), member.getDisplayName(), ownedSummary(member));
        } catch (StageException e) {
            // Cambió entre la comprobación y el join: el miembro ya salió de donde estaba
            member.send(member.getOwnedStageId() != null
                    ? new ServerEvent.WentToMenu(ownedSummary(member))
                    : new ServerEvent.LeftSession());
            throw e;
        }
        member.enterStage(stageId);
        events.publishEvent(StageLifecycleEvent.audienceChanged(this, target));
    }

    /**
     * Un host que sale de su propio stage va al menú; el stage sigue funcionando.
     */
    public void leaveStage(MemberSession member) {
        switch (member.getPhase()) {
            case HOSTING:
                goToMenu(member);
                break;
            case AUDIENCE:
            case VISITING:
                stepOut(member);
                member.send(new ServerEvent.LeftSession());
                break;
            default:
                throw StageException.notFound("You are not on a stage");
        }
    }

    /**
     * El stage propio queda en HOST_AWAY sin plazo: la espera de {@code hostAwayTimeout} solo
     * corre mientras el host está desconectado.
     */
    public void goToMenu(MemberSession member) {
        stepOut(member);
        member.send(new ServerEvent.WentToMenu(ownedSummary(member)));
    }

    public void returnToStage(MemberSession member) {
        String ownedId = member.getOwnedStageId();
        if (ownedId == null) {
            throw StageException.notFound("You are not hosting a stage");
        }
        Optional<Stage> owned = stages.find(ownedId);
        if (owned.isEmpty()) {
            member.stageClosed(ownedId);
            throw StageException.notFound("Your stage no longer exists");
        }
        if (member.isVisitor()) {
            leaveVisitedStage(member);
        }
        cancel(hostExpiries, ownedId);
        owned.get().hostReturned();
        member.enterStage(ownedId);
        events.publishEvent(StageLifecycleEvent.hostReturned(this, owned.get()));
    }

    public void endStage(MemberSession member) {
        String ownedId = member.getOwnedStageId();
        if (ownedId == null) {
            throw StageException.notFound("You are not hosting a stage");
        }
        Optional<Stage> owned = stages.find(ownedId);
        if (owned.isPresent()) {
            closeStage(owned.get(), REASON_HOST_ENDED);
        } else {
            member.stageClosed(ownedId);
        }
    }

    // ==================== DENTRO DEL STAGE ====================

    public Stage currentStage(MemberSession member) {
        String stageId = member.getCurrentStageId();
        if (stageId == null) {
            throw StageException.notFound("You are not on a stage");
        }
        return stages.find(stageId)
                .orElseThrow(() -> StageException.notFound("Stage no longer exists"));
    }

    public void postChat(MemberSession member, String text) {
        currentStage(member).postChat(member.getMemberId(), text);
    }

    public void renameStage(MemberSession member, String name) {
        Stage stage = currentStage(member);
        stage.rename(member.getMemberId(), name);
        events.publishEvent(StageLifecycleEvent.updated(this, stage));
    }

    public void togglePublic(MemberSession member) {
        Stage stage = currentStage(member);
        stage.togglePublic(member.getMemberId());
        events.publishEvent(StageLifecycleEvent.visibilityChanged(this, stage));
    }

    public void updateNowPlaying(MemberSession member, TrackInfo track) {
        Stage stage = currentStage(member);
        stage.updateNowPlaying(member.getMemberId(), track);
        events.publishEvent(StageLifecycleEvent.updated(this, stage));
    }

    // ==================== INTERNOS ====================

    // Sale del stage actual sin responder nada: el host deja el suyo en HOST_AWAY
    private void stepOut(MemberSession member) {
        String currentId = member.getCurrentStageId();
        if (currentId == null) {
            return;
        }
        if (currentId.equals(member.getOwnedStageId())) {
            stages.find(currentId).ifPresent(stage -> {
                stage.hostStepAway();
                events.publishEvent(StageLifecycleEvent.hostAway(this, stage));
            });
            member.leaveCurrentStage();
        } else {
            leaveVisitedStage(member);
        }
    }

    private void leaveVisitedStage(MemberSession member) {
        String visitedId = member.getCurrentStageId();
        member.leaveCurrentStage();
        stages.find(visitedId).ifPresent(stage -> {
            if (stage.leave(member.getMemberId())) {
                events.publishEvent(StageLifecycleEvent.audienceChanged(this, stage));
            }
        });
    }

    private void closeStage(Stage stage, String reason) {
        cancel(hostExpiries, stage.getId());
        for (String memberId : stage.close(reason)) {
            members.find(memberId).ifPresent(m -> m.stageClosed(stage.getId()));
        }
        members.find(stage.getHostMemberId()).ifPresent(m -> m.stageClosed(stage.getId()));
        stages.remove(stage.getId());
        events.publishEvent(StageLifecycleEvent.closed(this, stage));
        logger.info("🛑 Stage {} closed: {}", stage.getId(), reason);
    }

    private StageSummary ownedSummary(MemberSession member) {
        return stages.find(member.getOwnedStageId()).map(Stage::summary).orElse(null);
    }

    private void scheduleHostExpiry(String stageId) {
        long delayMs = properties.getHostAwayTimeout().toMillis();
        ScheduledFuture<?> future = scheduler.schedule(() -> expireHostAway(stageId), delayMs, TimeUnit.MILLISECONDS);
        replace(hostExpiries, stageId, future);
    }

    private void scheduleMemberExpiry(String memberId) {
        long delayMs = properties.getMemberGracePeriod().toMillis();
        ScheduledFuture<?> future = scheduler.schedule(() -> expireMember(memberId), delayMs, TimeUnit.MILLISECONDS);
        replace(memberExpiries, memberId, future);
    }

    private void replace(Map<String, ScheduledFuture<?>> timers, String key, ScheduledFuture<?> future) {
        ScheduledFuture<?> previous = timers.put(key, future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void cancel(Map<String, ScheduledFuture<?>> timers, String key) {
        ScheduledFuture<?> future = timers.remove(key);
        if (future != null) {
            future.cancel(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        logger.info("🛑 Closing {} stages", stages.size());
        for (Stage stage : stages.all()) {
            closeStage(stage, REASON_SHUTDOWN);
        }
        hostExpiries.values().forEach(f -> f.cancel(false));
        memberExpiries.values().forEach(f -> f.cancel(false));
        hostExpiries.clear();
        memberExpiries.clear();
    }
}
