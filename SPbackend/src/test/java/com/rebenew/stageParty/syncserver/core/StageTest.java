package com.rebenew.stageParty.syncserver.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rebenew.stageParty.syncserver.config.StageProperties;
import com.rebenew.stageParty.syncserver.exception.StageErrorCode;
import com.rebenew.stageParty.syncserver.model.AudioSource;
import com.rebenew.stageParty.syncserver.model.ChatMessage;
import com.rebenew.stageParty.syncserver.model.ConnectionState;
import com.rebenew.stageParty.syncserver.model.HostActionKind;
import com.rebenew.stageParty.syncserver.model.Member;
import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;
import com.rebenew.stageParty.syncserver.model.QueueItem;
import com.rebenew.stageParty.syncserver.model.QueueItemStatus;
import com.rebenew.stageParty.syncserver.model.StageState;
import com.rebenew.stageParty.syncserver.model.Suggestion;
import com.rebenew.stageParty.syncserver.model.SuggestionDecision;
import com.rebenew.stageParty.syncserver.model.TrackInfo;
import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import com.rebenew.stageParty.syncserver.support.MutableClock;
import com.rebenew.stageParty.syncserver.support.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StageTest {

    private static final String HOST = "host-1";
    private static final String ANA = "ana-1";
    private static final String BO = "bo-1";

    private MutableClock clock;
    private RecordingSink sink;
    private StageProperties properties;
    private Stage stage;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        sink = new RecordingSink();
        properties = new StageProperties();
        stage = new Stage("stage-1", Member.host(HOST, "Hana"), "Night Set", properties, clock, sink);
    }

    private void openWithAudience(String... audience) {
        stage.togglePublic(HOST);
        for (String memberId : audience) {
            stage.join(memberId, memberId.substring(0, memberId.indexOf('-')), null);
        }
        sink.clear();
    }

    private static ObjectNode payload() {
        return JsonNodeFactory.instance.objectNode();
    }

    @Test
    void newStageIsLivePrivateAndPausedAtZero() {
        assertThat(stage.getState()).isEqualTo(StageState.LIVE);
        assertThat(stage.isPublic()).isFalse();
        assertThat(stage.getName()).isEqualTo("Night Set");
        assertThat(stage.getPlaybackSnapshot().positionSeconds()).isZero();
        assertThat(stage.getPlaybackSnapshot().isPlaying()).isFalse();
        assertThat(stage.getAudienceCount()).isZero();
        assertThat(stage.getMembers()).extracting(Member::id).containsExactly(HOST);
    }

    @Test
    void blankNameFallsBackToHostName() {
        Stage unnamed = new Stage("stage-2", Member.host(HOST, "Hana"), "   ", properties, clock, sink);

        assertThat(unnamed.getName()).isEqualTo("Hana's Stage");
    }

    // ==================== MEMBRESÍA ====================

    @Test
    void privateStageCannotBeJoined() {
        assertThatThrownBy(() -> stage.join(ANA, "Ana", null))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.FORBIDDEN);
        assertThat(stage.hasMember(ANA)).isFalse();
    }

    @Test
    void joinSendsFullStateAndAnnouncesToOthers() {
        stage.togglePublic(HOST);
        stage.join(BO, "Bo", null);
        sink.clear();

        stage.join(ANA, "Ana", null);

        ServerEvent.SessionJoined joined = sink.to(ANA, ServerEvent.SessionJoined.class).get(0);
        assertThat(joined.session().id()).isEqualTo("stage-1");
        assertThat(joined.members()).extracting(Member::id).containsExactly(HOST, BO, ANA);
        assertThat(joined.chatLog()).extracting(ChatMessage::text).contains("Ana joined the stage");

        ServerEvent.MemberJoined announced = sink.to(HOST, ServerEvent.MemberJoined.class).get(0);
        assertThat(announced.systemMessage().isSystem()).isTrue();
        assertThat(sink.to(BO, ServerEvent.MemberJoined.class)).hasSize(1);
        assertThat(sink.to(ANA, ServerEvent.MemberJoined.class)).isEmpty();
        assertThat(stage.getAudienceCount()).isEqualTo(2);
    }

    @Test
    void leaveDropsPendingSuggestionAndTellsEveryone() {
        openWithAudience(ANA, BO);
        stage.suggest(ANA, "Song", "youtube", "https://example.org/s");
        sink.clear();

        assertThat(stage.leave(ANA)).isTrue();

        assertThat(sink.to(HOST, ServerEvent.MemberLeft.class)).hasSize(1);
        ServerEvent.QueueUpdated update = sink.to(BO, ServerEvent.QueueUpdated.class).get(0);
        assertThat(update.suggestions()).isEmpty();
        assertThat(stage.leave(ANA)).isFalse();
    }

    @Test
    void hostCannotLeaveItsOwnStage() {
        assertThatThrownBy(() -> stage.leave(HOST))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_COMMAND);
    }

    @Test
    void renameMemberUpdatesHostNameInSummary() {
        openWithAudience(ANA);

        stage.renameMember(HOST, "DJ Hana");

        assertThat(stage.summary().hostName()).isEqualTo("DJ Hana");
        assertThat(sink.to(ANA, ServerEvent.MemberRenamed.class)).hasSize(1);
    }

    // ==================== AUTORIDAD ====================

    @Test
    void audienceCannotIssueHostCommands() {
        openWithAudience(ANA);
        PlaybackSnapshot before = stage.getPlaybackSnapshot();

        assertThatThrownBy(() -> stage.applyHeartbeat(ANA, 10.0, true, 1.0))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> stage.applyHostAction(ANA, HostActionKind.PLAY, null))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> stage.rename(ANA, "Mine now"))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> stage.togglePublic(ANA))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> stage.enqueue(ANA, "Song", "upload", "/x"))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> stage.reorderQueue(ANA, List.of()))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.FORBIDDEN);

        assertThat(stage.getPlaybackSnapshot()).isEqualTo(before);
        assertThat(stage.getName()).isEqualTo("Night Set");
        assertThat(stage.isPublic()).isTrue();
        assertThat(sink.total()).isZero();
    }

    @Test
    void renameRejectsBlankAndTruncatesLongNames() {
        assertThatThrownBy(() -> stage.rename(HOST, "  "))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_COMMAND);

        stage.rename(HOST, "x".repeat(80));

        assertThat(stage.getName()).hasSize(properties.getNames().getStageMax());
    }

    @Test
    void nowPlayingShowsUpInSummary() {
        TrackInfo track = new TrackInfo("Blue", "Someone", "youtube", "https://example.org/blue");

        stage.updateNowPlaying(HOST, track);

        assertThat(stage.summary().nowPlaying()).isEqualTo(track);
        assertThat(sink.to(HOST, ServerEvent.SessionUpdated.class)).hasSize(1);
    }

    // ==================== PLAYBACK ====================

    @Test
    void heartbeatIsStampedWithServerClockAndRelayedToAudienceOnly() {
        openWithAudience(ANA);

        PlaybackSnapshot snapshot = stage.applyHeartbeat(HOST, 42.0, true, 1.25);

        assertThat(snapshot.capturedAt()).isEqualTo(clock.millis());
        ServerEvent.SyncSnapshot relayed = sink.to(ANA, ServerEvent.SyncSnapshot.class).get(0);
        assertThat(relayed.positionSeconds()).isEqualTo(42.0);
        assertThat(relayed.isPlaying()).isTrue();
        assertThat(relayed.speedMultiplier()).isEqualTo(1.25);
        assertThat(sink.to(HOST)).isEmpty();
    }

    @Test
    void heartbeatWithMissingFieldsOrBadSpeedIsRejected() {
        assertThatThrownBy(() -> stage.applyHeartbeat(HOST, null, true, 1.0))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_COMMAND);
        assertThatThrownBy(() -> stage.applyHeartbeat(HOST, 1.0, true, 0.0))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_COMMAND);
        assertThat(stage.getPlaybackSnapshot().positionSeconds()).isZero();
    }

    @Test
    void heartbeatPastKnownDurationIsClamped() {
        stage.setAudioSource(HOST, new AudioSource("upload", "/rooms/uploads/a.mp3", "A", 180.0), null);

        PlaybackSnapshot snapshot = stage.applyHeartbeat(HOST, 200.0, true, 1.0);

        assertThat(snapshot.positionSeconds()).isEqualTo(180.0);
    }

    @Test
    void seekMovesClockAndIsFollowedBySnapshot() {
        openWithAudience(ANA);

        stage.applyHostAction(HOST, HostActionKind.SEEK, payload().put("positionSeconds", 90.0));

        assertThat(stage.getPlaybackSnapshot().positionSeconds()).isEqualTo(90.0);
        List<ServerEvent> received = sink.to(ANA);
        assertThat(received).hasSize(2);
        assertThat(received.get(0)).isInstanceOf(ServerEvent.HostActionBroadcast.class);
        assertThat(received.get(1)).isInstanceOf(ServerEvent.SyncSnapshot.class);
    }

    @Test
    void playAndPauseToggleClock() {
        stage.applyHostAction(HOST, HostActionKind.PLAY, payload().put("positionSeconds", 5.0));
        clock.advance(Duration.ofSeconds(4));

        stage.applyHostAction(HOST, HostActionKind.PAUSE, null);

        PlaybackSnapshot paused = stage.getPlaybackSnapshot();
        assertThat(paused.isPlaying()).isFalse();
        assertThat(paused.positionSeconds()).isCloseTo(9.0, within(1e-9));
    }

    @Test
    void speedChangeRequiresPositiveSpeed() {
        assertThatThrownBy(() -> stage.applyHostAction(HOST, HostActionKind.SPEED_CHANGE, payload().put("speed", 0)))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_COMMAND);
        assertThatThrownBy(() -> stage.applyHostAction(HOST, HostActionKind.SEEK, payload()))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_COMMAND);

        stage.applyHostAction(HOST, HostActionKind.SPEED_CHANGE, payload().put("speedMultiplier", 1.5));

        assertThat(stage.getPlaybackSnapshot().speedMultiplier()).isEqualTo(1.5);
    }

    @Test
    void visualizerActionsAreRememberedWithoutSnapshot() {
        openWithAudience(ANA);

        stage.applyHostAction(HOST, HostActionKind.SHAPE_CHANGE, payload().put("shape", "torus"));
        ObjectNode eq = payload();
        eq.putObject("audioTuning").put("bass", 1.8);
        stage.applyHostAction(HOST, HostActionKind.EQ_CHANGE, eq);

        assertThat(stage.getVisualizerSnapshot().shape()).isEqualTo("torus");
        assertThat(stage.getVisualizerSnapshot().audioTuning().bass()).isEqualTo(1.8);
        assertThat(stage.getVisualizerSnapshot().audioTuning().mid()).isEqualTo(1.0);
        assertThat(sink.to(ANA, ServerEvent.SyncSnapshot.class)).isEmpty();
        assertThat(sink.to(ANA, ServerEvent.HostActionBroadcast.class)).hasSize(2);

        stage.applyHostAction(HOST, HostActionKind.RESET, null);
        assertThat(stage.getVisualizerSnapshot().shape()).isEqualTo("sphere");
    }

    @Test
    void newAudioSourceRestartsPaused() {
        openWithAudience(ANA);
        stage.applyHeartbeat(HOST, 60.0, true, 1.0);
        sink.clear();

        stage.setAudioSource(HOST, new AudioSource("upload", "/rooms/uploads/b.mp3", "B", null), null);

        assertThat(stage.getPlaybackSnapshot().positionSeconds()).isZero();
        assertThat(stage.getPlaybackSnapshot().isPlaying()).isFalse();
        List<ServerEvent> received = sink.to(ANA);
        assertThat(received.get(0)).isInstanceOf(ServerEvent.AudioSourceChanged.class);
        assertThat(received.get(1)).isInstanceOf(ServerEvent.SyncSnapshot.class);
        assertThatThrownBy(() -> stage.setAudioSource(HOST, null, null))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_COMMAND);
    }

    // ==================== PRESENCIA DEL HOST ====================

    @Nested
    class WhileHostAway {

        @BeforeEach
        void hostStepsAwayWhilePlaying() {
            openWithAudience(ANA);
            stage.applyHeartbeat(HOST, 10.0, true, 1.0);
            clock.advance(Duration.ofSeconds(5));
            sink.clear();
            stage.hostStepAway();
        }

        @Test
        void stageKeepsRunningFromExtrapolatedSnapshot() {
            assertThat(stage.getState()).isEqualTo(StageState.HOST_AWAY);
            assertThat(stage.getPlaybackSnapshot().positionSeconds()).isCloseTo(15.0, within(1e-9));
            assertThat(sink.to(ANA, ServerEvent.SessionUpdated.class)).hasSize(1);
            assertThat(sink.to(HOST)).isEmpty();
        }

        @Test
        void hostGetsNoInStageTraffic() {
            stage.postChat(ANA, "anyone here?");

            assertThat(sink.to(ANA, ServerEvent.ChatPosted.class)).hasSize(1);
            assertThat(sink.to(HOST)).isEmpty();
        }

        @Test
        void fallbackHeartbeatKeepsAudienceFresh() {
            clock.advance(Duration.ofSeconds(2));

            assertThat(stage.emitFallbackHeartbeat()).isTrue();

            ServerEvent.SyncSnapshot tick = sink.to(ANA, ServerEvent.SyncSnapshot.class).get(0);
            assertThat(tick.positionSeconds()).isCloseTo(17.0, within(1e-9));
            assertThat(tick.capturedAt()).isEqualTo(clock.millis());
        }

        @Test
        void suggestionWaitsInQueueForAbsentHost() {
            Suggestion suggestion = stage.suggest(ANA, "Song", "youtube", "https://example.org/s");

            assertThat(sink.to(HOST)).isEmpty();
            assertThat(stage.snapshot().suggestions()).containsExactly(suggestion);
        }

        @Test
        void returnRestoresAuthorityAndFullState() {
            stage.hostDisconnected();
            stage.hostReturned();

            assertThat(stage.getState()).isEqualTo(StageState.LIVE);
            ServerEvent.ReturnedToSession returned = sink.to(HOST, ServerEvent.ReturnedToSession.class).get(0);
            assertThat(returned.needsAudioReload()).isFalse();
            assertThat(returned.members()).filteredOn(Member::isHost)
                    .extracting(Member::connectionState).containsExactly(ConnectionState.CONNECTED);
            assertThat(sink.to(ANA, ServerEvent.SyncSnapshot.class)).isNotEmpty();
            assertThat(stage.emitFallbackHeartbeat()).isFalse();
        }
    }

    @Test
    void fallbackHeartbeatIsSilentWhileHostIsPresent() {
        stage.applyHeartbeat(HOST, 10.0, true, 1.0);

        assertThat(stage.emitFallbackHeartbeat()).isFalse();
    }

    @Test
    void returnAfterAudioWasSetAsksForReload() {
        stage.setAudioSource(HOST, new AudioSource("upload", "/rooms/uploads/a.mp3", "A", 120.0), null);
        stage.hostStepAway();
        sink.clear();

        stage.hostReturned();

        assertThat(sink.to(HOST, ServerEvent.ReturnedToSession.class).get(0).needsAudioReload()).isTrue();
    }

    @Test
    void closeNotifiesEveryoneAndRejectsFurtherCommands() {
        openWithAudience(ANA, BO);

        List<String> notified = stage.close("Host ended the stage");

        assertThat(notified).containsExactlyInAnyOrder(HOST, ANA, BO);
        assertThat(sink.to(ANA, ServerEvent.SessionClosed.class).get(0).reason()).isEqualTo("Host ended the stage");
        assertThat(stage.getState()).isEqualTo(StageState.CLOSED);
        assertThatThrownBy(() -> stage.checkJoinable(ANA))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> stage.applyHeartbeat(HOST, 1.0, true, 1.0))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.NOT_FOUND);
        assertThat(stage.close("again")).isEmpty();
    }

    // ==================== CHAT ====================

    @Test
    void chatIsTrimmedCappedAndBlankIgnored() {
        openWithAudience(ANA);

        stage.postChat(ANA, "   ");
        stage.postChat(ANA, "  hi  ");
        stage.postChat(HOST, "x".repeat(600));

        List<ServerEvent.ChatPosted> posted = sink.to(ANA, ServerEvent.ChatPosted.class);
        assertThat(posted).hasSize(2);
        assertThat(posted.get(0).message().text()).isEqualTo("hi");
        assertThat(posted.get(0).message().isHost()).isFalse();
        assertThat(posted.get(1).message().text()).hasSize(500);
        assertThat(posted.get(1).message().isHost()).isTrue();
    }

    @Test
    void chatHistoryIsCutBackWhenItOverflows() {
        for (int i = 0; i <= 200; i++) {
            stage.postChat(HOST, "msg " + i);
        }

        List<ChatMessage> log = stage.getChatLog();
        assertThat(log).hasSize(100);
        assertThat(log.get(log.size() - 1).text()).isEqualTo("msg 200");
        assertThat(log.get(0).text()).isEqualTo("msg 101");
    }

    @Test
    void strangersCannotChat() {
        assertThatThrownBy(() -> stage.postChat(ANA, "hello"))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.NOT_FOUND);
    }

    // ==================== COLA Y SUGERENCIAS ====================

    @Test
    void suggestionRoundTripBetweenAudienceAndHost() {
        openWithAudience(ANA);

        Suggestion suggestion = stage.suggest(ANA, "Song A", "youtube", "https://example.org/a");

        assertThat(sink.to(HOST, ServerEvent.SuggestionCreated.class)).hasSize(1);
        assertThat(sink.to(ANA, ServerEvent.SuggestionSent.class).get(0).suggestion()).isEqualTo(suggestion);
        assertThatThrownBy(() -> stage.suggest(ANA, "Song B", "youtube", "https://example.org/b"))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.DUPLICATE_PENDING);
        assertThat(stage.snapshot().suggestions()).hasSize(1);

        StageQueue.Resolution resolution = stage.respondToSuggestion(HOST, suggestion.id(), SuggestionDecision.APPROVE);

        ServerEvent.SuggestionResolved resolved = sink.to(ANA, ServerEvent.SuggestionResolved.class).get(0);
        assertThat(resolved.decision()).isEqualTo(SuggestionDecision.APPROVE);
        assertThat(stage.snapshot().queue()).extracting(QueueItem::id).containsExactly(resolution.queuedItem().id());
        assertThat(stage.snapshot().suggestions()).isEmpty();
    }

    @Test
    void hostCannotSuggest() {
        assertThatThrownBy(() -> stage.suggest(HOST, "Song", "youtube", "https://example.org/s"))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.FORBIDDEN);
    }

    @Test
    void removingPlayingItemStartsNext() {
        openWithAudience(ANA);
        QueueItem first = stage.enqueue(HOST, "One", "upload", "/1");
        QueueItem second = stage.enqueue(HOST, "Two", "upload", "/2");
        stage.advanceQueue(HOST);
        sink.clear();

        QueueItem removed = stage.removeItem(HOST, first.id());

        assertThat(removed.status()).isEqualTo(QueueItemStatus.PLAYING);
        ServerEvent.QueuePlayNext next = sink.to(ANA, ServerEvent.QueuePlayNext.class).get(0);
        assertThat(next.item().id()).isEqualTo(second.id());
        List<ServerEvent> received = sink.to(ANA);
        assertThat(received.get(0)).isInstanceOf(ServerEvent.QueueUpdated.class);
    }

    @Test
    void advanceAnnouncesNextItem() {
        openWithAudience(ANA);
        QueueItem first = stage.enqueue(HOST, "One", "upload", "/1");
        sink.clear();

        assertThat(stage.advanceQueue(HOST)).map(QueueItem::id).contains(first.id());
        assertThat(sink.to(ANA, ServerEvent.QueuePlayNext.class)).hasSize(1);

        sink.clear();
        assertThat(stage.advanceQueue(HOST)).isEmpty();
        assertThat(sink.to(ANA, ServerEvent.QueuePlayNext.class)).isEmpty();
        assertThat(sink.to(ANA, ServerEvent.QueueUpdated.class)).hasSize(1);
    }
}
