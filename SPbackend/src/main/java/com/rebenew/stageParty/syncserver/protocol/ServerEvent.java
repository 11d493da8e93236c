package com.rebenew.stageParty.syncserver.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.stageParty.syncserver.exception.StageErrorCode;
import com.rebenew.stageParty.syncserver.model.AudioSource;
import com.rebenew.stageParty.syncserver.model.ChatMessage;
import com.rebenew.stageParty.syncserver.model.HostActionKind;
import com.rebenew.stageParty.syncserver.model.Member;
import com.rebenew.stageParty.syncserver.model.PlaybackSnapshot;
import com.rebenew.stageParty.syncserver.model.QueueItem;
import com.rebenew.stageParty.syncserver.model.StageSnapshot;
import com.rebenew.stageParty.syncserver.model.StageSummary;
import com.rebenew.stageParty.syncserver.model.Suggestion;
import com.rebenew.stageParty.syncserver.model.SuggestionDecision;

import java.util.List;

/**
 * Todos los frames que envía el servidor, discriminados por {@code type}.
 * Los comparten el servidor (serialización) y {@code StageClient} (deserialización).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerEvent.Connected.class, name = "connected"),
        @JsonSubTypes.Type(value = ServerEvent.DisplayNameSet.class, name = "display_name_set"),
        @JsonSubTypes.Type(value = ServerEvent.PublicSessions.class, name = "public_sessions"),
        @JsonSubTypes.Type(value = ServerEvent.ErrorNotice.class, name = "error"),
        @JsonSubTypes.Type(value = ServerEvent.SessionCreated.class, name = "session_created"),
        @JsonSubTypes.Type(value = ServerEvent.SessionJoined.class, name = "session_joined"),
        @JsonSubTypes.Type(value = ServerEvent.SessionUpdated.class, name = "session_updated"),
        @JsonSubTypes.Type(value = ServerEvent.SessionClosed.class, name = "session_closed"),
        @JsonSubTypes.Type(value = ServerEvent.LeftSession.class, name = "left_session"),
        @JsonSubTypes.Type(value = ServerEvent.WentToMenu.class, name = "went_to_menu"),
        @JsonSubTypes.Type(value = ServerEvent.ReturnedToSession.class, name = "returned_to_session"),
        @JsonSubTypes.Type(value = ServerEvent.MemberJoined.class, name = "member_joined"),
        @JsonSubTypes.Type(value = ServerEvent.MemberLeft.class, name = "member_left"),
        @JsonSubTypes.Type(value = ServerEvent.MemberRenamed.class, name = "member_renamed"),
        @JsonSubTypes.Type(value = ServerEvent.ChatPosted.class, name = "chat_message"),
        @JsonSubTypes.Type(value = ServerEvent.AudioSourceChanged.class, name = "audio_source"),
        @JsonSubTypes.Type(value = ServerEvent.SyncSnapshot.class, name = "sync_snapshot"),
        @JsonSubTypes.Type(value = ServerEvent.HostActionBroadcast.class, name = "host_action"),
        @JsonSubTypes.Type(value = ServerEvent.QueueUpdated.class, name = "queue_updated"),
        @JsonSubTypes.Type(value = ServerEvent.QueuePlayNext.class, name = "queue_play_next"),
        @JsonSubTypes.Type(value = ServerEvent.SuggestionCreated.class, name = "suggestion_created"),
        @JsonSubTypes.Type(value = ServerEvent.SuggestionSent.class, name = "suggestion_sent"),
        @JsonSubTypes.Type(value = ServerEvent.SuggestionResolved.class, name = "suggestion_resolved")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface ServerEvent {

    void dispatch(Handler handler);

    interface Handler {
        void on(Connected event);

        void on(DisplayNameSet event);

        void on(PublicSessions event);

        void on(ErrorNotice event);

        void on(SessionCreated event);

        void on(SessionJoined event);

        void on(SessionUpdated event);

        void on(SessionClosed event);

        void on(LeftSession event);

        void on(WentToMenu event);

        void on(ReturnedToSession event);

        void on(MemberJoined event);

        void on(MemberLeft event);

        void on(MemberRenamed event);

        void on(ChatPosted event);

        void on(AudioSourceChanged event);

        void on(SyncSnapshot event);

        void on(HostActionBroadcast event);

        void on(QueueUpdated event);

        void on(QueuePlayNext event);

        void on(SuggestionCreated event);

        void on(SuggestionSent event);

        void on(SuggestionResolved event);
    }

    // ==================== CONEXIÓN ====================

    record Connected(String memberId, List<StageSummary> publicSessions, boolean resumed) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record DisplayNameSet(String name) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record PublicSessions(List<StageSummary> list) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record ErrorNotice(StageErrorCode code, String message) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    // ==================== CICLO DE VIDA ====================

    record SessionCreated(StageSnapshot session, List<Member> members) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record SessionJoined(
            StageSnapshot session, List<Member> members, List<ChatMessage> chatLog,
            StageSummary ownedSessionSummary
    ) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record SessionUpdated(StageSnapshot session) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record SessionClosed(String sessionId, String reason) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record LeftSession() implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record WentToMenu(StageSummary ownedSessionSummary) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record ReturnedToSession(
            StageSnapshot session, List<Member> members, List<ChatMessage> chatLog,
            boolean needsAudioReload
    ) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    // ==================== MIEMBROS Y CHAT ====================

    record MemberJoined(List<Member> members, ChatMessage systemMessage) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record MemberLeft(List<Member> members, ChatMessage systemMessage) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record MemberRenamed(String memberId, List<Member> members) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record ChatPosted(ChatMessage message) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    // ==================== PLAYBACK ====================

    record AudioSourceChanged(AudioSource audioSource, JsonNode analysisResult) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record SyncSnapshot(
            double positionSeconds,
            @JsonProperty("isPlaying") boolean isPlaying,
            double speedMultiplier,
            long capturedAt
    ) implements ServerEvent {
        public static SyncSnapshot of(PlaybackSnapshot snapshot) {
            return new SyncSnapshot(snapshot.positionSeconds(), snapshot.isPlaying(),
                    snapshot.speedMultiplier(), snapshot.capturedAt());
        }

        public PlaybackSnapshot toPlaybackSnapshot() {
            return new PlaybackSnapshot(positionSeconds, isPlaying, speedMultiplier, capturedAt);
        }

        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record HostActionBroadcast(HostActionKind kind, JsonNode payload) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    // ==================== COLA ====================

    record QueueUpdated(List<QueueItem> queue, List<Suggestion> suggestions) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record QueuePlayNext(QueueItem item) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record SuggestionCreated(Suggestion suggestion) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record SuggestionSent(Suggestion suggestion) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }

    record SuggestionResolved(String suggestionId, SuggestionDecision decision) implements ServerEvent {
        @Override
        public void dispatch(Handler handler) {
            handler.on(this);
        }
    }
}
