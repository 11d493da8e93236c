package com.rebenew.stageParty.syncserver.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.stageParty.syncserver.model.AudioSource;
import com.rebenew.stageParty.syncserver.model.HostActionKind;
import com.rebenew.stageParty.syncserver.model.QueueItemStatus;
import com.rebenew.stageParty.syncserver.model.SuggestionDecision;
import com.rebenew.stageParty.syncserver.model.TrackInfo;

import java.util.List;

/**
 * Todos los frames que puede enviar un cliente, discriminados por {@code type}.
 * <p>
 * El conjunto es cerrado: un comando nuevo es un record aquí y un método en
 * {@link Handler}, y ninguna vista compila hasta decidir qué significa para su rol.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientCommand.CreateSession.class, name = "create_session"),
        @JsonSubTypes.Type(value = ClientCommand.JoinSession.class, name = "join_session"),
        @JsonSubTypes.Type(value = ClientCommand.LeaveSession.class, name = "leave_session"),
        @JsonSubTypes.Type(value = ClientCommand.SetDisplayName.class, name = "set_display_name"),
        @JsonSubTypes.Type(value = ClientCommand.RenameSession.class, name = "rename_session"),
        @JsonSubTypes.Type(value = ClientCommand.TogglePublic.class, name = "toggle_public"),
        @JsonSubTypes.Type(value = ClientCommand.UpdateNowPlaying.class, name = "update_now_playing"),
        @JsonSubTypes.Type(value = ClientCommand.SendChat.class, name = "chat_message"),
        @JsonSubTypes.Type(value = ClientCommand.SetAudioSource.class, name = "set_audio_source"),
        @JsonSubTypes.Type(value = ClientCommand.SyncHeartbeat.class, name = "sync_heartbeat"),
        @JsonSubTypes.Type(value = ClientCommand.HostAction.class, name = "host_action"),
        @JsonSubTypes.Type(value = ClientCommand.QueueAdd.class, name = "queue_add"),
        @JsonSubTypes.Type(value = ClientCommand.QueueRemove.class, name = "queue_remove"),
        @JsonSubTypes.Type(value = ClientCommand.QueueReorder.class, name = "queue_reorder"),
        @JsonSubTypes.Type(value = ClientCommand.QueueAdvance.class, name = "queue_advance"),
        @JsonSubTypes.Type(value = ClientCommand.QueueUpdateItem.class, name = "queue_update_item"),
        @JsonSubTypes.Type(value = ClientCommand.SuggestSong.class, name = "suggest_song"),
        @JsonSubTypes.Type(value = ClientCommand.RespondSuggestion.class, name = "respond_suggestion"),
        @JsonSubTypes.Type(value = ClientCommand.GoToMenu.class, name = "go_to_menu"),
        @JsonSubTypes.Type(value = ClientCommand.ReturnToSession.class, name = "return_to_session"),
        @JsonSubTypes.Type(value = ClientCommand.EndSession.class, name = "end_session")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface ClientCommand {

    <C> void dispatch(Handler<C> handler, C context);

    /**
     * Un método por comando. Cada implementación decide qué hace según el rol.
     */
    interface Handler<C> {
        void handle(C context, CreateSession command);

        void handle(C context, JoinSession command);

        void handle(C context, LeaveSession command);

        void handle(C context, SetDisplayName command);

        void handle(C context, RenameSession command);

        void handle(C context, TogglePublic command);

        void handle(C context, UpdateNowPlaying command);

        void handle(C context, SendChat command);

        void handle(C context, SetAudioSource command);

        void handle(C context, SyncHeartbeat command);

        void handle(C context, HostAction command);

        void handle(C context, QueueAdd command);

        void handle(C context, QueueRemove command);

        void handle(C context, QueueReorder command);

        void handle(C context, QueueAdvance command);

        void handle(C context, QueueUpdateItem command);

        void handle(C context, SuggestSong command);

        void handle(C context, RespondSuggestion command);

        void handle(C context, GoToMenu command);

        void handle(C context, ReturnToSession command);

        void handle(C context, EndSession command);
    }

    // ==================== CICLO DE VIDA ====================

    record CreateSession(String name) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record JoinSession(@JsonAlias("roomId") String sessionId) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record LeaveSession() implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record SetDisplayName(@JsonAlias("username") String name) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record GoToMenu() implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record ReturnToSession() implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record EndSession() implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    // ==================== AJUSTES DEL STAGE ====================

    record RenameSession(String name) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record TogglePublic() implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record UpdateNowPlaying(TrackInfo track) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record SendChat(String text) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    // ==================== PLAYBACK ====================

    record SetAudioSource(AudioSource audioSource, JsonNode analysisResult) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    // Envoltorios: un campo ausente llega como null, no como 0/false
    record SyncHeartbeat(
            Double positionSeconds,
            @JsonProperty("isPlaying") Boolean isPlaying,
            Double speedMultiplier
    ) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record HostAction(HostActionKind kind, JsonNode payload) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    // ==================== COLA ====================

    record QueueAdd(String title, String source, String url) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record QueueRemove(String itemId) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record QueueReorder(@JsonAlias("order") List<String> tailOrder) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record QueueAdvance() implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record QueueUpdateItem(String itemId, QueueItemStatus status, JsonNode analysisResult) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record SuggestSong(String title, String source, String url) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }

    record RespondSuggestion(
            String suggestionId,
            @JsonAlias("action") SuggestionDecision decision
    ) implements ClientCommand {
        @Override
        public <C> void dispatch(Handler<C> handler, C context) {
            handler.handle(context, this);
        }
    }
}
