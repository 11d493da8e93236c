package com.rebenew.stageParty.syncserver.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.rebenew.stageParty.syncserver.exception.StageErrorCode;
import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.model.QueueItem;
import com.rebenew.stageParty.syncserver.model.QueueItemStatus;
import com.rebenew.stageParty.syncserver.model.Suggestion;
import com.rebenew.stageParty.syncserver.model.SuggestionDecision;
import com.rebenew.stageParty.syncserver.model.SuggestionStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageQueueTest {

    private static List<String> ids(List<QueueItem> items) {
        return items.stream().map(QueueItem::id).collect(Collectors.toList());
    }

    private static StageQueue queueWith(int lockedHeadSize, int count) {
        StageQueue queue = new StageQueue(lockedHeadSize);
        for (int i = 0; i < count; i++) {
            queue.enqueue("Track " + i, "upload", "/rooms/uploads/t" + i, "host", "Host");
        }
        return queue;
    }

    @Test
    void rejectsNegativeHeadSize() {
        assertThatThrownBy(() -> new StageQueue(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enqueueAppendsPendingItemsWithoutStartingPlayback() {
        StageQueue queue = queueWith(3, 2);

        assertThat(queue.items()).extracting(QueueItem::status)
                .containsExactly(QueueItemStatus.PENDING, QueueItemStatus.PENDING);
        assertThat(queue.items()).extracting(QueueItem::position).containsExactly(0, 1);
        assertThat(queue.playing()).isEmpty();
    }

    @Test
    void headAndTailSplitAtLockedHeadSize() {
        StageQueue queue = queueWith(3, 5);
        List<String> all = ids(queue.items());

        assertThat(ids(queue.head())).isEqualTo(all.subList(0, 3));
        assertThat(ids(queue.tail())).isEqualTo(all.subList(3, 5));
    }

    @Test
    void playingItemSitsAboveTheLockedUpcomingItems() {
        StageQueue queue = queueWith(3, 6);
        queue.startNext();
        List<String> all = ids(queue.items());

        assertThat(ids(queue.head())).isEqualTo(all.subList(0, 4));
        assertThat(ids(queue.tail())).containsExactly(all.get(4), all.get(5));

        queue.reorderTail(List.of(all.get(5), all.get(4)));
        assertThat(ids(queue.items())).containsExactly(all.get(0), all.get(1), all.get(2), all.get(3),
                all.get(5), all.get(4));

        assertThatThrownBy(() -> queue.reorderTail(List.of(all.get(3), all.get(4), all.get(5))))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_ORDER);
    }

    @Test
    void shortQueueHasNoTail() {
        StageQueue queue = queueWith(3, 2);

        assertThat(queue.head()).hasSize(2);
        assertThat(queue.tail()).isEmpty();
        queue.reorderTail(List.of());
        assertThat(queue.items()).hasSize(2);
    }

    @Test
    void reorderPermutesTailAndLeavesHeadAlone() {
        StageQueue queue = queueWith(3, 6);
        queue.startNext();
        List<String> headBefore = ids(queue.head());
        List<String> newTail = new ArrayList<>(ids(queue.tail()));
        Collections.reverse(newTail);

        queue.reorderTail(newTail);

        assertThat(ids(queue.head())).isEqualTo(headBefore);
        assertThat(ids(queue.tail())).isEqualTo(newTail);
        assertThat(queue.items()).extracting(QueueItem::position).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(queue.playing()).map(QueueItem::id).contains(headBefore.get(0));
    }

    @Test
    void reorderWithHeadItemIsRejectedWithoutChanges() {
        StageQueue queue = queueWith(2, 4);
        List<String> before = ids(queue.items());
        List<String> tail = ids(queue.tail());

        assertThatThrownBy(() -> queue.reorderTail(List.of(before.get(0), tail.get(0))))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getCode())
                .isEqualTo(StageErrorCode.INVALID_ORDER);
        assertThat(ids(queue.items())).isEqualTo(before);
    }

    @Test
    void reorderRejectsWrongSizeDuplicatesAndUnknownIds() {
        StageQueue queue = queueWith(1, 4);
        List<String> tail = ids(queue.tail());

        assertThatThrownBy(() -> queue.reorderTail(tail.subList(0, 2)))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_ORDER);
        assertThatThrownBy(() -> queue.reorderTail(List.of(tail.get(0), tail.get(0), tail.get(1))))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_ORDER);
        assertThatThrownBy(() -> queue.reorderTail(List.of(tail.get(0), tail.get(1), "nope")))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_ORDER);
        assertThatThrownBy(() -> queue.reorderTail(null))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_ORDER);
        assertThat(ids(queue.tail())).isEqualTo(tail);
    }

    @Test
    void advanceWithOnlyPlayingItemLockedPlaysFormerFirstTailItem() {
        StageQueue queue = queueWith(0, 4);
        queue.startNext();
        List<String> tail = new ArrayList<>(ids(queue.tail()));
        Collections.reverse(tail);
        queue.reorderTail(tail);

        Optional<QueueItem> next = queue.advance();

        assertThat(next).map(QueueItem::id).contains(tail.get(0));
        assertThat(next).map(QueueItem::status).contains(QueueItemStatus.PLAYING);
        assertThat(ids(queue.items())).isEqualTo(tail);
    }

    @Test
    void advanceWithWiderHeadPlaysNextHeadItemAndPromotesTail() {
        StageQueue queue = queueWith(2, 5);
        queue.startNext();
        List<String> head = ids(queue.head());
        List<String> tail = ids(queue.tail());

        Optional<QueueItem> next = queue.advance();

        assertThat(next).map(QueueItem::id).contains(head.get(1));
        assertThat(ids(queue.head())).containsExactly(head.get(1), head.get(2), tail.get(0));
        assertThat(ids(queue.tail())).containsExactly(tail.get(1));
    }

    @Test
    void advanceWithNothingPlayingStartsFirstItem() {
        StageQueue queue = queueWith(3, 2);
        String first = queue.items().get(0).id();

        assertThat(queue.advance()).map(QueueItem::id).contains(first);
        assertThat(queue.items()).hasSize(2);
    }

    @Test
    void advancePastLastItemEmptiesQueue() {
        StageQueue queue = queueWith(3, 1);
        queue.startNext();

        assertThat(queue.advance()).isEmpty();
        assertThat(queue.items()).isEmpty();
        assertThat(queue.playing()).isEmpty();
    }

    @Test
    void removeWorksInEitherSegmentAndRenumbers() {
        StageQueue queue = queueWith(2, 4);
        List<String> all = ids(queue.items());

        queue.remove(all.get(1));
        queue.remove(all.get(3));

        assertThat(ids(queue.items())).containsExactly(all.get(0), all.get(2));
        assertThat(queue.items()).extracting(QueueItem::position).containsExactly(0, 1);
        assertThatThrownBy(() -> queue.remove("missing"))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.NOT_FOUND);
    }

    @Test
    void updateItemTracksAnalysisButNotPlaybackStates() {
        StageQueue queue = queueWith(3, 2);
        queue.startNext();
        List<String> all = ids(queue.items());

        QueueItem analyzing = queue.updateItem(all.get(1), QueueItemStatus.ANALYZING, null);
        assertThat(analyzing.status()).isEqualTo(QueueItemStatus.ANALYZING);

        QueueItem ready = queue.updateItem(all.get(1), QueueItemStatus.READY,
                JsonNodeFactory.instance.objectNode().put("bpm", 120));
        assertThat(ready.analysisResult().get("bpm").asInt()).isEqualTo(120);

        QueueItem playing = queue.updateItem(all.get(0), QueueItemStatus.READY, null);
        assertThat(playing.status()).isEqualTo(QueueItemStatus.PLAYING);

        assertThatThrownBy(() -> queue.updateItem(all.get(1), QueueItemStatus.PLAYED, null))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.INVALID_COMMAND);
    }

    @Test
    void memberMayHaveOnlyOnePendingSuggestion() {
        StageQueue queue = new StageQueue(3);
        queue.suggest("m1", "Ana", "Song A", "youtube", "https://example.org/a");

        assertThatThrownBy(() -> queue.suggest("m1", "Ana", "Song B", "youtube", "https://example.org/b"))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.DUPLICATE_PENDING);
        queue.suggest("m2", "Bo", "Song C", "youtube", "https://example.org/c");
        assertThat(queue.suggestions()).hasSize(2);
    }

    @Test
    void approvalAppendsToTailOnBehalfOfProposer() {
        StageQueue queue = queueWith(1, 2);
        Suggestion suggestion = queue.suggest("m1", "Ana", "Song A", "youtube", "https://example.org/a");

        StageQueue.Resolution resolution = queue.respond(suggestion.id(), SuggestionDecision.APPROVE);

        assertThat(resolution.suggestion().status()).isEqualTo(SuggestionStatus.APPROVED);
        assertThat(resolution.queuedItem().addedByMemberId()).isEqualTo("m1");
        assertThat(queue.items()).last().extracting(QueueItem::title).isEqualTo("Song A");
        assertThat(queue.suggestions()).isEmpty();

        queue.suggest("m1", "Ana", "Song B", "youtube", "https://example.org/b");
        assertThat(queue.suggestions()).hasSize(1);
    }

    @Test
    void rejectionDropsSuggestionOnly() {
        StageQueue queue = queueWith(1, 2);
        Suggestion suggestion = queue.suggest("m1", "Ana", "Song A", "youtube", "https://example.org/a");

        StageQueue.Resolution resolution = queue.respond(suggestion.id(), SuggestionDecision.REJECT);

        assertThat(resolution.queuedItem()).isNull();
        assertThat(resolution.suggestion().status()).isEqualTo(SuggestionStatus.REJECTED);
        assertThat(queue.items()).hasSize(2);
        assertThatThrownBy(() -> queue.respond(suggestion.id(), SuggestionDecision.APPROVE))
                .hasFieldOrPropertyWithValue("code", StageErrorCode.NOT_FOUND);
    }

    @Test
    void dropSuggestionsByRemovesOnlyThatMember() {
        StageQueue queue = new StageQueue(3);
        queue.suggest("m1", "Ana", "Song A", "youtube", "a");
        queue.suggest("m2", "Bo", "Song B", "youtube", "b");

        assertThat(queue.dropSuggestionsBy("m1")).extracting(Suggestion::proposerMemberId).containsExactly("m1");
        assertThat(queue.suggestions()).extracting(Suggestion::proposerMemberId).containsExactly("m2");
    }
}
