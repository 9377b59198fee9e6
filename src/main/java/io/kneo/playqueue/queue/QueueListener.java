package io.kneo.playqueue.queue;

import io.kneo.playqueue.model.PlaybackOptions;
import io.kneo.playqueue.model.QueueChange;
import io.kneo.playqueue.model.QueueItem;
import io.kneo.playqueue.model.cnst.PlayerState;

/**
 * Observer of one {@link PlayQueue}. Callbacks run after the queue lock has been
 * released, one at a time and in version order. With several mutating threads a
 * callback may run on a thread other than the one that made the change.
 */
public interface QueueListener {

    void onQueueModified(QueueChange change);

    default void onOrderInvalidated(String partition) {
    }

    default void onOptionsChanged(String partition, PlaybackOptions options) {
    }

    /**
     * @param current the playing entry, {@code null} when none
     */
    default void onPlayerChanged(String partition, PlayerState state, QueueItem current) {
    }
}
