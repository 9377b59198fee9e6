package io.kneo.playqueue.queue;

import io.kneo.playqueue.model.QueueItem;
import io.kneo.playqueue.model.Song;
import io.kneo.playqueue.service.exceptions.QueueException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntryStoreTest {

    private VersionLedger ledger;
    private EntryStore store;

    @BeforeEach
    void setUp() {
        ledger = new VersionLedger();
        store = new EntryStore(ledger, 10);
    }

    @Test
    void testInsertAllocatesIncreasingIdsThatAreNeverReused() {
        fill(3);
        assertEquals(List.of(1, 2, 3), ids());

        store.removeById(3);
        int id = store.insert(store.size(), Song.of("late.mp3"));

        assertEquals(4, id);
        assertEquals(List.of(1, 2, 4), ids());
    }

    @Test
    void testInsertClampsIndex() {
        fill(2);
        int front = store.insert(-5, Song.of("front.mp3"));
        int back = store.insert(100, Song.of("back.mp3"));

        assertEquals(0, store.positionOf(front));
        assertEquals(3, store.positionOf(back));
        assertEquals(List.of(front, 1, 2, back), ids());
    }

    @Test
    void testInsertFailsWhenFull() {
        fill(10);
        QueueException e = assertThrows(QueueException.class, () -> store.insert(0, Song.of("one-too-many.mp3")));
        assertEquals(QueueException.ErrorType.CAPACITY_EXCEEDED, e.getErrorType());
        assertEquals(10, store.size());
        assertEquals(1, store.idAt(0));
    }

    @Test
    void testMoveSingleEntryBehindItsNeighbour() {
        fill(3);
        assertTrue(store.moveRange(0, 1, 2));
        assertEquals(List.of(2, 1, 3), ids());
    }

    @Test
    void testMoveRunToFront() {
        fill(6);
        store.moveRange(2, 5, 0);
        assertEquals(List.of(3, 4, 5, 1, 2, 6), ids());
    }

    @Test
    void testMoveRunToEnd() {
        fill(5);
        store.moveRange(0, 2, 5);
        assertEquals(List.of(3, 4, 5, 1, 2), ids());
    }

    @Test
    void testMoveOntoItsOwnBoundsIsNoop() {
        fill(4);
        assertFalse(store.moveRange(1, 3, 1));
        assertFalse(store.moveRange(1, 3, 3));
        assertEquals(List.of(1, 2, 3, 4), ids());
    }

    @Test
    void testMoveRejectsDestinationInsideSource() {
        fill(5);
        QueueException e = assertThrows(QueueException.class, () -> store.moveRange(1, 4, 2));
        assertEquals(QueueException.ErrorType.INVALID_RANGE, e.getErrorType());
        assertEquals(List.of(1, 2, 3, 4, 5), ids());
    }

    @Test
    void testMoveRejectsDestinationOutOfBounds() {
        fill(5);
        assertThrows(QueueException.class, () -> store.moveRange(0, 1, 6));
        assertThrows(QueueException.class, () -> store.moveRange(0, 1, -1));
        assertThrows(QueueException.class, () -> store.moveRange(3, 6, 0));
        assertEquals(List.of(1, 2, 3, 4, 5), ids());
    }

    @Test
    void testMoveIdToFront() {
        fill(4);
        store.moveId(4, 0);
        assertEquals(List.of(4, 1, 2, 3), ids());
        assertEquals(0, store.positionOf(4));
        assertEquals(3, store.positionOf(3));
    }

    @Test
    void testRemoveRangeCompactsPositions() {
        fill(5);
        assertTrue(store.removeRange(1, 3));
        assertEquals(List.of(1, 4, 5), ids());
        assertEquals(1, store.positionOf(4));
        assertFalse(store.containsId(2));
    }

    @Test
    void testRemoveRangeRejectsBadBounds() {
        fill(5);
        assertThrows(QueueException.class, () -> store.removeRange(3, 2));
        assertThrows(QueueException.class, () -> store.removeRange(0, 6));
        assertThrows(QueueException.class, () -> store.removeRange(-1, 2));
        assertEquals(5, store.size());
    }

    @Test
    void testRemoveEmptyRangeTouchesNothing() {
        fill(3);
        ledger.bump();
        assertFalse(store.removeRange(0, 0));
        assertFalse(ledger.isDirty());
    }

    @Test
    void testRemoveUnknownId() {
        fill(2);
        QueueException e = assertThrows(QueueException.class, () -> store.removeById(42));
        assertEquals(QueueException.ErrorType.NO_SUCH_ID, e.getErrorType());
        assertEquals(2, store.size());
    }

    @Test
    void testRemovingCurrentEntryIsFlaggedOnce() {
        fill(3);
        store.markCurrent(2);
        store.removeRange(1, 2);

        assertEquals(EntryStore.NO_ID, store.getCurrentId());
        assertTrue(store.takeCurrentRemoved());
        assertFalse(store.takeCurrentRemoved());
    }

    @Test
    void testCurrentSurvivesRenumbering() {
        fill(4);
        store.markCurrent(3);
        store.removeRange(0, 1);
        store.insert(0, Song.of("new.mp3"));
        store.moveRange(0, 2, 4);

        assertEquals(3, store.getCurrentId());
        assertEquals(store.positionOf(3), store.currentPosition());
        assertFalse(store.takeCurrentRemoved());
    }

    @Test
    void testSwap() {
        fill(4);
        store.swap(0, 3);
        assertEquals(List.of(4, 2, 3, 1), ids());
        store.swapById(2, 3);
        assertEquals(List.of(4, 3, 2, 1), ids());
        assertThrows(QueueException.class, () -> store.swap(0, 9));
        assertThrows(QueueException.class, () -> store.swapById(1, 77));
        assertEquals(List.of(4, 3, 2, 1), ids());
    }

    @Test
    void testSetPriority() {
        fill(4);
        assertTrue(store.setPriorityRange(0, 2, 10));
        assertFalse(store.setPriorityRange(0, 2, 10));
        assertTrue(store.setPriorityId(4, 255));

        assertEquals(10, store.byPosition(0).priority());
        assertEquals(10, store.byPosition(1).priority());
        assertEquals(0, store.byPosition(2).priority());
        assertEquals(255, store.byId(4).priority());
        assertEquals(List.of(1, 2, 3, 4), ids());
    }

    @Test
    void testSetPriorityRejectsBadArguments() {
        fill(2);
        assertEquals(QueueException.ErrorType.INVALID_RANGE,
                assertThrows(QueueException.class, () -> store.setPriorityRange(0, 1, 256)).getErrorType());
        assertEquals(QueueException.ErrorType.INVALID_RANGE,
                assertThrows(QueueException.class, () -> store.setPriorityRange(0, 3, 1)).getErrorType());
        assertEquals(QueueException.ErrorType.NO_SUCH_ID,
                assertThrows(QueueException.class, () -> store.setPriorityId(9, 1)).getErrorType());
        assertEquals(0, store.byPosition(0).priority());
    }

    @Test
    void testShuffleRangeLeavesOutsideUntouched() {
        fill(5);
        store.shuffleRange(1, 4, new Random(42));

        assertEquals(1, store.idAt(0));
        assertEquals(5, store.idAt(4));
        assertEquals(Set.of(2, 3, 4), Set.of(store.idAt(1), store.idAt(2), store.idAt(3)));
        for (int position = 0; position < store.size(); position++) {
            assertEquals(position, store.positionOf(store.idAt(position)));
        }
    }

    @Test
    void testShuffleOfSingleEntryIsNoop() {
        fill(3);
        assertFalse(store.shuffleRange(1, 2, new Random(1)));
        assertThrows(QueueException.class, () -> store.shuffleRange(2, 4, new Random(1)));
    }

    @Test
    void testSetSongRange() {
        fill(2);
        store.setSongRange(2, 1500, 0);
        assertEquals(1500, store.byId(2).song().getStartMs());
        assertEquals(0, store.byId(2).song().getEndMs());

        assertThrows(QueueException.class, () -> store.setSongRange(2, 3000, 2000));
        assertThrows(QueueException.class, () -> store.setSongRange(7, 0, 1000));
        assertEquals(1500, store.byId(2).song().getStartMs());
    }

    @Test
    void testLookupsFailInsteadOfReturningDefaults() {
        fill(2);
        assertEquals(QueueException.ErrorType.INVALID_RANGE,
                assertThrows(QueueException.class, () -> store.byPosition(2)).getErrorType());
        assertEquals(QueueException.ErrorType.NO_SUCH_ID,
                assertThrows(QueueException.class, () -> store.byId(3)).getErrorType());
    }

    @Test
    void testTouchedEntriesCarryPendingVersion() {
        fill(3);
        ledger.bump();
        long before = store.byPosition(0).version();

        store.removeRange(0, 1);

        assertEquals(ledger.pendingVersion(), store.byPosition(0).version());
        assertEquals(ledger.pendingVersion(), store.byPosition(1).version());
        assertTrue(store.byPosition(0).version() > before);
        assertEquals(0, ledger.getLowestTouched());
    }

    @Test
    void testClear() {
        assertFalse(store.clear());
        fill(3);
        store.markCurrent(1);
        assertTrue(store.clear());
        assertEquals(0, store.size());
        assertTrue(store.takeCurrentRemoved());
        assertFalse(store.containsId(1));
    }

    private void fill(int count) {
        for (int i = 0; i < count; i++) {
            store.insert(store.size(), Song.of("song" + i + ".mp3"));
        }
    }

    private List<Integer> ids() {
        return store.snapshot(0, store.size()).stream().map(QueueItem::id).toList();
    }
}
