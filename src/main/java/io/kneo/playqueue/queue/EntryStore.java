package io.kneo.playqueue.queue;

import io.kneo.playqueue.model.QueueItem;
import io.kneo.playqueue.model.Song;
import io.kneo.playqueue.service.exceptions.QueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Ordered, dual-indexed collection of queue entries.
 * <p>
 * Positions are the indices of {@link #items}; {@link #idToPosition} is kept in
 * step for every entry whose position changes. Each mutation validates all of its
 * arguments before touching anything, so a failed call leaves the store as it was.
 * Every entry a mutation touches gets the ledger's pending version and the ledger
 * is told the lowest touched position.
 * <p>
 * Not thread safe, {@link PlayQueue} guards it.
 */
public class EntryStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(EntryStore.class);
    public static final int MAX_PRIORITY = 0xff;
    public static final int NO_ID = -1;

    private final List<QueueEntry> items = new ArrayList<>();
    private final Map<Integer, Integer> idToPosition = new HashMap<>();
    private final VersionLedger ledger;
    private final int maxLength;
    private int nextId = 1;
    private int currentId = NO_ID;
    private boolean currentRemoved;

    public EntryStore(VersionLedger ledger, int maxLength) {
        this.ledger = ledger;
        this.maxLength = maxLength;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int getMaxLength() {
        return maxLength;
    }

    public int insert(int index, Song song) {
        if (song == null) {
            throw new IllegalArgumentException("song must not be null");
        }
        if (items.size() >= maxLength) {
            throw new QueueException(QueueException.ErrorType.CAPACITY_EXCEEDED,
                    String.format("Queue already holds the maximum of %d entries", maxLength));
        }
        int position = Math.max(0, Math.min(index, items.size()));
        QueueEntry entry = new QueueEntry(nextId++, song, ledger.pendingVersion());
        items.add(position, entry);
        renumber(position, items.size());
        ledger.markTouched(position);
        LOGGER.debug("Inserted id {} at {}: {}", entry.getId(), position, song.getUri());
        return entry.getId();
    }

    public boolean removeRange(int start, int end) {
        checkRange(start, end);
        if (start == end) {
            return false;
        }
        List<QueueEntry> removed = items.subList(start, end);
        for (QueueEntry entry : removed) {
            idToPosition.remove(entry.getId());
            if (entry.getId() == currentId) {
                currentId = NO_ID;
                currentRemoved = true;
            }
        }
        removed.clear();
        renumber(start, items.size());
        ledger.markTouched(start);
        LOGGER.debug("Removed range [{}, {})", start, end);
        return true;
    }

    public boolean removeById(int id) {
        int position = positionOf(id);
        return removeRange(position, position + 1);
    }

    /**
     * Relocates {@code [start, end)} so that it lands in front of the entry that was at
     * {@code dest} before the call; {@code dest == size()} moves the run to the end.
     */
    public boolean moveRange(int start, int end, int dest) {
        checkRange(start, end);
        if (dest < 0 || dest > items.size()) {
            throw QueueException.invalidRange("Move destination %d outside [0, %d]", dest, items.size());
        }
        if (dest > start && dest < end) {
            throw QueueException.invalidRange("Move destination %d inside source range [%d, %d)", dest, start, end);
        }
        int length = end - start;
        if (length == 0 || dest == start || dest == end) {
            return false;
        }
        int target = dest < start ? dest : dest - length;
        List<QueueEntry> run = new ArrayList<>(items.subList(start, end));
        items.subList(start, end).clear();
        items.addAll(target, run);

        int low = Math.min(start, target);
        int high = Math.max(end, target + length);
        renumber(low, high);
        ledger.markTouched(low);
        LOGGER.debug("Moved [{}, {}) to {}", start, end, target);
        return true;
    }

    public boolean moveId(int id, int dest) {
        int position = positionOf(id);
        return moveRange(position, position + 1, dest);
    }

    public boolean swap(int positionA, int positionB) {
        checkPosition(positionA);
        checkPosition(positionB);
        if (positionA == positionB) {
            return false;
        }
        Collections.swap(items, positionA, positionB);
        renumber(positionA, positionA + 1);
        renumber(positionB, positionB + 1);
        ledger.markTouched(Math.min(positionA, positionB));
        return true;
    }

    public boolean swapById(int idA, int idB) {
        int positionA = positionOf(idA);
        int positionB = positionOf(idB);
        return swap(positionA, positionB);
    }

    public boolean setPriorityRange(int start, int end, int priority) {
        checkPriority(priority);
        checkRange(start, end);
        int lowest = -1;
        for (int position = start; position < end; position++) {
            if (applyPriority(position, priority) && lowest < 0) {
                lowest = position;
            }
        }
        if (lowest < 0) {
            return false;
        }
        ledger.markTouched(lowest);
        return true;
    }

    public boolean setPriorityId(int id, int priority) {
        checkPriority(priority);
        int position = positionOf(id);
        if (!applyPriority(position, priority)) {
            return false;
        }
        ledger.markTouched(position);
        return true;
    }

    /**
     * Fisher-Yates over {@code [start, end)} only; entries outside keep their positions.
     */
    public boolean shuffleRange(int start, int end, Random random) {
        checkRange(start, end);
        if (end - start < 2) {
            return false;
        }
        for (int i = end - 1; i > start; i--) {
            int j = start + random.nextInt(i - start + 1);
            Collections.swap(items, i, j);
        }
        renumber(start, end);
        ledger.markTouched(start);
        LOGGER.debug("Shuffled [{}, {})", start, end);
        return true;
    }

    public void setSongRange(int id, long startMs, long endMs) {
        if (startMs < 0 || endMs < 0 || (endMs != 0 && endMs <= startMs)) {
            throw QueueException.invalidRange("Bad song range %d:%d", startMs, endMs);
        }
        int position = positionOf(id);
        QueueEntry entry = items.get(position);
        entry.setSong(entry.getSong().withRange(startMs, endMs));
        entry.setVersion(ledger.pendingVersion());
        ledger.markTouched(position);
    }

    public boolean clear() {
        if (items.isEmpty()) {
            return false;
        }
        if (currentId != NO_ID) {
            currentId = NO_ID;
            currentRemoved = true;
        }
        items.clear();
        idToPosition.clear();
        ledger.reset(0);
        LOGGER.debug("Cleared queue");
        return true;
    }

    public QueueItem byPosition(int position) {
        checkPosition(position);
        return items.get(position).toItem(position);
    }

    public QueueItem byId(int id) {
        int position = positionOf(id);
        return items.get(position).toItem(position);
    }

    public boolean containsId(int id) {
        return idToPosition.containsKey(id);
    }

    public int positionOf(int id) {
        Integer position = idToPosition.get(id);
        if (position == null) {
            throw QueueException.noSuchId(id);
        }
        return position;
    }

    public int idAt(int position) {
        checkPosition(position);
        return items.get(position).getId();
    }

    public List<QueueItem> snapshot(int start, int end) {
        checkRange(start, end);
        List<QueueItem> result = new ArrayList<>(end - start);
        for (int position = start; position < end; position++) {
            result.add(items.get(position).toItem(position));
        }
        return result;
    }

    public int getCurrentId() {
        return currentId;
    }

    public void markCurrent(int id) {
        if (id != NO_ID && !idToPosition.containsKey(id)) {
            throw QueueException.noSuchId(id);
        }
        currentId = id;
    }

    public int currentPosition() {
        return currentId == NO_ID ? -1 : idToPosition.get(currentId);
    }

    /**
     * Returns whether the playing entry was removed since the last call, and resets the flag.
     */
    public boolean takeCurrentRemoved() {
        boolean removed = currentRemoved;
        currentRemoved = false;
        return removed;
    }

    List<QueueEntry> entries() {
        return Collections.unmodifiableList(items);
    }

    private boolean applyPriority(int position, int priority) {
        QueueEntry entry = items.get(position);
        if (entry.getPriority() == priority) {
            return false;
        }
        entry.setPriority(priority);
        entry.setVersion(ledger.pendingVersion());
        return true;
    }

    private void renumber(int from, int to) {
        long version = ledger.pendingVersion();
        for (int position = from; position < to; position++) {
            QueueEntry entry = items.get(position);
            entry.setVersion(version);
            idToPosition.put(entry.getId(), position);
        }
    }

    void checkRange(int start, int end) {
        if (start < 0 || start > end || end > items.size()) {
            throw QueueException.invalidRange("Bad song range [%d, %d) for queue of %d", start, end, items.size());
        }
    }

    private void checkPosition(int position) {
        if (position < 0 || position >= items.size()) {
            throw QueueException.invalidRange("Bad song index %d for queue of %d", position, items.size());
        }
    }

    private static void checkPriority(int priority) {
        if (priority < 0 || priority > MAX_PRIORITY) {
            throw QueueException.invalidRange("Priority %d outside [0, %d]", priority, MAX_PRIORITY);
        }
    }
}
