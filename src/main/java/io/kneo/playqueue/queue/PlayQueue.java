package io.kneo.playqueue.queue;

import io.kneo.playqueue.model.PlaybackOptions;
import io.kneo.playqueue.model.PositionId;
import io.kneo.playqueue.model.PositionRange;
import io.kneo.playqueue.model.QueueChange;
import io.kneo.playqueue.model.QueueItem;
import io.kneo.playqueue.model.Song;
import io.kneo.playqueue.model.cnst.PlayerState;
import io.kneo.playqueue.service.exceptions.QueueException;
import io.kneo.playqueue.util.QueueActivityLogger;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The queue of one partition: entry store, version ledger and random order behind a
 * single read/write lock.
 * <p>
 * Every mutating call runs inside a {@link QueueBulkEdit}; when the caller has not
 * opened one, the call opens its own. Reads take the read lock only, except that a
 * stale random order is rebuilt under the write lock first.
 * <p>
 * The playing entry is tracked by id. In random mode the order cursor is the order
 * index of that entry, in sequential mode it is simply its position.
 */
public class PlayQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlayQueue.class);
    public static final int WINDOW_END = Integer.MAX_VALUE;

    @Getter
    private final String partition;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final VersionLedger ledger;
    private final EntryStore store;
    private final RandomOrder randomOrder;
    private final Random random;
    private final List<QueueListener> listeners = new CopyOnWriteArrayList<>();
    private final Queue<Notification> pendingNotifications = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean delivering = new AtomicBoolean();
    private final PlaybackOptions options = new PlaybackOptions();
    private PlayerState state = PlayerState.STOP;

    private int depth;
    private String pendingAction;
    private boolean orderInvalidated;
    private boolean currentRemoved;
    private boolean optionsChanged;
    private boolean playerChanged;

    public PlayQueue(String partition, int maxLength) {
        this(partition, maxLength, 0, new Random());
    }

    public PlayQueue(String partition, int maxLength, long historyHorizon, Random random) {
        this.partition = partition;
        this.random = random;
        this.ledger = new VersionLedger(historyHorizon);
        this.store = new EntryStore(ledger, maxLength);
        this.randomOrder = new RandomOrder(random);
        LOGGER.info("Created play queue for partition {} (max length {})", partition, maxLength);
    }

    public void addListener(QueueListener listener) {
        listeners.add(listener);
    }

    public void removeListener(QueueListener listener) {
        listeners.remove(listener);
    }

    public QueueBulkEdit beginBulkEdit() {
        lock.writeLock().lock();
        depth++;
        return new QueueBulkEdit(this);
    }

    void endBulkEdit() {
        try {
            depth--;
            if (depth > 0) {
                return;
            }
            Notification notification = collectNotification();
            if (notification != null) {
                pendingNotifications.add(notification);
            }
        } finally {
            lock.writeLock().unlock();
        }
        deliverNotifications();
    }

    public int append(Song song) {
        return insert(WINDOW_END, song);
    }

    public int insert(int index, Song song) {
        return edit("add", () -> structural(store.insert(index, song)));
    }

    /**
     * Appends every song or none: capacity and arguments are checked before the first insert.
     */
    public List<Integer> appendAll(Collection<Song> songs) {
        return edit("add", () -> {
            for (Song song : songs) {
                if (song == null) {
                    throw new IllegalArgumentException("songs must not contain null");
                }
            }
            if (store.size() + songs.size() > store.getMaxLength()) {
                throw new QueueException(QueueException.ErrorType.CAPACITY_EXCEEDED,
                        String.format("Adding %d songs to %d would exceed the maximum of %d entries",
                                songs.size(), store.size(), store.getMaxLength()));
            }
            List<Integer> ids = new ArrayList<>(songs.size());
            try {
                for (Song song : songs) {
                    ids.add(store.insert(store.size(), song));
                }
            } finally {
                structural(!ids.isEmpty());
            }
            return ids;
        });
    }

    public int getMaxLength() {
        return store.getMaxLength();
    }

    /**
     * Appends {@code song} and moves it to {@code position}, which may be anything in
     * {@code [0, size]}; validated before the song is added.
     */
    public int addId(Song song, int position) {
        return edit("addid", () -> {
            if (position < 0 || position > store.size()) {
                throw QueueException.invalidRange("Bad song index %d for queue of %d", position, store.size());
            }
            int id = store.insert(store.size(), song);
            store.moveId(id, position);
            return structural(id);
        });
    }

    public void removeRange(int start, int end) {
        edit("delete", () -> structural(store.removeRange(start, end)));
    }

    public void removeById(int id) {
        edit("deleteid", () -> structural(store.removeById(id)));
    }

    public void moveRange(int start, int end, int dest) {
        edit("move", () -> structural(store.moveRange(start, end, dest)));
    }

    public void moveId(int id, int dest) {
        edit("moveid", () -> structural(store.moveId(id, dest)));
    }

    public void swap(int positionA, int positionB) {
        edit("swap", () -> structural(store.swap(positionA, positionB)));
    }

    public void swapById(int idA, int idB) {
        edit("swapid", () -> structural(store.swapById(idA, idB)));
    }

    public void setPriorityRange(int start, int end, int priority) {
        edit("prio", () -> structural(store.setPriorityRange(start, end, priority)));
    }

    public void setPriorityId(int id, int priority) {
        edit("prioid", () -> structural(store.setPriorityId(id, priority)));
    }

    public void setPriorityRanges(int priority, List<PositionRange> ranges) {
        edit("prio", () -> {
            for (PositionRange range : ranges) {
                store.checkRange(range.start(), range.end());
            }
            boolean changed = false;
            for (PositionRange range : ranges) {
                changed |= store.setPriorityRange(range.start(), range.end(), priority);
            }
            return structural(changed);
        });
    }

    public void setPriorityIds(int priority, List<Integer> ids) {
        edit("prioid", () -> {
            for (Integer id : ids) {
                store.positionOf(id);
            }
            boolean changed = false;
            for (Integer id : ids) {
                changed |= store.setPriorityId(id, priority);
            }
            return structural(changed);
        });
    }

    public void shuffle() {
        edit("shuffle", () -> structural(store.shuffleRange(0, store.size(), random)));
    }

    public void shuffleRange(int start, int end) {
        edit("shuffle", () -> structural(store.shuffleRange(start, end, random)));
    }

    public void clear() {
        edit("clear", () -> structural(store.clear()));
    }

    public void setSongRange(int id, long startMs, long endMs) {
        edit("rangeid", () -> {
            if (id == store.getCurrentId() && state != PlayerState.STOP) {
                throw new QueueException(QueueException.ErrorType.NOT_ALLOWED, "Cannot edit the current song");
            }
            store.setSongRange(id, startMs, endMs);
            return null;
        });
    }

    public QueueItem get(int position) {
        return read(() -> store.byPosition(position));
    }

    public QueueItem getById(int id) {
        return read(() -> store.byId(id));
    }

    public boolean containsId(int id) {
        return read(() -> store.containsId(id));
    }

    public int size() {
        return read(store::size);
    }

    public long getVersion() {
        return read(ledger::getCurrentVersion);
    }

    public List<QueueItem> snapshot() {
        return read(() -> store.snapshot(0, store.size()));
    }

    public List<QueueItem> snapshot(int start, int end) {
        return read(() -> {
            int[] window = window(start, end);
            return store.snapshot(window[0], window[1]);
        });
    }

    /**
     * Entries in {@code [start, end)} that are new or changed since {@code fromVersion}.
     * May contain entries that did not change; never misses one that did.
     * {@code end} may be {@link #WINDOW_END}.
     */
    public List<QueueItem> diff(long fromVersion, int start, int end) {
        return read(() -> {
            ledger.checkRetained(fromVersion);
            int[] window = window(start, end);
            List<QueueEntry> entries = store.entries();
            List<QueueItem> result = new ArrayList<>();
            for (int position = window[0]; position < window[1]; position++) {
                QueueEntry entry = entries.get(position);
                if (ledger.isChanged(position, entry.getVersion(), fromVersion)) {
                    result.add(entry.toItem(position));
                }
            }
            return result;
        });
    }

    public List<PositionId> diffPositions(long fromVersion, int start, int end) {
        return diff(fromVersion, start, end).stream()
                .map(item -> new PositionId(item.position(), item.id()))
                .toList();
    }

    public List<QueueItem> find(SongFilter filter) {
        return read(() -> {
            List<QueueEntry> entries = store.entries();
            List<QueueItem> result = new ArrayList<>();
            for (int position = 0; position < entries.size(); position++) {
                QueueEntry entry = entries.get(position);
                if (filter.test(entry.getSong())) {
                    result.add(entry.toItem(position));
                }
            }
            return result;
        });
    }

    public PlaybackOptions getOptions() {
        return read(options::copy);
    }

    public PlayerState getState() {
        return read(() -> state);
    }

    public Optional<QueueItem> current() {
        return read(() -> Optional.ofNullable(currentItemLocked()));
    }

    public Optional<Integer> currentId() {
        return current().map(QueueItem::id);
    }

    /**
     * Order index of the playing entry in the active order, {@code -1} when idle.
     */
    public int currentOrderIndex() {
        return readOrdered(this::cursor);
    }

    /**
     * Active play order as positions: identity in sequential mode.
     */
    public List<Integer> playOrder() {
        return readOrdered(() -> {
            List<Integer> result = new ArrayList<>(store.size());
            for (int orderIndex = 0; orderIndex < store.size(); orderIndex++) {
                result.add(positionAt(orderIndex));
            }
            return result;
        });
    }

    /**
     * Entry that follows the playing one in the active order, honouring single and repeat.
     *
     * @throws QueueException {@code END_OF_QUEUE} if playback would stop instead
     */
    public QueueItem next() {
        return readOrdered(() -> store.byPosition(positionAt(nextOrderIndex(true))));
    }

    public QueueItem previous() {
        return readOrdered(() -> store.byPosition(positionAt(previousOrderIndex())));
    }

    /**
     * The entry the output pipeline should prepare after the current one, if any.
     */
    public Optional<QueueItem> peekNext() {
        return readOrdered(() -> {
            try {
                return Optional.of(store.byPosition(positionAt(nextOrderIndex(true))));
            } catch (QueueException e) {
                if (e.getErrorType() != QueueException.ErrorType.END_OF_QUEUE) {
                    throw e;
                }
                return Optional.empty();
            }
        });
    }

    public QueueItem play(int position) {
        return edit("play", () -> {
            int id = store.idAt(position);
            setCurrent(id);
            setState(PlayerState.PLAY);
            return currentItemLocked();
        });
    }

    public QueueItem playId(int id) {
        return edit("playid", () -> {
            store.positionOf(id);
            setCurrent(id);
            setState(PlayerState.PLAY);
            return currentItemLocked();
        });
    }

    /**
     * Resumes the current entry, or starts from the beginning of the active order.
     */
    public QueueItem play() {
        return edit("play", () -> {
            if (store.getCurrentId() == EntryStore.NO_ID) {
                ensureOrder();
                int orderIndex = RandomOrder.next(-1, store.size(), false);
                setCurrent(store.idAt(positionAt(orderIndex)));
            }
            setState(PlayerState.PLAY);
            return currentItemLocked();
        });
    }

    public void pause() {
        edit("pause", () -> {
            if (state == PlayerState.PLAY) {
                setState(PlayerState.PAUSE);
            }
            return null;
        });
    }

    public void stop() {
        edit("stop", () -> {
            setState(PlayerState.STOP);
            return null;
        });
    }

    /**
     * Skips to the next entry of the active order; single mode does not apply.
     */
    public QueueItem playNext() {
        return edit("next", () -> {
            ensureOrder();
            int position = positionAt(nextOrderIndex(false));
            setCurrent(store.idAt(position));
            setState(PlayerState.PLAY);
            return currentItemLocked();
        });
    }

    public QueueItem playPrevious() {
        return edit("previous", () -> {
            ensureOrder();
            int position = positionAt(previousOrderIndex());
            setCurrent(store.idAt(position));
            setState(PlayerState.PLAY);
            return currentItemLocked();
        });
    }

    /**
     * Called by the playback engine when the current entry has been played to its end.
     * Removes it in consume mode and advances the cursor.
     *
     * @return the new current entry, empty when playback stopped
     */
    public Optional<QueueItem> entryFinished() {
        return edit("finished", () -> {
            int finishedId = store.getCurrentId();
            if (finishedId == EntryStore.NO_ID) {
                setState(PlayerState.STOP);
                return Optional.empty();
            }
            ensureOrder();
            int cursor = cursor();
            int nextId = EntryStore.NO_ID;
            boolean wrapped = false;
            try {
                int nextOrderIndex = nextOrderIndex(true);
                wrapped = nextOrderIndex <= cursor;
                nextId = store.idAt(positionAt(nextOrderIndex));
            } catch (QueueException e) {
                if (e.getErrorType() != QueueException.ErrorType.END_OF_QUEUE) {
                    throw e;
                }
            }

            if (options.isConsume()) {
                if (nextId == finishedId) {
                    nextId = EntryStore.NO_ID;
                }
                structural(store.removeById(finishedId));
                currentRemoved = false;
                if (nextId != EntryStore.NO_ID && options.isRandom()) {
                    randomOrder.setCursor(wrapped ? 0 : cursor);
                }
            }

            if (nextId == EntryStore.NO_ID) {
                store.markCurrent(EntryStore.NO_ID);
                randomOrder.setCursor(-1);
                setState(PlayerState.STOP);
                return Optional.empty();
            }
            setCurrent(nextId);
            setState(PlayerState.PLAY);
            return Optional.of(currentItemLocked());
        });
    }

    public void setRandom(boolean enabled) {
        edit("random", () -> {
            if (options.isRandom() == enabled) {
                return null;
            }
            options.setRandom(enabled);
            optionsChanged = true;
            if (enabled) {
                randomOrder.invalidate();
                randomOrder.setCursor(store.getCurrentId() == EntryStore.NO_ID ? -1 : 0);
                orderInvalidated = true;
            }
            return null;
        });
    }

    public void setRepeat(boolean enabled) {
        edit("repeat", () -> {
            if (options.isRepeat() != enabled) {
                options.setRepeat(enabled);
                optionsChanged = true;
            }
            return null;
        });
    }

    public void setSingle(boolean enabled) {
        edit("single", () -> {
            if (options.isSingle() != enabled) {
                options.setSingle(enabled);
                optionsChanged = true;
            }
            return null;
        });
    }

    public void setConsume(boolean enabled) {
        edit("consume", () -> {
            if (options.isConsume() != enabled) {
                options.setConsume(enabled);
                optionsChanged = true;
            }
            return null;
        });
    }

    private Notification collectNotification() {
        String action = pendingAction == null ? "edit" : pendingAction;
        QueueChange change = null;
        if (ledger.isDirty()) {
            int lowest = ledger.getLowestTouched();
            long version = ledger.bump();
            change = new QueueChange(partition, version, store.size(), lowest, currentRemoved);
            QueueActivityLogger.logChange(action, change);
        }
        PlaybackOptions changedOptions = optionsChanged ? options.copy() : null;
        boolean notifyPlayer = playerChanged;
        QueueItem current = currentItemLocked();
        if (notifyPlayer) {
            QueueActivityLogger.logPlayer(partition, action, state, current);
        }
        Notification notification = null;
        if (change != null || orderInvalidated || changedOptions != null || notifyPlayer) {
            notification = new Notification(change, orderInvalidated, changedOptions, notifyPlayer, state, current);
        }
        pendingAction = null;
        orderInvalidated = false;
        currentRemoved = false;
        optionsChanged = false;
        playerChanged = false;
        return notification;
    }

    /**
     * Notifications are queued under the write lock, so the queue holds them in version
     * order. Only one thread delivers at a time; a thread that finds another one
     * delivering leaves its notification to it.
     */
    private void deliverNotifications() {
        while (!pendingNotifications.isEmpty()) {
            if (!delivering.compareAndSet(false, true)) {
                return;
            }
            try {
                Notification notification;
                while ((notification = pendingNotifications.poll()) != null) {
                    deliver(notification);
                }
            } finally {
                delivering.set(false);
            }
        }
    }

    private void deliver(Notification notification) {
        for (QueueListener listener : listeners) {
            try {
                if (notification.change() != null) {
                    listener.onQueueModified(notification.change());
                }
                if (notification.orderInvalidated()) {
                    listener.onOrderInvalidated(partition);
                }
                if (notification.options() != null) {
                    listener.onOptionsChanged(partition, notification.options());
                }
                if (notification.playerChanged()) {
                    listener.onPlayerChanged(partition, notification.state(), notification.current());
                }
            } catch (RuntimeException e) {
                LOGGER.error("Queue listener failed for partition {}: {}", partition, e.getMessage(), e);
            }
        }
    }

    private <T> T edit(String action, Supplier<T> operation) {
        try (QueueBulkEdit ignored = beginBulkEdit()) {
            pendingAction = pendingAction == null || pendingAction.equals(action) ? action : "bulk";
            return operation.get();
        }
    }

    private <T> T read(Supplier<T> operation) {
        lock.readLock().lock();
        try {
            return operation.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T readOrdered(Supplier<T> operation) {
        if (lock.isWriteLockedByCurrentThread()) {
            ensureOrder();
            return operation.get();
        }
        lock.readLock().lock();
        try {
            if (!needsOrder()) {
                return operation.get();
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            ensureOrder();
            lock.readLock().lock();
        } finally {
            lock.writeLock().unlock();
        }
        try {
            return operation.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T structural(T result) {
        boolean changed = result instanceof Boolean ? (Boolean) result : result != null;
        if (changed) {
            randomOrder.invalidate();
            orderInvalidated = true;
        }
        if (store.takeCurrentRemoved()) {
            currentRemoved = true;
            randomOrder.setCursor(-1);
            setState(PlayerState.STOP);
        }
        return result;
    }

    private boolean needsOrder() {
        return options.isRandom() && !randomOrder.isValid();
    }

    private void ensureOrder() {
        if (needsOrder()) {
            randomOrder.generate(store.entries(), store.getCurrentId());
        }
    }

    private int cursor() {
        if (options.isRandom()) {
            return randomOrder.getCursor();
        }
        return store.currentPosition();
    }

    private int positionAt(int orderIndex) {
        if (options.isRandom()) {
            return randomOrder.positionAt(orderIndex);
        }
        return orderIndex;
    }

    private int nextOrderIndex(boolean honourSingle) {
        int cursor = cursor();
        if (honourSingle && options.isSingle() && cursor >= 0) {
            if (options.isRepeat()) {
                return cursor;
            }
            throw new QueueException(QueueException.ErrorType.END_OF_QUEUE, "Single mode stops after the current entry");
        }
        return RandomOrder.next(cursor, store.size(), options.isRepeat());
    }

    private int previousOrderIndex() {
        return RandomOrder.previous(cursor(), store.size(), options.isRepeat());
    }

    private void setCurrent(int id) {
        store.markCurrent(id);
        if (options.isRandom()) {
            ensureOrder();
            randomOrder.setCursor(randomOrder.orderIndexOf(store.positionOf(id)));
        }
        playerChanged = true;
    }

    private void setState(PlayerState newState) {
        if (state != newState) {
            state = newState;
            playerChanged = true;
        }
    }

    private QueueItem currentItemLocked() {
        int currentId = store.getCurrentId();
        return currentId == EntryStore.NO_ID ? null : store.byId(currentId);
    }

    private int[] window(int start, int end) {
        if (start < 0 || start > end) {
            throw QueueException.invalidRange("Bad window [%d, %d)", start, end);
        }
        int clampedEnd = Math.min(end, store.size());
        return new int[]{Math.min(start, clampedEnd), clampedEnd};
    }

    private record Notification(QueueChange change, boolean orderInvalidated, PlaybackOptions options,
                                boolean playerChanged, PlayerState state, QueueItem current) {
    }
}
