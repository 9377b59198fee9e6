package io.kneo.playqueue.queue;

import io.kneo.playqueue.service.exceptions.QueueException;
import lombok.Getter;

/**
 * Version counter plus the low-water-mark of touched positions.
 * <p>
 * Entries carry the version of their last change, so {@code entry.version > from}
 * catches everything touched after {@code from}. The floor adds a conservative
 * "everything at or after this position" for clients older than the moment the
 * floor was last lowered. False positives are accepted, false negatives are not.
 */
public class VersionLedger {
    public static final long INITIAL_VERSION = 1;

    @Getter
    private long currentVersion = INITIAL_VERSION;
    @Getter
    private int floor;
    @Getter
    private long floorVersion = INITIAL_VERSION;
    private final long horizon;
    private boolean dirty;
    private int lowestTouched = Integer.MAX_VALUE;

    public VersionLedger() {
        this(0);
    }

    /**
     * @param horizon how many versions back a diff may reach; {@code 0} keeps everything
     */
    public VersionLedger(long horizon) {
        this.horizon = horizon;
    }

    /**
     * Version the next {@link #bump()} will produce; touched entries are stamped with it.
     */
    public long pendingVersion() {
        return currentVersion + 1;
    }

    public void markTouched(int position) {
        dirty = true;
        lowestTouched = Math.min(lowestTouched, position);
        if (position < floor) {
            floor = position;
            floorVersion = pendingVersion();
        }
    }

    /**
     * Nothing below {@code length} is stale any more; used when the queue is emptied.
     */
    public void reset(int length) {
        dirty = true;
        lowestTouched = Math.min(lowestTouched, length);
        floor = length;
        floorVersion = pendingVersion();
    }

    public long bump() {
        currentVersion++;
        dirty = false;
        lowestTouched = Integer.MAX_VALUE;
        return currentVersion;
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * Lowest position touched since the last bump, {@link Integer#MAX_VALUE} if none.
     */
    public int getLowestTouched() {
        return lowestTouched;
    }

    public void checkRetained(long fromVersion) {
        if (horizon > 0 && fromVersion < currentVersion - horizon) {
            throw new QueueException(QueueException.ErrorType.VERSION_TOO_OLD,
                    String.format("Version %d is older than the retained horizon of %d versions (current %d)",
                            fromVersion, horizon, currentVersion));
        }
    }

    /**
     * Whether an entry must be reported to a client that last saw {@code fromVersion}.
     */
    public boolean isChanged(int position, long entryVersion, long fromVersion) {
        if (fromVersion > currentVersion) {
            return true;
        }
        if (entryVersion > fromVersion) {
            return true;
        }
        return fromVersion < floorVersion && position >= floor;
    }
}
