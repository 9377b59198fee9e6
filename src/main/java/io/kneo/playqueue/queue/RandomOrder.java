package io.kneo.playqueue.queue;

import io.kneo.playqueue.service.exceptions.QueueException;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Play order used while random mode is on: {@code order[orderIndex] = position}.
 * <p>
 * Positions are grouped by priority, highest first, and each group is shuffled on its
 * own. When an entry is playing it is kept at the cursor and the highest priority
 * entries follow it directly; the rest wrap around in front of the cursor.
 * <p>
 * The permutation is invalidated by any structural or priority change and rebuilt
 * lazily by the owner.
 */
public class RandomOrder {
    private static final Logger LOGGER = LoggerFactory.getLogger(RandomOrder.class);

    private final Random random;
    private int[] order = new int[0];
    private int[] inverse = new int[0];
    @Getter
    private boolean valid;
    @Getter
    @Setter
    private int cursor = -1;

    public RandomOrder(Random random) {
        this.random = random;
    }

    public void invalidate() {
        valid = false;
    }

    public int length() {
        return order.length;
    }

    public int[] generate(List<QueueEntry> entries, int currentId) {
        Map<Integer, List<Integer>> tiers = new TreeMap<>((a, b) -> Integer.compare(b, a));
        int currentPosition = -1;
        for (int position = 0; position < entries.size(); position++) {
            QueueEntry entry = entries.get(position);
            if (entry.getId() == currentId) {
                currentPosition = position;
                continue;
            }
            tiers.computeIfAbsent(entry.getPriority(), p -> new ArrayList<>()).add(position);
        }

        int[] tiered = new int[entries.size() - (currentPosition < 0 ? 0 : 1)];
        int filled = 0;
        for (List<Integer> tier : tiers.values()) {
            int tierStart = filled;
            for (Integer position : tier) {
                tiered[filled++] = position;
            }
            shuffle(tiered, tierStart, filled);
        }

        int[] result = new int[entries.size()];
        if (currentPosition < 0) {
            System.arraycopy(tiered, 0, result, 0, tiered.length);
            cursor = -1;
        } else {
            cursor = Math.max(0, Math.min(cursor, entries.size() - 1));
            int after = entries.size() - cursor - 1;
            System.arraycopy(tiered, after, result, 0, cursor);
            result[cursor] = currentPosition;
            System.arraycopy(tiered, 0, result, cursor + 1, after);
        }

        order = result;
        inverse = new int[result.length];
        for (int orderIndex = 0; orderIndex < result.length; orderIndex++) {
            inverse[result[orderIndex]] = orderIndex;
        }
        valid = true;
        LOGGER.debug("Generated random order over {} entries, {} priority tiers, cursor {}",
                result.length, tiers.size(), cursor);
        return result.clone();
    }

    public int positionAt(int orderIndex) {
        if (orderIndex < 0 || orderIndex >= order.length) {
            throw QueueException.invalidRange("Bad order index %d for order of %d", orderIndex, order.length);
        }
        return order[orderIndex];
    }

    public int orderIndexOf(int position) {
        if (position < 0 || position >= inverse.length) {
            throw QueueException.invalidRange("Bad song index %d for order of %d", position, inverse.length);
        }
        return inverse[position];
    }

    public int next(int cursor, boolean repeat) {
        return next(cursor, order.length, repeat);
    }

    public int previous(int cursor, boolean repeat) {
        return previous(cursor, order.length, repeat);
    }

    /**
     * Order index after {@code cursor}; a cursor of {@code -1} means "before the first".
     */
    public static int next(int cursor, int length, boolean repeat) {
        if (length == 0) {
            throw new QueueException(QueueException.ErrorType.END_OF_QUEUE, "Queue is empty");
        }
        if (cursor + 1 < length) {
            return cursor + 1;
        }
        if (repeat) {
            return 0;
        }
        throw new QueueException(QueueException.ErrorType.END_OF_QUEUE);
    }

    public static int previous(int cursor, int length, boolean repeat) {
        if (length == 0) {
            throw new QueueException(QueueException.ErrorType.END_OF_QUEUE, "Queue is empty");
        }
        if (cursor > 0) {
            return Math.min(cursor, length) - 1;
        }
        if (repeat) {
            return length - 1;
        }
        throw new QueueException(QueueException.ErrorType.END_OF_QUEUE);
    }

    private void shuffle(int[] values, int from, int to) {
        for (int i = to - 1; i > from; i--) {
            int j = from + random.nextInt(i - from + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
