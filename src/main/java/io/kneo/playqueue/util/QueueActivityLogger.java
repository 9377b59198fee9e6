package io.kneo.playqueue.util;

import io.kneo.playqueue.model.QueueChange;
import io.kneo.playqueue.model.QueueItem;
import io.kneo.playqueue.model.cnst.PlayerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One line per coalesced queue change or player transition, with the partition and the
 * command that caused it in the MDC.
 */
public class QueueActivityLogger {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueueActivityLogger.class);
    private static final String PARTITION_KEY = "partition";
    private static final String ACTION_KEY = "action";

    private QueueActivityLogger() {
    }

    public static void logChange(String action, QueueChange change) {
        withContext(change.partition(), action, () -> {
            if (change.currentRemoved()) {
                LOGGER.info("QUEUE_CHANGE {} -> v{} length={} from={} (current entry removed)",
                        action, change.version(), change.length(), change.lowestTouched());
            } else {
                LOGGER.info("QUEUE_CHANGE {} -> v{} length={} from={}",
                        action, change.version(), change.length(), change.lowestTouched());
            }
        });
    }

    public static void logPlayer(String partition, String action, PlayerState state, QueueItem current) {
        withContext(partition, action, () -> {
            if (current == null) {
                LOGGER.info("PLAYER {} -> {}", action, state);
            } else {
                LOGGER.info("PLAYER {} -> {} id={} pos={} {}",
                        action, state, current.id(), current.position(), current.song());
            }
        });
    }

    private static void withContext(String partition, String action, Runnable log) {
        try {
            MDC.put(PARTITION_KEY, partition);
            MDC.put(ACTION_KEY, action);
            log.run();
        } finally {
            MDC.remove(PARTITION_KEY);
            MDC.remove(ACTION_KEY);
        }
    }
}
