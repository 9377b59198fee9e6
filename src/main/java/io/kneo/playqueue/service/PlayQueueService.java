package io.kneo.playqueue.service;

import io.kneo.playqueue.config.PlayQueueConfig;
import io.kneo.playqueue.model.QueueChange;
import io.kneo.playqueue.queue.PlayQueue;
import io.kneo.playqueue.queue.QueueListener;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the play queue of every partition and fans their changes out to sessions.
 */
@ApplicationScoped
public class PlayQueueService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlayQueueService.class);
    public static final String DEFAULT_PARTITION = "default";

    private final ConcurrentHashMap<String, PlayQueue> pool = new ConcurrentHashMap<>();
    private final BroadcastProcessor<QueueChange> changes = BroadcastProcessor.create();

    @Inject
    PlayQueueConfig config;

    void onStart(@Observes StartupEvent event) {
        for (String partition : config.getPartitions()) {
            getQueue(partition);
        }
        LOGGER.info("Play queue partitions ready: {}", partitions());
    }

    public PlayQueue getQueue(String partition) {
        return pool.computeIfAbsent(partition, this::createQueue);
    }

    public PlayQueue getDefaultQueue() {
        return getQueue(DEFAULT_PARTITION);
    }

    public Optional<PlayQueue> findQueue(String partition) {
        return Optional.ofNullable(pool.get(partition));
    }

    public Uni<PlayQueue> get(String partition) {
        return Uni.createFrom().item(() -> getQueue(partition));
    }

    public Set<String> partitions() {
        return new TreeSet<>(pool.keySet());
    }

    public boolean deletePartition(String partition) {
        if (DEFAULT_PARTITION.equals(partition)) {
            LOGGER.warn("Refusing to delete the default partition");
            return false;
        }
        PlayQueue removed = pool.remove(partition);
        if (removed != null) {
            LOGGER.info("Deleted partition {}", partition);
        }
        return removed != null;
    }

    /**
     * Hot stream of coalesced changes of one partition; subscribers see changes made
     * after they subscribed.
     */
    public Multi<QueueChange> changes(String partition) {
        return changes.select().where(change -> change.partition().equals(partition));
    }

    private PlayQueue createQueue(String partition) {
        PlayQueue queue = new PlayQueue(partition, config.getMaxLength(), config.getHistoryHorizon(), new Random());
        queue.addListener(new ChangePublisher());
        return queue;
    }

    private class ChangePublisher implements QueueListener {

        @Override
        public void onQueueModified(QueueChange change) {
            LOGGER.debug("Partition {} now at version {} with {} entries",
                    change.partition(), change.version(), change.length());
            synchronized (changes) {
                changes.onNext(change);
            }
        }
    }
}
