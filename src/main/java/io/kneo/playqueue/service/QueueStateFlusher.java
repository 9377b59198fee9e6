package io.kneo.playqueue.service;

import io.kneo.playqueue.config.PlayQueueConfig;
import io.kneo.playqueue.persistence.QueueStateFile;
import io.kneo.playqueue.queue.PlayQueue;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Keeps the default partition's queue in the state file: loaded on startup, written
 * periodically when its version moved, and once more on shutdown.
 */
@ApplicationScoped
public class QueueStateFlusher {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueueStateFlusher.class);

    @Inject
    PlayQueueConfig config;

    @Inject
    PlayQueueService playQueueService;

    @Inject
    QueueStateFile queueStateFile;

    private volatile long lastSavedVersion = -1;

    void onStart(@Observes StartupEvent ev) {
        Optional<Path> path = stateFile();
        if (path.isEmpty()) {
            LOGGER.info("Queue state file disabled");
            return;
        }
        PlayQueue queue = playQueueService.getDefaultQueue();
        try {
            if (queueStateFile.read(queue, path.get())) {
                lastSavedVersion = queue.getVersion();
            }
        } catch (RuntimeException e) {
            lastSavedVersion = queue.getVersion();
            LOGGER.error("Failed to restore queue from {}, leaving the file alone until the queue changes",
                    path.get(), e);
        }
    }

    void onStop(@Observes ShutdownEvent ev) {
        LOGGER.info("Application shutting down, saving queue state...");
        flush();
    }

    @Scheduled(every = "${playqueue.state-file.interval:2m}", identity = "queue-state-flush")
    void scheduledFlush() {
        flush();
    }

    public boolean flush() {
        Optional<Path> path = stateFile();
        if (path.isEmpty()) {
            return false;
        }
        PlayQueue queue = playQueueService.getDefaultQueue();
        long version = queue.getVersion();
        if (version == lastSavedVersion) {
            LOGGER.debug("Scheduled flush: queue unchanged at version {}", version);
            return false;
        }
        try {
            lastSavedVersion = queueStateFile.write(queue, path.get());
            return true;
        } catch (RuntimeException e) {
            LOGGER.error("Failed to save queue state to {}", path.get(), e);
            return false;
        }
    }

    private Optional<Path> stateFile() {
        return config.getStateFilePath()
                .filter(p -> !p.isBlank())
                .map(Path::of);
    }
}
