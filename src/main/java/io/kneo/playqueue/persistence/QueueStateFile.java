package io.kneo.playqueue.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.kneo.playqueue.dto.QueueStateDTO;
import io.kneo.playqueue.dto.QueueStateEntryDTO;
import io.kneo.playqueue.model.PlaybackOptions;
import io.kneo.playqueue.model.QueueItem;
import io.kneo.playqueue.model.Song;
import io.kneo.playqueue.model.cnst.PlayerState;
import io.kneo.playqueue.queue.PlayQueue;
import io.kneo.playqueue.queue.QueueBulkEdit;
import io.kneo.playqueue.service.exceptions.QueueException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Saves a queue as JSON and rebuilds it through the regular queue operations.
 */
@ApplicationScoped
public class QueueStateFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueueStateFile.class);

    private final ObjectMapper objectMapper;

    @Inject
    public QueueStateFile(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public QueueStateDTO capture(PlayQueue queue) {
        try (QueueBulkEdit ignored = queue.beginBulkEdit()) {
            QueueStateDTO dto = new QueueStateDTO();
            dto.setPartition(queue.getPartition());
            dto.setVersion(queue.getVersion());
            dto.setState(queue.getState());
            queue.current().ifPresent(item -> dto.setCurrentPosition(item.position()));
            PlaybackOptions options = queue.getOptions();
            dto.setRandom(options.isRandom());
            dto.setRepeat(options.isRepeat());
            dto.setSingle(options.isSingle());
            dto.setConsume(options.isConsume());
            for (QueueItem item : queue.snapshot()) {
                dto.getEntries().add(toEntry(item));
            }
            return dto;
        }
    }

    /**
     * Replaces the queue content with {@code state}: all songs are inserted inside one
     * bulk edit, priorities and ranges are applied afterwards, then options and the
     * current entry. Entries beyond the queue's capacity are dropped before anything
     * is cleared; a priority or range the queue rejects is skipped for that entry only.
     */
    public void restore(PlayQueue queue, QueueStateDTO state) {
        List<QueueStateEntryDTO> entries = state.getEntries();
        if (entries.size() > queue.getMaxLength()) {
            LOGGER.warn("State file holds {} entries but partition {} takes at most {}, dropping the rest",
                    entries.size(), queue.getPartition(), queue.getMaxLength());
            entries = entries.subList(0, queue.getMaxLength());
        }
        try (QueueBulkEdit ignored = queue.beginBulkEdit()) {
            queue.clear();
            List<Integer> ids = new ArrayList<>(entries.size());
            for (QueueStateEntryDTO entry : entries) {
                Song song = Song.builder()
                        .uri(entry.getUri())
                        .tags(entry.getTags() == null ? Map.of() : entry.getTags())
                        .build();
                ids.add(queue.append(song));
            }
            for (int i = 0; i < ids.size(); i++) {
                QueueStateEntryDTO entry = entries.get(i);
                try {
                    if (entry.getPriority() != 0) {
                        queue.setPriorityId(ids.get(i), entry.getPriority());
                    }
                    if (entry.getStartMs() != 0 || entry.getEndMs() != 0) {
                        queue.setSongRange(ids.get(i), entry.getStartMs(), entry.getEndMs());
                    }
                } catch (QueueException e) {
                    LOGGER.warn("Skipping stored details of {} at {}: {}", entry.getUri(), i, e.getMessage());
                }
            }
            queue.setRandom(state.isRandom());
            queue.setRepeat(state.isRepeat());
            queue.setSingle(state.isSingle());
            queue.setConsume(state.isConsume());

            Integer current = state.getCurrentPosition();
            if (current != null && current >= 0 && current < ids.size()) {
                queue.playId(ids.get(current));
                if (state.getState() == PlayerState.PAUSE) {
                    queue.pause();
                } else if (state.getState() != PlayerState.PLAY) {
                    queue.stop();
                }
            }
        }
        LOGGER.info("Restored {} entries into partition {}", entries.size(), queue.getPartition());
    }

    /**
     * @return the queue version that was written
     */
    public long write(PlayQueue queue, Path path) {
        QueueStateDTO state = capture(queue);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(temp.toFile(), state);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write queue state to " + path, e);
        }
        LOGGER.info("Saved {} entries of partition {} to {}", state.getEntries().size(), queue.getPartition(), path);
        return state.getVersion();
    }

    /**
     * @return {@code false} if there is no state file yet
     */
    public boolean read(PlayQueue queue, Path path) {
        if (!Files.exists(path)) {
            LOGGER.info("No queue state file at {}", path);
            return false;
        }
        QueueStateDTO state;
        try {
            state = objectMapper.readValue(path.toFile(), QueueStateDTO.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read queue state from " + path, e);
        }
        restore(queue, state);
        return true;
    }

    private static QueueStateEntryDTO toEntry(QueueItem item) {
        QueueStateEntryDTO entry = new QueueStateEntryDTO();
        Song song = item.song();
        entry.setUri(song.getUri());
        entry.getTags().putAll(song.getTags());
        entry.setPriority(item.priority());
        entry.setStartMs(song.getStartMs());
        entry.setEndMs(song.getEndMs());
        return entry;
    }
}
