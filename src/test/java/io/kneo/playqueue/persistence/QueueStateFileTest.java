package io.kneo.playqueue.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kneo.playqueue.dto.QueueStateDTO;
import io.kneo.playqueue.dto.QueueStateEntryDTO;
import io.kneo.playqueue.model.PlaybackOptions;
import io.kneo.playqueue.model.QueueItem;
import io.kneo.playqueue.model.Song;
import io.kneo.playqueue.model.cnst.PlayerState;
import io.kneo.playqueue.queue.PlayQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueStateFileTest {

    @TempDir
    Path tempDir;

    private QueueStateFile stateFile;

    @BeforeEach
    void setUp() {
        stateFile = new QueueStateFile(new ObjectMapper());
    }

    @Test
    void testWriteAndReadBack() throws Exception {
        PlayQueue source = new PlayQueue("default", 100, 0, new Random(3));
        source.append(Song.builder().uri("music/a.flac").tag("artist", "Alpha").tag("title", "First").build());
        int second = source.append(Song.of("music/b.flac"));
        int third = source.append(Song.of("music/c.flac"));
        source.setPriorityId(third, 42);
        source.setSongRange(second, 1000, 61000);
        source.setRepeat(true);
        source.setConsume(true);
        source.play(1);
        source.pause();

        Path path = tempDir.resolve("state").resolve("queue.json");
        long written = stateFile.write(source, path);
        assertEquals(source.getVersion(), written);
        assertTrue(Files.exists(path));
        assertFalse(Files.exists(tempDir.resolve("state").resolve("queue.json.tmp")));

        PlayQueue target = new PlayQueue("default", 100, 0, new Random(3));
        long versionBefore = target.getVersion();
        assertTrue(stateFile.read(target, path));

        assertEquals(versionBefore + 1, target.getVersion());
        List<QueueItem> restored = target.snapshot();
        assertEquals(List.of("music/a.flac", "music/b.flac", "music/c.flac"),
                restored.stream().map(item -> item.song().getUri()).toList());
        assertEquals("Alpha", restored.get(0).song().getTag("artist"));
        assertEquals("First", restored.get(0).song().getTag("title"));
        assertEquals(1000, restored.get(1).song().getStartMs());
        assertEquals(61000, restored.get(1).song().getEndMs());
        assertEquals(42, restored.get(2).priority());
        assertEquals(0, restored.get(0).priority());

        PlaybackOptions options = target.getOptions();
        assertTrue(options.isRepeat());
        assertTrue(options.isConsume());
        assertFalse(options.isRandom());
        assertEquals(PlayerState.PAUSE, target.getState());
        assertEquals(1, target.current().orElseThrow().position());
    }

    @Test
    void testRestoreReplacesExistingContent() {
        PlayQueue source = new PlayQueue("default", 100);
        source.append(Song.of("new/one.mp3"));
        QueueStateDTO state = stateFile.capture(source);

        PlayQueue target = new PlayQueue("default", 100);
        target.append(Song.of("old/one.mp3"));
        target.append(Song.of("old/two.mp3"));
        target.play(0);
        long versionBefore = target.getVersion();

        stateFile.restore(target, state);

        assertEquals(versionBefore + 1, target.getVersion());
        assertEquals(1, target.size());
        assertEquals("new/one.mp3", target.get(0).song().getUri());
        assertTrue(target.current().isEmpty());
        assertEquals(PlayerState.STOP, target.getState());
    }

    @Test
    void testRestoreDropsEntriesBeyondCapacity() {
        PlayQueue target = new PlayQueue("default", 3);
        target.append(Song.of("keep-a.mp3"));
        target.append(Song.of("keep-b.mp3"));
        long versionBefore = target.getVersion();

        QueueStateDTO state = new QueueStateDTO();
        for (int i = 0; i < 5; i++) {
            state.getEntries().add(entry("s" + i + ".mp3", 0, 0, 0));
        }
        state.setCurrentPosition(4);
        state.setState(PlayerState.PLAY);

        stateFile.restore(target, state);

        assertEquals(List.of("s0.mp3", "s1.mp3", "s2.mp3"),
                target.snapshot().stream().map(item -> item.song().getUri()).toList());
        assertEquals(versionBefore + 1, target.getVersion());
        assertTrue(target.current().isEmpty());
        assertEquals(5, state.getEntries().size());
    }

    @Test
    void testRestoreSkipsDetailsTheQueueRejects() {
        QueueStateDTO state = new QueueStateDTO();
        state.getEntries().add(entry("a.mp3", 999, 0, 0));
        state.getEntries().add(entry("b.mp3", 0, 5000, 1000));
        state.getEntries().add(entry("c.mp3", 7, 100, 200));
        PlayQueue target = new PlayQueue("default", 10);

        stateFile.restore(target, state);

        assertEquals(3, target.size());
        assertEquals(0, target.get(0).priority());
        assertEquals(0, target.get(1).song().getStartMs());
        assertEquals(7, target.get(2).priority());
        assertEquals(100, target.get(2).song().getStartMs());
        assertEquals(200, target.get(2).song().getEndMs());
    }

    @Test
    void testCaptureDoesNotBumpVersion() {
        PlayQueue queue = new PlayQueue("default", 100);
        queue.append(Song.of("one.mp3"));
        long version = queue.getVersion();

        QueueStateDTO state = stateFile.capture(queue);

        assertEquals(version, state.getVersion());
        assertEquals(version, queue.getVersion());
        assertEquals(1, state.getEntries().size());
    }

    @Test
    void testMissingFileIsNotAnError() {
        PlayQueue queue = new PlayQueue("default", 100);
        long version = queue.getVersion();

        assertFalse(stateFile.read(queue, tempDir.resolve("absent.json")));
        assertEquals(version, queue.getVersion());
    }

    @Test
    void testUnknownFieldsAreIgnored() throws Exception {
        Path path = tempDir.resolve("queue.json");
        Files.writeString(path, "{\"partition\":\"default\",\"version\":7,\"format\":2,"
                + "\"entries\":[{\"uri\":\"x.ogg\",\"priority\":5,\"rating\":3}]}");
        PlayQueue queue = new PlayQueue("default", 100);

        assertTrue(stateFile.read(queue, path));
        assertEquals("x.ogg", queue.get(0).song().getUri());
        assertEquals(5, queue.get(0).priority());
    }

    private static QueueStateEntryDTO entry(String uri, int priority, long startMs, long endMs) {
        QueueStateEntryDTO entry = new QueueStateEntryDTO();
        entry.setUri(uri);
        entry.setPriority(priority);
        entry.setStartMs(startMs);
        entry.setEndMs(endMs);
        return entry;
    }
}
