package io.kneo.playqueue.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * Already-resolved track descriptor owned by a queue entry.
 * <p>
 * {@code startMs}/{@code endMs} restrict playback to a part of the track;
 * an {@code endMs} of zero means "until the end".
 */
@Getter
@Builder(toBuilder = true)
public class Song {
    private final String uri;
    @Singular
    private final Map<String, String> tags;
    private final long startMs;
    private final long endMs;

    public static Song of(String uri) {
        return Song.builder().uri(uri).build();
    }

    public String getTag(String name) {
        return tags.get(name);
    }

    public Song withRange(long startMs, long endMs) {
        return toBuilder().startMs(startMs).endMs(endMs).build();
    }

    @Override
    public String toString() {
        return uri;
    }
}
