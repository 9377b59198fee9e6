package io.kneo.playqueue.queue;

import io.kneo.playqueue.model.QueueItem;
import io.kneo.playqueue.model.Song;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
class QueueEntry {
    private final int id;
    private Song song;
    private int priority;
    private long version;

    QueueEntry(int id, Song song, long version) {
        this.id = id;
        this.song = song;
        this.version = version;
    }

    QueueItem toItem(int position) {
        return new QueueItem(position, id, priority, version, song);
    }
}
