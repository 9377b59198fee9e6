package io.kneo.playqueue.model;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PlaybackOptions {
    private boolean random;
    private boolean repeat;
    private boolean single;
    private boolean consume;

    public PlaybackOptions copy() {
        PlaybackOptions copy = new PlaybackOptions();
        copy.setRandom(random);
        copy.setRepeat(repeat);
        copy.setSingle(single);
        copy.setConsume(consume);
        return copy;
    }

    @Override
    public String toString() {
        return String.format("random=%s, repeat=%s, single=%s, consume=%s", random, repeat, single, consume);
    }
}
