package io.kneo.playqueue.model;

/**
 * Half-open {@code [start, end)} range of queue positions.
 */
public record PositionRange(int start, int end) {

    public static PositionRange single(int position) {
        return new PositionRange(position, position + 1);
    }
}
