package io.kneo.playqueue.model;

/**
 * Read-only view of one queue entry at the moment it was taken.
 */
public record QueueItem(int position, int id, int priority, long version, Song song) {
}
