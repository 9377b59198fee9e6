package io.kneo.playqueue.model;

/**
 * Coalesced notification delivered once per externally visible mutation.
 *
 * @param version        queue version after the mutation
 * @param length         queue length after the mutation
 * @param lowestTouched  lowest position touched by the mutation
 * @param currentRemoved the entry marked as playing was removed and the playback engine must pick another one
 */
public record QueueChange(String partition, long version, int length, int lowestTouched, boolean currentRemoved) {
}
