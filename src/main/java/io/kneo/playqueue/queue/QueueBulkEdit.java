package io.kneo.playqueue.queue;

/**
 * Exclusive, nestable edit scope over a {@link PlayQueue}.
 * <p>
 * While at least one scope is open on a queue, mutations only accumulate; closing
 * the outermost one bumps the version once (if anything changed), invalidates the
 * random order once and notifies listeners. Meant for try-with-resources:
 * <pre>
 * try (QueueBulkEdit edit = queue.beginBulkEdit()) {
 *     queue.append(a);
 *     queue.append(b);
 * }
 * </pre>
 */
public final class QueueBulkEdit implements AutoCloseable {
    private final PlayQueue queue;
    private boolean closed;

    QueueBulkEdit(PlayQueue queue) {
        this.queue = queue;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.endBulkEdit();
    }
}
