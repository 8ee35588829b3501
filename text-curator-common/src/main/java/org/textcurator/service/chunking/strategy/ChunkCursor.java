package org.textcurator.service.chunking.strategy;

import org.textcurator.model.Chunk;
import org.textcurator.service.chunking.CancellationToken;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pull-based chunk producer: one chunk is computed per pull.
 *
 * <p>The cancellation token is checked before every computation. Cursors are
 * single-use and not thread-safe.</p>
 */
abstract class ChunkCursor implements Iterator<Chunk> {

    private final CancellationToken cancellationToken;
    private Chunk lookahead;
    private boolean exhausted;

    ChunkCursor(CancellationToken cancellationToken) {
        this.cancellationToken = cancellationToken;
    }

    /**
     * Computes the next chunk.
     *
     * @return the chunk, or {@code null} when the text is exhausted
     */
    protected abstract Chunk computeNext();

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        cancellationToken.throwIfCancelled();
        lookahead = computeNext();
        if (lookahead == null) {
            exhausted = true;
        }
        return lookahead != null;
    }

    @Override
    public Chunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Chunk chunk = lookahead;
        lookahead = null;
        return chunk;
    }

    protected CancellationToken cancellationToken() {
        return cancellationToken;
    }
}
