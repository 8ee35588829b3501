package org.textcurator.service.chunking;

import org.textcurator.model.Chunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for ordered chunk sequences.
 */
public final class ChunkSequence {

    private ChunkSequence() {}

    /**
     * Rewrites {@code index} and {@code totalChunks} so they are contiguous over the whole list.
     */
    public static List<Chunk> reindex(List<Chunk> chunks) {
        int total = chunks.size();
        List<Chunk> result = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            result.add(chunks.get(i).withPosition(i, total));
        }
        return result;
    }
}
