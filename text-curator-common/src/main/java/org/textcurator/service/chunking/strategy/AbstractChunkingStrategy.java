package org.textcurator.service.chunking.strategy;

import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.chunking.ChunkSequence;
import org.textcurator.service.language.LanguageProfile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Common plumbing for strategies built on a {@link ChunkCursor}.
 */
public abstract class AbstractChunkingStrategy implements ChunkingStrategy {

    @Override
    public List<Chunk> chunk(String text, LanguageProfile profile, ChunkOptions options, CancellationToken token) {
        Iterator<Chunk> cursor = chunkIterator(text, profile, options, token);
        List<Chunk> chunks = new ArrayList<>();
        while (cursor.hasNext()) {
            chunks.add(cursor.next());
        }
        return ChunkSequence.reindex(chunks);
    }

    @Override
    public Iterator<Chunk> chunkIterator(String text, LanguageProfile profile, ChunkOptions options,
                                         CancellationToken token) {
        if (text == null || text.isBlank()) {
            return Collections.emptyIterator();
        }
        return openCursor(new ChunkAssembler(text, profile, options, type()), token);
    }

    /**
     * Opens a cursor over non-blank text.
     */
    protected abstract Iterator<Chunk> openCursor(ChunkAssembler assembler, CancellationToken token);

    /**
     * Estimate shared by the size-driven strategies: one chunk when everything fits,
     * otherwise the total divided by the tokens each chunk adds beyond its overlap.
     */
    protected static int estimateBySize(String text, LanguageProfile profile, ChunkOptions options, int overlap) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int total = profile.estimateTokenCount(text);
        if (total <= options.getMaxChunkSize()) {
            return 1;
        }
        int step = options.getTargetChunkSize() - overlap;
        if (step <= 0) {
            step = Math.max(1, options.getTargetChunkSize() / 2);
        }
        return (int) Math.ceil((double) total / step);
    }
}
