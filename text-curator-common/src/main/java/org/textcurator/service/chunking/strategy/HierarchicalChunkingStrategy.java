package org.textcurator.service.chunking.strategy;

import lombok.extern.slf4j.Slf4j;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.language.LanguageProfile;
import org.textcurator.service.language.SectionHeader;

import java.util.Iterator;
import java.util.List;

/**
 * Chunks along the document's heading structure.
 *
 * <p>Each section (its heading line plus the text up to the next heading of any
 * level) becomes a chunk tagged with its level, title, path and the id of its
 * parent section's first chunk. Sections over the maximum size are split by
 * sentence; the pieces share the section's tags. Small leaf sections are merged
 * into their next leaf sibling first.</p>
 */
@Slf4j
public class HierarchicalChunkingStrategy extends AbstractChunkingStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.HIERARCHICAL;
    }

    @Override
    protected Iterator<Chunk> openCursor(ChunkAssembler assembler, CancellationToken token) {
        return new SectionCursor(assembler, token);
    }

    @Override
    public int estimateChunkCount(String text, LanguageProfile profile, ChunkOptions options) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        List<SectionHeader> headers = profile.findSectionHeaders(text);
        boolean preamble = headers.isEmpty()
                ? !text.isBlank()
                : !text.substring(0, headers.get(0).start()).isBlank();
        int bySize = (int) Math.ceil((double) profile.estimateTokenCount(text) / options.getMaxChunkSize());
        return Math.max(headers.size() + (preamble ? 1 : 0), bySize);
    }

    private static final class SectionCursor extends ChunkCursor {

        private final ChunkAssembler assembler;
        private final long maxWeight;

        private SectionTree tree;
        private int nextNode;
        private Iterator<Chunk> pieces;

        SectionCursor(ChunkAssembler assembler, CancellationToken token) {
            super(token);
            this.assembler = assembler;
            this.maxWeight = LanguageProfile.toWeight(assembler.options().getMaxChunkSize());
        }

        @Override
        protected Chunk computeNext() {
            if (tree == null) {
                tree = SectionTree.build(assembler.text(), assembler.profile());
                tree.mergeSmallLeaves(LanguageProfile.toWeight(assembler.options().getMinChunkSize()));
                log.debug("Built section tree with {} headings", tree.size() - 1);
                cancellationToken().throwIfCancelled();
            }

            while (true) {
                if (pieces != null) {
                    if (pieces.hasNext()) {
                        return pieces.next();
                    }
                    pieces = null;
                }
                if (nextNode >= tree.size()) {
                    return null;
                }

                int index = nextNode++;
                SectionTree.Node node = tree.node(index);
                if (node.absorbed) {
                    continue;
                }
                HierarchyTag tag = tree.tagOf(index);

                if (node.weight <= maxWeight) {
                    Chunk chunk = assembler.assemble(node.start, node.end, tag, node.firstChunkId);
                    if (chunk != null) {
                        return chunk;
                    }
                    continue;
                }

                cancellationToken().throwIfCancelled();
                UnitAccumulatingCursor cursor =
                        SentenceChunkingStrategy.cursorOver(assembler, node.start, node.end, cancellationToken());
                cursor.tagWith(tag);
                pieces = cursor;
            }
        }
    }
}
