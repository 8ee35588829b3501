package org.textcurator.service.chunking.strategy;

import org.textcurator.model.Chunk;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.chunking.strategy.TextSegmenter.TextSegment;
import org.textcurator.service.language.LanguageProfile;

import java.util.List;

/**
 * Greedy accumulation of text units (sentences or paragraphs) into chunks.
 *
 * <p>A chunk is closed when the next unit would push it past the maximum
 * size and it already holds the minimum, or when {@link #closesBefore} says
 * so. A unit heavier than the maximum always becomes a chunk of its own.</p>
 *
 * <p>Between chunks the cursor may carry text into the next buffer: either
 * overlap (repeated text, dropped when nothing new follows) or content that
 * has not been emitted yet.</p>
 */
abstract class UnitAccumulatingCursor extends ChunkCursor {

    protected final ChunkAssembler assembler;
    protected final List<TextSegment> units;
    protected final long minWeight;
    protected final long maxWeight;

    protected int nextUnit;

    private HierarchyTag hierarchyTag;
    private boolean tagIdAssigned;

    private int carryStart = -1;
    private int carryEnd = -1;
    private long carryWeight;
    private boolean carryIsContent;

    UnitAccumulatingCursor(ChunkAssembler assembler, List<TextSegment> units, CancellationToken cancellationToken) {
        this(assembler, units, assembler.options().getMinChunkSize(), assembler.options().getMaxChunkSize(),
                cancellationToken);
    }

    UnitAccumulatingCursor(ChunkAssembler assembler, List<TextSegment> units, int minTokens, int maxTokens,
                           CancellationToken cancellationToken) {
        super(cancellationToken);
        this.assembler = assembler;
        this.units = units;
        this.minWeight = LanguageProfile.toWeight(minTokens);
        this.maxWeight = LanguageProfile.toWeight(maxTokens);
    }

    /**
     * Stamps every chunk of this cursor with {@code tag}; the first one receives the tag's id.
     */
    void tagWith(HierarchyTag tag) {
        this.hierarchyTag = tag;
        this.tagIdAssigned = false;
    }

    /**
     * Whether the chunk must close before {@code units[unitIndex]}, on top of the size guards.
     */
    protected boolean closesBefore(int unitIndex, long bufferWeight) {
        return false;
    }

    /**
     * Called when {@code units[unitIndex]} joins the buffer.
     *
     * @param firstOfChunk whether it is the first new unit of the chunk
     */
    protected void onAppend(int unitIndex, boolean firstOfChunk) {
    }

    /**
     * Start offset of the overlap carried after a chunk spanning {@code [chunkStart, chunkEnd)}
     * whose new units are {@code units[firstUnit, endUnit)}; {@code chunkEnd} when there is none.
     */
    protected int overlapStart(int chunkStart, int chunkEnd, int firstUnit, int endUnit) {
        long budget = LanguageProfile.toWeight(assembler.options().getOverlapSize());
        int start = chunkEnd;
        long accumulated = 0;
        for (int k = endUnit - 1; k > firstUnit; k--) {
            TextSegment unit = units.get(k);
            if (accumulated + unit.weight() > budget) {
                break;
            }
            accumulated += unit.weight();
            start = unit.startOffset();
        }
        return start;
    }

    protected boolean hasUnits() {
        return nextUnit < units.size();
    }

    protected boolean hasContentCarry() {
        return carryIsContent && carryStart >= 0;
    }

    /**
     * Places not-yet-emitted content at the head of the next buffer.
     */
    protected void carryContent(int start, int end, long weight) {
        carryStart = start;
        carryEnd = end;
        carryWeight = weight;
        carryIsContent = true;
    }

    protected void clearCarry() {
        carryStart = -1;
        carryEnd = -1;
        carryWeight = 0;
        carryIsContent = false;
    }

    /**
     * Emits carried content on its own.
     *
     * @return the chunk, or {@code null} when nothing is carried
     */
    protected Chunk flushContentCarry() {
        if (!hasContentCarry()) {
            clearCarry();
            return null;
        }
        Chunk chunk = emit(carryStart, carryEnd);
        clearCarry();
        return chunk;
    }

    /**
     * Builds the next chunk from the carry and the following units.
     */
    protected Chunk accumulate() {
        int start = carryStart;
        int end = carryEnd;
        long weight = carryWeight;
        boolean hasNew = hasContentCarry();
        int firstUnit = nextUnit;
        boolean firstOfChunk = true;

        while (nextUnit < units.size()) {
            TextSegment unit = units.get(nextUnit);

            if (unit.weight() > maxWeight) {
                if (hasNew) {
                    break;
                }
                // an oversized unit is emitted alone; carried overlap is dropped
                start = unit.startOffset();
                end = unit.endOffset();
                weight = unit.weight();
                onAppend(nextUnit, true);
                nextUnit++;
                hasNew = true;
                break;
            }
            if (hasNew && weight + unit.weight() > maxWeight && weight >= minWeight) {
                break;
            }
            if (hasNew && closesBefore(nextUnit, weight)) {
                break;
            }

            if (start < 0) {
                start = unit.startOffset();
            }
            end = unit.endOffset();
            weight += unit.weight();
            onAppend(nextUnit, firstOfChunk);
            firstOfChunk = false;
            hasNew = true;
            nextUnit++;
        }

        clearCarry();
        if (!hasNew) {
            return null;
        }

        if (assembler.options().getOverlapSize() > 0 && nextUnit < units.size()) {
            int overlapFrom = overlapStart(start, end, firstUnit, nextUnit);
            if (overlapFrom < end) {
                carryStart = overlapFrom;
                carryEnd = end;
                carryWeight = assembler.profile().tokenWeight(assembler.text(), overlapFrom, end);
                carryIsContent = false;
            }
        }
        return emit(start, end);
    }

    private Chunk emit(int start, int end) {
        if (hierarchyTag == null) {
            return assembler.assemble(start, end);
        }
        String id = tagIdAssigned ? null : hierarchyTag.firstChunkId();
        Chunk chunk = assembler.assemble(start, end, hierarchyTag, id);
        if (chunk != null) {
            tagIdAssigned = true;
        }
        return chunk;
    }
}
