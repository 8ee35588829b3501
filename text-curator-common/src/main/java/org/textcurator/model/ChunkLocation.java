package org.textcurator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Position of a chunk within the original text.
 *
 * <p>Offsets are character positions into the text handed to the chunker,
 * {@code startPosition <= endPosition}. Line numbers are 1-based.</p>
 */
@Value
@Builder(toBuilder = true)
public class ChunkLocation {

    int startPosition;
    int endPosition;
    int startLine;
    int endLine;

    /** Slash-joined heading titles from the document root; empty outside hierarchical chunking. */
    @Builder.Default
    String sectionPath = "";
}
