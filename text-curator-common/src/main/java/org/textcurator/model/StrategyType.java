package org.textcurator.model;

/**
 * Chunking strategies selectable through {@link ChunkOptions}.
 */
public enum StrategyType {

    /** Resolved to a concrete strategy from the text's structure before chunking starts. */
    AUTO,

    SENTENCE,

    PARAGRAPH,

    TOKEN,

    /** Requires a similarity oracle. */
    SEMANTIC,

    HIERARCHICAL
}
