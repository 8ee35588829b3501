package org.textcurator.model;

import java.util.List;

/**
 * Outcome of running the preprocessing pipeline followed by chunking.
 *
 * @param originalText         text as received
 * @param processedText        text after every preprocessor ran
 * @param chunks               chunks of the processed text
 * @param appliedPreprocessors preprocessor names, in execution order
 */
public record PreprocessingResult(
        String originalText,
        String processedText,
        List<Chunk> chunks,
        List<String> appliedPreprocessors
) {
}
