package org.textcurator.service.preprocess;

/**
 * A text transformation applied before chunking, such as noise removal or masking.
 */
public interface TextPreprocessor {

    /**
     * Short identifier reported in {@link org.textcurator.model.PreprocessingResult}.
     */
    String name();

    /**
     * @param text non-null input
     * @return the transformed text, never {@code null}
     */
    String process(String text);
}
