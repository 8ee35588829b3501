package org.textcurator.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request payload for the single-text chunking endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkRequest {

    /** Text to chunk. */
    private String text;

    /** Optional overrides of the configured chunking defaults. */
    private ChunkOptionsRequest options;
}
