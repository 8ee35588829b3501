package org.textcurator.service.chunking;

/**
 * Thrown when chunking options are contradictory or a strategy requires a
 * collaborator that has not been configured.
 *
 * <p>Always raised before any chunking work starts.</p>
 */
public class ChunkingConfigurationException extends IllegalArgumentException {

    public ChunkingConfigurationException(String message) {
        super(message);
    }
}
