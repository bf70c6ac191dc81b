package dev.contentagents.backend;

import dev.contentagents.error.GenerationException;
import dev.contentagents.model.GenerationRequest;

/**
 * Abstraction over text-generation providers.
 */
public interface GenerationBackend {

    /**
     * Issue one request and return the raw response text. Failures must be classified:
     * rate limiting and timeouts as transient kinds, everything else as fatal.
     */
    String complete(GenerationRequest request) throws GenerationException;

    /** Backend display name. */
    String getName();
}
