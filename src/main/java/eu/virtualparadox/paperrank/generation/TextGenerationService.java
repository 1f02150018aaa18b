package eu.virtualparadox.paperrank.generation;

import eu.virtualparadox.paperrank.review.exception.GenerationTimeoutException;
import eu.virtualparadox.paperrank.review.exception.UpstreamUnavailableException;

/**
 * Text-generation capability used for keyword extraction, synonym expansion
 * and rubric scoring. The returned text is unreliable: callers own parsing
 * and validation.
 */
public interface TextGenerationService {

    /**
     * @param request instructions, context and the expected response shape
     * @return raw generated text, possibly empty
     * @throws UpstreamUnavailableException if the generator cannot be reached
     * @throws GenerationTimeoutException   if the generator does not answer in time
     */
    String generate(GenerationRequest request);
}
