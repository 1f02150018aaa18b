package eu.virtualparadox.paperrank.corpus.signal;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;

/**
 * Venue specific reading of review scores as a signal in [0,1].
 */
public interface ReviewSignalExtractor {

    /**
     * @param venue venue tag of a paper record, e.g. {@code NeurIPS}
     */
    boolean supports(String venue);

    /**
     * @return normalised review signal, or {@code null} if the paper carries no score
     */
    Double extract(PaperRecord paper);
}
