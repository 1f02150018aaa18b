package eu.virtualparadox.paperrank.corpus.provider;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;

import java.io.IOException;
import java.util.List;

/**
 * Read-only source of pre-fetched venue/year corpora.
 */
public interface CorpusProvider {

    /**
     * @param venue conference name, e.g. {@code NeurIPS}
     * @param year  conference year
     * @return every paper of the edition, possibly empty
     * @throws IOException if the corpus cannot be read
     */
    List<PaperRecord> fetch(String venue, int year) throws IOException;
}
