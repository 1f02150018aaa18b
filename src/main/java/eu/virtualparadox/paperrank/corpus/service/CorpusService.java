package eu.virtualparadox.paperrank.corpus.service;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.application.config.ResilienceConfig;
import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.corpus.provider.CorpusProvider;
import eu.virtualparadox.paperrank.review.exception.CorpusEmptyException;
import eu.virtualparadox.paperrank.review.exception.UpstreamUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Loads the venue/year corpus a run works on.
 * <p>
 * Read failures are retried with backoff; when the budget is exhausted the
 * {@link UpstreamUnavailableException} reaches the caller. A corpus without
 * any paper is rejected with {@link CorpusEmptyException}. With
 * {@code accepted-only} set, rejected and withdrawn papers are dropped; if
 * that leaves nothing, the exception names the filter.
 */
@Slf4j
@Service
public class CorpusService {

    private final CorpusProvider corpusProvider;
    private final PipelineConfig pipelineConfig;
    private final Retry retry;

    public CorpusService(final CorpusProvider corpusProvider,
                         final PipelineConfig pipelineConfig,
                         final RetryRegistry retryRegistry) {
        this.corpusProvider = corpusProvider;
        this.pipelineConfig = pipelineConfig;
        this.retry = retryRegistry.retry(ResilienceConfig.CORPUS);
    }

    public List<PaperRecord> load(final String venue, final int year) {
        final List<PaperRecord> papers = Retry.decorateSupplier(retry, () -> fetchOnce(venue, year)).get();
        if (papers.isEmpty()) {
            throw new CorpusEmptyException("Corpus " + venue + " " + year + " holds no paper");
        }
        if (!pipelineConfig.isAcceptedOnly()) {
            log.info("Corpus {} {}: {} papers", venue, year, papers.size());
            return papers;
        }

        final List<PaperRecord> accepted = papers.stream()
                .filter(CorpusService::isAccepted)
                .toList();
        log.info("Corpus {} {}: {} papers, {} kept as accepted", venue, year, papers.size(), accepted.size());
        if (accepted.isEmpty()) {
            throw new CorpusEmptyException("Corpus " + venue + " " + year + " holds " + papers.size()
                    + " papers but none is accepted; disable paperrank.pipeline.accepted-only to rank them");
        }
        return accepted;
    }

    /**
     * Unknown decisions count as accepted; only explicit rejections and
     * withdrawals are dropped.
     */
    public static boolean isAccepted(final PaperRecord paper) {
        final String decision = paper.decision().toLowerCase(Locale.ROOT);
        return !decision.contains("reject") && !decision.contains("withdraw");
    }

    private List<PaperRecord> fetchOnce(final String venue, final int year) {
        try {
            return corpusProvider.fetch(venue, year);
        } catch (IOException e) {
            log.warn("Reading corpus {} {} failed: {}", venue, year, e.getMessage());
            throw new UpstreamUnavailableException("Corpus " + venue + " " + year + " unavailable", e);
        }
    }
}
