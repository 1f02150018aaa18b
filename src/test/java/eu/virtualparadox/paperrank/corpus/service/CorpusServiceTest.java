package eu.virtualparadox.paperrank.corpus.service;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.application.config.ResilienceConfig;
import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.corpus.provider.CorpusProvider;
import eu.virtualparadox.paperrank.review.exception.CorpusEmptyException;
import eu.virtualparadox.paperrank.review.exception.UpstreamUnavailableException;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CorpusServiceTest {

    private PipelineConfig config;

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        config.setUpstreamMaxAttempts(3);
        config.setUpstreamInitialBackoff(Duration.ofMillis(1));
    }

    @Test
    @DisplayName("Transient read failures are retried")
    void testRetry() {
        final AtomicInteger calls = new AtomicInteger();
        final CorpusProvider provider = (venue, year) -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("flaky");
            }
            return List.of(paper("p1", "Accept (poster)"));
        };

        final List<PaperRecord> papers = service(provider).load("NeurIPS", 2024);

        assertEquals(1, papers.size());
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Exhausted retries surface as UpstreamUnavailableException")
    void testRetryExhausted() {
        final AtomicInteger calls = new AtomicInteger();
        final CorpusProvider provider = (venue, year) -> {
            calls.incrementAndGet();
            throw new IOException("down");
        };

        assertThrows(UpstreamUnavailableException.class, () -> service(provider).load("NeurIPS", 2024));
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("A corpus without papers is fatal")
    void testEmpty() {
        assertThrows(CorpusEmptyException.class, () -> service((venue, year) -> List.of()).load("NeurIPS", 2024));
    }

    @Test
    @DisplayName("Accepted-only drops rejected and withdrawn papers, keeps unknown decisions")
    void testAcceptedOnly() {
        final CorpusProvider provider = (venue, year) -> List.of(
                paper("a", "Accept (oral)"),
                paper("r", "Reject"),
                paper("w", "Withdrawn"),
                paper("u", ""));

        final List<String> ids = service(provider).load("NeurIPS", 2024).stream().map(PaperRecord::id).toList();
        assertEquals(List.of("a", "u"), ids);

        config.setAcceptedOnly(false);
        assertEquals(4, service(provider).load("NeurIPS", 2024).size());
    }

    @Test
    @DisplayName("A corpus emptied by accepted-only fails with a message naming the filter")
    void testAcceptedOnlyLeavesNothing() {
        final CorpusProvider provider = (venue, year) -> List.of(paper("r", "Reject"), paper("w", "Withdrawn"));

        final CorpusEmptyException e =
                assertThrows(CorpusEmptyException.class, () -> service(provider).load("ICLR", 2025));
        assertTrue(e.getMessage().contains("accepted-only"));
        assertTrue(e.getMessage().contains("2 papers"));

        config.setAcceptedOnly(false);
        assertEquals(2, service(provider).load("ICLR", 2025).size());
    }

    private CorpusService service(final CorpusProvider provider) {
        return new CorpusService(provider, config, RetryRegistry.of(ResilienceConfig.upstreamRetryConfig(config)));
    }

    private static PaperRecord paper(final String id, final String decision) {
        return PaperRecord.builder().id(id).title(id).decision(decision).build();
    }
}
