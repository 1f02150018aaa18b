package eu.virtualparadox.paperrank.application.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.paperrank.cache.CaffeineKeyValueStore;
import eu.virtualparadox.paperrank.cache.JsonFileKeyValueStore;
import eu.virtualparadox.paperrank.cache.KeyValueStore;
import eu.virtualparadox.paperrank.query.synonym.SynonymSet;
import eu.virtualparadox.paperrank.rank.evaluate.RubricScore;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Memoization stores for synonym sets and rubric scores. Process-scoped
 * Caffeine stores by default; JSON files under {@code paperrank.cache} when
 * {@code paperrank.pipeline.persistent-cache} is set.
 */
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private static final long MAX_ENTRIES = 50_000;

    private final ApplicationConfig applicationConfig;
    private final PipelineConfig pipelineConfig;
    private final ObjectMapper objectMapper;

    @Bean
    public KeyValueStore<SynonymSet> synonymStore() {
        return store("synonyms", SynonymSet.class);
    }

    @Bean
    public KeyValueStore<RubricScore> rubricStore() {
        return store("rubric", RubricScore.class);
    }

    private <V> KeyValueStore<V> store(final String prefix, final Class<V> type) {
        if (!pipelineConfig.isPersistentCache()) {
            return new CaffeineKeyValueStore<>(MAX_ENTRIES);
        }
        return new JsonFileKeyValueStore<>(applicationConfig.getCache(), prefix, type, objectMapper,
                pipelineConfig.getCacheTtl(), Clock.systemUTC());
    }
}
