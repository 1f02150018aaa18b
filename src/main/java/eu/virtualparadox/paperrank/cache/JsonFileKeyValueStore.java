package eu.virtualparadox.paperrank.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * On-disk store: one JSON file per entry, named {@code {prefix}_{key}.json}.
 * <p>
 * Each file holds the write timestamp next to the value; entries older than
 * the TTL are treated as absent and removed. Writes go to a temporary file
 * first and are then moved into place, so readers never see a partial entry.
 * An unreadable entry is a cache miss.
 */
@Slf4j
public class JsonFileKeyValueStore<V> implements KeyValueStore<V> {

    private static final String FIELD_STORED_AT = "storedAt";
    private static final String FIELD_VALUE = "value";
    private static final String TEMP_FILE_PREFIX = "kv-";
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private final Path directory;
    private final String prefix;
    private final Class<V> type;
    private final ObjectMapper mapper;
    private final Duration ttl;
    private final Clock clock;

    public JsonFileKeyValueStore(final Path directory,
                                 final String prefix,
                                 final Class<V> type,
                                 final ObjectMapper mapper,
                                 final Duration ttl,
                                 final Clock clock) {
        this.directory = directory;
        this.prefix = prefix;
        this.type = type;
        this.mapper = mapper;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Optional<V> get(final String key) {
        final Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            final JsonNode root = mapper.readTree(file.toFile());
            final long storedAt = root.path(FIELD_STORED_AT).asLong(0L);
            if (clock.millis() - storedAt > ttl.toMillis()) {
                log.debug("Cache entry {} expired", file.getFileName());
                Files.deleteIfExists(file);
                return Optional.empty();
            }
            return Optional.of(mapper.treeToValue(root.path(FIELD_VALUE), type));
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(final String key, final V value) {
        final Path file = fileFor(key);
        final ObjectNode root = mapper.createObjectNode();
        root.put(FIELD_STORED_AT, clock.millis());
        root.set(FIELD_VALUE, mapper.valueToTree(value));
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
            mapper.writeValue(temp.toFile(), root);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            // the next run recomputes the value
            log.warn("Could not persist cache entry {}: {}", file, e.getMessage());
            deleteQuietly(temp);
        }
    }

    private static void deleteQuietly(final Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary cache file {}: {}", temp, e.getMessage());
        }
    }

    private Path fileFor(final String key) {
        return directory.resolve(prefix + "_" + key + ".json");
    }
}
