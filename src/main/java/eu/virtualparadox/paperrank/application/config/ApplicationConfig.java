package eu.virtualparadox.paperrank.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem locations used by the application.
 * <ul>
 *     <li>{@code root}: working directory, usually {@code ~/.paperrank}</li>
 *     <li>{@code corpus}: pre-fetched venue/year corpora ({@code {venue}_{year}/all_papers.json})</li>
 *     <li>{@code cache}: persistent memoization store</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "paperrank")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path corpus;
    private Path cache;

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (corpus != null) Files.createDirectories(corpus);
        if (cache != null) Files.createDirectories(cache);
    }
}
