package br.edu.ifba.storygraph.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Validates story graph configuration on application startup.
 *
 * <p>Supported storage types:</p>
 * <ul>
 *   <li><code>file</code> - one JSON document per project on disk (default)</li>
 *   <li><code>memory</code> - documents kept in process memory</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class StoryGraphConfigValidator {

    private static final Logger logger = LoggerFactory.getLogger(StoryGraphConfigValidator.class);

    static final Set<String> STORAGE_TYPES = Set.of("file", "memory");

    @Inject
    StoryGraphConfig config;

    void onStart(@Observes StartupEvent event) {
        logger.info("Validating story graph configuration...");
        validate(config);
        logger.info("Story graph configuration valid: storage={}, workers={}, batch cap={}",
            config.storage().type(), config.jobs().workerThreads(), config.batch().maxScenes());
    }

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    static void validate(StoryGraphConfig config) {
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid story graph configuration: " + e.getMessage(), e);
        }

        String storageType = config.storage().type().toLowerCase(Locale.ROOT).trim();
        if (!STORAGE_TYPES.contains(storageType)) {
            throw new IllegalStateException(
                "Invalid storage type: '" + config.storage().type() + "'. Supported types: 'file', 'memory'");
        }
    }
}
