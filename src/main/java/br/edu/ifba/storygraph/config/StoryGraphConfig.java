package br.edu.ifba.storygraph.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for story graph extraction, batching, locking and storage.
 *
 * <p>All properties are read from application.properties with the prefix "storygraph".</p>
 *
 * <h2>Configuration Groups:</h2>
 * <ul>
 *   <li><b>extraction</b> - model call timeout, model name, prompt context and NER models</li>
 *   <li><b>llm</b> - credentials and sampling settings for the chat completions endpoint</li>
 *   <li><b>batch</b> - whole-project extraction cap and cost confirmation gate</li>
 *   <li><b>lock</b> - per-project lock acquisition bound</li>
 *   <li><b>storage</b> - where graph documents live</li>
 *   <li><b>jobs</b> - extraction worker pool</li>
 * </ul>
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * storygraph.extraction.timeout=120s
 * storygraph.batch.max-scenes=500
 * storygraph.batch.cost-confirmation-threshold=1.00
 * storygraph.storage.type=file
 * storygraph.storage.directory=data/graphs
 * }</pre>
 */
@ConfigMapping(prefix = "storygraph")
public interface StoryGraphConfig {

    Extraction extraction();

    Llm llm();

    Batch batch();

    Lock lock();

    Storage storage();

    Jobs jobs();

    /**
     * Validates configuration at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        if (extraction().timeout().isNegative() || extraction().timeout().isZero()) {
            throw new IllegalArgumentException(
                String.format("Extraction timeout must be positive, got %s", extraction().timeout())
            );
        }

        if (batch().maxScenes() < 1) {
            throw new IllegalArgumentException(
                String.format("Batch max scenes must be positive, got %d", batch().maxScenes())
            );
        }

        if (batch().costConfirmationThreshold().signum() < 0) {
            throw new IllegalArgumentException(
                String.format("Cost confirmation threshold must be non-negative, got %s",
                    batch().costConfirmationThreshold())
            );
        }

        if (lock().acquireTimeout().isNegative()) {
            throw new IllegalArgumentException(
                String.format("Lock acquire timeout must be non-negative, got %s", lock().acquireTimeout())
            );
        }

        if (jobs().workerThreads() < 1) {
            throw new IllegalArgumentException(
                String.format("Worker threads must be positive, got %d", jobs().workerThreads())
            );
        }
    }

    /**
     * Extraction settings.
     */
    interface Extraction {
        /**
         * Upper bound for one extraction call, after which the job fails with a TIMEOUT kind.
         *
         * @return per-call timeout, default 120 seconds
         */
        @WithDefault("120s")
        Duration timeout();

        /**
         * Model identifier recorded on semantic and hybrid jobs.
         */
        @WithDefault("gpt-4o-mini")
        String model();

        /**
         * How many already-known entities are summarized into the semantic prompt.
         *
         * @return known entity limit, default 20
         */
        @WithName("known-entity-limit")
        @WithDefault("20")
        @Min(0)
        int knownEntityLimit();

        Ner ner();
    }

    /**
     * Apache OpenNLP model locations. When no name finder model is configured, the
     * lightweight strategy falls back to pattern-based recognition.
     */
    interface Ner {
        @WithName("person-model")
        Optional<String> personModel();

        @WithName("location-model")
        Optional<String> locationModel();

        @WithName("organization-model")
        Optional<String> organizationModel();

        @WithName("sentence-model")
        Optional<String> sentenceModel();

        @WithName("tokenizer-model")
        Optional<String> tokenizerModel();
    }

    /**
     * Chat completions settings. The endpoint URL itself belongs to the REST client
     * ({@code quarkus.rest-client.storygraph-llm.url}).
     */
    interface Llm {
        /**
         * Bearer token; omitted for local endpoints that need none.
         */
        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("0.2")
        double temperature();

        /**
         * Completion token cap per call.
         */
        @WithName("max-tokens")
        @WithDefault("4000")
        @Min(1)
        int maxTokens();
    }

    /**
     * Whole-project batch extraction limits.
     */
    interface Batch {
        /**
         * Hard cap on scenes processed per batch invocation; the rest are reported as skipped.
         *
         * @return max scenes, default 500
         */
        @WithName("max-scenes")
        @WithDefault("500")
        @Min(1)
        int maxScenes();

        /**
         * Estimated spend above which a paid batch requires explicit confirmation.
         *
         * @return threshold in dollars, default 1.00
         */
        @WithName("cost-confirmation-threshold")
        @WithDefault("1.00")
        @DecimalMin("0.0")
        BigDecimal costConfirmationThreshold();

        /**
         * Blended price per 1000 tokens used for estimates and job accounting.
         */
        @WithName("cost-per-1k-tokens")
        @WithDefault("0.003")
        @DecimalMin("0.0")
        BigDecimal costPer1kTokens();

        /**
         * Expected completion tokens per scene when estimating a batch.
         */
        @WithName("expected-output-tokens")
        @WithDefault("1500")
        @Min(0)
        int expectedOutputTokens();
    }

    interface Lock {
        @WithName("acquire-timeout")
        @WithDefault("30s")
        Duration acquireTimeout();
    }

    interface Storage {
        /**
         * {@code file} keeps one JSON document per project under {@link #directory()};
         * {@code memory} keeps documents for the lifetime of the process.
         */
        @WithDefault("file")
        String type();

        @WithDefault("data/graphs")
        String directory();
    }

    interface Jobs {
        @WithName("worker-threads")
        @WithDefault("4")
        @Min(1)
        int workerThreads();
    }
}
