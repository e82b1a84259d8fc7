package br.edu.ifba.storygraph.adapters;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.exception.ExtractionException;
import br.edu.ifba.storygraph.llm.ChatCompletionRequest;
import br.edu.ifba.storygraph.llm.ChatCompletionResponse;
import br.edu.ifba.storygraph.llm.ChatCompletionsClient;
import br.edu.ifba.storygraph.llm.LLMFunction;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link LLMFunction} backed by an OpenAI-compatible chat completions endpoint.
 *
 * <p>The REST client is blocking, so each call runs on a dedicated pool whose threads carry the
 * application classloader. Recognized kwargs: {@code model}, {@code temperature}, {@code max_tokens}.</p>
 */
@ApplicationScoped
public class OpenAiLLMAdapter implements LLMFunction {

    private static final Logger LOG = Logger.getLogger(OpenAiLLMAdapter.class);
    private static final ClassLoader APP_CLASSLOADER = OpenAiLLMAdapter.class.getClassLoader();
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = task -> {
        Thread thread = new Thread(() -> {
            Thread.currentThread().setContextClassLoader(APP_CLASSLOADER);
            task.run();
        }, "storygraph-llm-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    private final ChatCompletionsClient client;
    private final StoryGraphConfig config;
    private final ExecutorService executor;

    @Inject
    public OpenAiLLMAdapter(@RestClient ChatCompletionsClient client, StoryGraphConfig config) {
        this(client, config, Executors.newCachedThreadPool(THREAD_FACTORY));
    }

    OpenAiLLMAdapter(@NotNull ChatCompletionsClient client, @NotNull StoryGraphConfig config,
                     @NotNull ExecutorService executor) {
        this.client = client;
        this.config = config;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> apply(
            @NotNull String prompt,
            @Nullable String systemPrompt,
            @NotNull Map<String, Object> kwargs) {
        ChatCompletionRequest request = ChatCompletionRequest.of(
            kwargs.get("model") instanceof String model ? model : config.extraction().model(),
            systemPrompt,
            prompt,
            kwargs.get("temperature") instanceof Number t ? t.doubleValue() : config.llm().temperature(),
            kwargs.get("max_tokens") instanceof Number m ? m.intValue() : config.llm().maxTokens());
        String authorization = config.llm().apiKey()
            .filter(key -> !key.isBlank())
            .map(key -> "Bearer " + key)
            .orElse(null);

        return CompletableFuture.supplyAsync(() -> call(authorization, request), executor);
    }

    private String call(@Nullable String authorization, ChatCompletionRequest request) {
        LOG.debugf("Chat completion request: model=%s, messages=%d, thread=%s",
            request.model(), request.messages().size(), Thread.currentThread().getName());

        ChatCompletionResponse response;
        try {
            response = client.complete(authorization, request);
        } catch (ExtractionException e) {
            throw e;
        } catch (ProcessingException e) {
            throw new ExtractionException(
                isTimeout(e) ? ExtractionException.Kind.TIMEOUT : ExtractionException.Kind.PROVIDER,
                "Chat completion failed before a response was received: " + e.getMessage(), e);
        }

        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            throw new ExtractionException(ExtractionException.Kind.PROVIDER, "Model returned no choices");
        }
        String content = response.content()
            .orElseThrow(() -> new ExtractionException(ExtractionException.Kind.UNPARSEABLE,
                "Model returned an empty message"));

        if (response.truncated()) {
            LOG.warnf("Completion for model %s stopped at the token limit (%d); output may be incomplete",
                request.model(), request.maxTokens());
        }
        LOG.debugf("Chat completion received: %d characters, %s tokens", content.length(),
            response.usage() != null ? response.usage().totalTokens() : "unknown");
        return content;
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
