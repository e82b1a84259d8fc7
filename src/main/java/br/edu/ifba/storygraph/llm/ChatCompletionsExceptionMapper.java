package br.edu.ifba.storygraph.llm;

import br.edu.ifba.storygraph.exception.ExtractionException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns provider error responses into {@link ExtractionException}s whose kind tells a rate limit,
 * a timeout and a credential problem apart. The job that made the call fails with that kind.
 */
public class ChatCompletionsExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(ChatCompletionsExceptionMapper.class);

    @Override
    public RuntimeException toThrowable(Response response) {
        int status = response.getStatus();
        if (status < 400) {
            return null;
        }

        ExtractionException.Kind kind = kindOf(status);
        StringBuilder message = new StringBuilder("Model provider returned ")
            .append(status).append(' ').append(response.getStatusInfo().getReasonPhrase());

        String retryAfter = response.getHeaderString("Retry-After");
        if (kind == ExtractionException.Kind.RATE_LIMITED && retryAfter != null) {
            message.append(" (retry after ").append(retryAfter).append("s)");
        }

        String body = readBody(response);
        if (body != null && !body.isBlank()) {
            message.append(" - ").append(body);
        }

        LOG.errorf("Chat completion failed with %s: %s", kind, message);
        return new ExtractionException(kind, message.toString());
    }

    static ExtractionException.Kind kindOf(int status) {
        return switch (status) {
            case 429 -> ExtractionException.Kind.RATE_LIMITED;
            case 401, 403 -> ExtractionException.Kind.AUTHENTICATION;
            case 408, 504 -> ExtractionException.Kind.TIMEOUT;
            default -> ExtractionException.Kind.PROVIDER;
        };
    }

    private static String readBody(Response response) {
        try {
            return response.hasEntity() ? response.readEntity(String.class) : null;
        } catch (RuntimeException e) {
            LOG.warn("Could not read provider error body", e);
            return null;
        }
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
