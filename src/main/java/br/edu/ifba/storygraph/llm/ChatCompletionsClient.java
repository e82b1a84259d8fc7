package br.edu.ifba.storygraph.llm;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * OpenAI-compatible chat completions endpoint. The base URL is configured under
 * {@code quarkus.rest-client.storygraph-llm.url}.
 */
@RegisterRestClient(configKey = "storygraph-llm")
@RegisterProvider(ChatCompletionsExceptionMapper.class)
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface ChatCompletionsClient {

    @POST
    @Path("/chat/completions")
    ChatCompletionResponse complete(@HeaderParam("Authorization") String authorization,
                                    ChatCompletionRequest request);
}
