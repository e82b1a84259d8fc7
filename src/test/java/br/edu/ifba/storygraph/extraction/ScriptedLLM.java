package br.edu.ifba.storygraph.extraction;

import br.edu.ifba.storygraph.llm.LLMFunction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * LLM stand-in that answers entity prompts and relationship prompts with fixed responses.
 */
public class ScriptedLLM implements LLMFunction {

    public static final String MICKEY_ENTITIES = """
        ```json
        [
          {"name": "Mickey", "type": "character", "description": "A man searching for someone",
           "aliases": ["Mick"], "attributes": {"mood": "anxious"}},
          {"name": "Sarah", "type": "character", "description": "The person Mickey is looking for"},
          {"name": "warehouse", "type": "location", "description": "An abandoned warehouse"}
        ]
        ```
        """;

    public static final String MICKEY_RELATIONSHIPS = """
        [
          {"source": "Mickey", "target": "Sarah", "relation": "related_to",
           "context": "He was looking for Sarah", "strength": 0.8, "valence": 0.5}
        ]
        """;

    public static final String MICKEY_SCENE = "Mickey walked into the warehouse. He was looking for Sarah.";

    private final String entityResponse;
    private final String relationshipResponse;
    private final AtomicInteger entityCalls = new AtomicInteger();
    private final AtomicInteger relationshipCalls = new AtomicInteger();

    public ScriptedLLM(String entityResponse, String relationshipResponse) {
        this.entityResponse = entityResponse;
        this.relationshipResponse = relationshipResponse;
    }

    public static ScriptedLLM mickey() {
        return new ScriptedLLM(MICKEY_ENTITIES, MICKEY_RELATIONSHIPS);
    }

    @Override
    public CompletableFuture<String> apply(String prompt, String systemPrompt, Map<String, Object> kwargs) {
        if (prompt.startsWith("Identify ALL relationships")) {
            relationshipCalls.incrementAndGet();
            return CompletableFuture.completedFuture(relationshipResponse);
        }
        entityCalls.incrementAndGet();
        return CompletableFuture.completedFuture(entityResponse);
    }

    public int entityCalls() {
        return entityCalls.get();
    }

    public int relationshipCalls() {
        return relationshipCalls.get();
    }
}
