package br.edu.ifba.storygraph.llm;

import br.edu.ifba.storygraph.exception.ExtractionException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatCompletionsExceptionMapperTest {

    private final ChatCompletionsExceptionMapper mapper = new ChatCompletionsExceptionMapper();

    @Test
    @DisplayName("HTTP status codes map onto failure kinds")
    void testKindOf() {
        assertEquals(ExtractionException.Kind.RATE_LIMITED, ChatCompletionsExceptionMapper.kindOf(429));
        assertEquals(ExtractionException.Kind.AUTHENTICATION, ChatCompletionsExceptionMapper.kindOf(401));
        assertEquals(ExtractionException.Kind.AUTHENTICATION, ChatCompletionsExceptionMapper.kindOf(403));
        assertEquals(ExtractionException.Kind.TIMEOUT, ChatCompletionsExceptionMapper.kindOf(408));
        assertEquals(ExtractionException.Kind.TIMEOUT, ChatCompletionsExceptionMapper.kindOf(504));
        assertEquals(ExtractionException.Kind.PROVIDER, ChatCompletionsExceptionMapper.kindOf(500));
        assertEquals(ExtractionException.Kind.PROVIDER, ChatCompletionsExceptionMapper.kindOf(400));
    }

    @Test
    @DisplayName("Authentication failure without a body still names the status")
    void testAuthenticationWithoutBody() {
        // Arrange
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(401);
        when(response.getStatusInfo()).thenReturn(Response.Status.UNAUTHORIZED);

        // Act
        ExtractionException error = (ExtractionException) mapper.toThrowable(response);

        // Assert
        assertEquals(ExtractionException.Kind.AUTHENTICATION, error.getKind());
        assertFalse(error.getKind().isTransient());
        assertEquals("Model provider returned 401 Unauthorized", error.getMessage());
    }

    @Test
    @DisplayName("Successful responses are not mapped")
    void testSuccessNotMapped() {
        // Arrange
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(200);

        // Act & Assert
        assertNull(mapper.toThrowable(response));
    }

    @Test
    @DisplayName("Error response becomes an ExtractionException carrying the body")
    void testErrorResponse() {
        // Arrange
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(429);
        when(response.hasEntity()).thenReturn(true);
        when(response.readEntity(String.class)).thenReturn("{\"error\":\"slow down\"}");
        when(response.getStatusInfo()).thenReturn(Response.Status.TOO_MANY_REQUESTS);
        when(response.getHeaderString("Retry-After")).thenReturn("20");

        // Act
        RuntimeException error = mapper.toThrowable(response);

        // Assert
        ExtractionException extraction = assertInstanceOf(ExtractionException.class, error);
        assertEquals(ExtractionException.Kind.RATE_LIMITED, extraction.getKind());
        assertTrue(extraction.getKind().isTransient());
        assertTrue(extraction.getMessage().contains("slow down"));
        assertTrue(extraction.getMessage().contains("retry after 20s"));
    }
}
