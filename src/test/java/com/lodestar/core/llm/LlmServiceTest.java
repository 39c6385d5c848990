package com.lodestar.core.llm;

import com.lodestar.core.error.GenerationFailureException;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.model.Recommendation;
import com.lodestar.core.model.RiskLevel;
import com.lodestar.core.model.ValidationVerdict;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real model is called.
 */
class LlmServiceTest {

    private static final String VERDICT_JSON = """
            {"summary":"Viable niche","recommendation":"GO","riskLevel":"LOW","strengths":["reciprocity"],"risks":[]}
            """;

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmProperties properties;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        // Wire up the fluent API chain
        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        properties = new LlmProperties();
        properties.setProvider("openai");
        properties.setModel("test-model");
        llmService = new LlmService(mockBuilder, properties);
    }

    @AfterEach
    void tearDown() {
        llmService.shutdown();
    }

    @Test
    @DisplayName("instructions go out as the system prompt and the context leads the user prompt")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn(VERDICT_JSON);

        llmService.generate("Assess the idea", "## Concept Anchor", ValidationVerdict.class);

        verify(mockRequestSpec).system("Assess the idea");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("## Concept Anchor\n\n"));
        assertTrue(userCaptor.getValue().length() > "## Concept Anchor\n\n".length(),
                "format instructions should follow the context");
    }

    @Test
    @DisplayName("a well-formed reply is converted to the requested record")
    void convertsReply() {
        when(mockCallResponse.content()).thenReturn(VERDICT_JSON);

        ValidationVerdict verdict = llmService.generate("i", "c", ValidationVerdict.class);

        assertEquals("Viable niche", verdict.summary());
        assertEquals(Recommendation.GO, verdict.recommendation());
        assertEquals(RiskLevel.LOW, verdict.riskLevel());
        assertTrue(verdict.overrides().isEmpty());
    }

    @Test
    @DisplayName("a fenced reply is still parsed")
    void parsesFencedReply() {
        when(mockCallResponse.content()).thenReturn("```json\n" + VERDICT_JSON + "```");

        ValidationVerdict verdict = llmService.generate("i", "c", ValidationVerdict.class);

        assertEquals("Viable niche", verdict.summary());
    }

    @Test
    @DisplayName("a reply that is not JSON is a schema failure carrying the raw output")
    void rejectsProse() {
        when(mockCallResponse.content()).thenReturn("I think this idea is great!");

        var ex = assertThrows(SchemaValidationException.class,
                () -> llmService.generate("i", "c", ValidationVerdict.class));
        assertEquals("I think this idea is great!", ex.rawOutput());
    }

    @Test
    @DisplayName("an empty reply is a transient failure")
    void emptyReply() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(GenerationFailureException.class, () -> llmService.generate("i", "c", ValidationVerdict.class));
    }

    @Test
    @DisplayName("a client error is a transient failure")
    void clientError() {
        when(mockCallResponse.content()).thenThrow(new RuntimeException("503 Service Unavailable"));

        var ex = assertThrows(GenerationFailureException.class,
                () -> llmService.generate("i", "c", ValidationVerdict.class));
        assertTrue(ex.getMessage().contains("503 Service Unavailable"));
    }

    @Test
    @DisplayName("a call running past the timeout is abandoned")
    void timesOut() {
        properties.setTimeout(Duration.ofMillis(50));
        ChatClient slowClient = mock(ChatClient.class);
        when(slowClient.prompt()).thenReturn(mockRequestSpec);
        when(mockCallResponse.content()).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return VERDICT_JSON;
        });
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(slowClient);
        LlmService slow = new LlmService(builder, properties);

        try {
            var ex = assertThrows(GenerationFailureException.class,
                    () -> slow.generate("i", "c", ValidationVerdict.class));
            assertTrue(ex.getMessage().contains("timed out"));
        } finally {
            slow.shutdown();
        }
    }

    @Test
    @DisplayName("stripFences removes markdown code fences")
    void stripFences() {
        assertEquals("{\"a\":1}", LlmService.stripFences("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", LlmService.stripFences("```\n{\"a\":1}```"));
        assertEquals("{\"a\":1}", LlmService.stripFences("  {\"a\":1}  "));
    }
}
