package com.swarmmind.core.llm;

import com.swarmmind.core.external.LlmReasoningService.ThoughtResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real model calls are made.
 */
class LlmServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and the user prompt with format instructions")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn("""
                {"reasoning":"r","conclusion":"c","suggestedActions":["explore_topic:CRDTs"],"confidence":0.8}
                """);

        llmService.structuredCall("System prompt", "User prompt", ThoughtResponse.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
    }

    @Test
    @DisplayName("structuredCall converts JSON into the requested record")
    void convertsJson() {
        when(mockCallResponse.content()).thenReturn("""
                {"reasoning":"r","conclusion":"c","suggestedActions":["explore_topic:CRDTs"],"confidence":0.8}
                """);

        ThoughtResponse response = llmService.structuredCall("s", "u", ThoughtResponse.class);

        assertEquals("c", response.conclusion());
        assertEquals(List.of("explore_topic:CRDTs"), response.suggestedActions());
        assertEquals(0.8, response.confidence());
    }

    @Test
    @DisplayName("code-fenced replies are parsed leniently")
    void codeFences() {
        String fenced = "```json\n{\"reasoning\":\"r\",\"conclusion\":\"fenced\",\"extra\":1}\n```";

        ThoughtResponse response = llmService.parseLeniently(fenced, ThoughtResponse.class);

        assertEquals("fenced", response.conclusion());
    }

    @Test
    @DisplayName("empty content raises LlmEmptyResponseException")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", ThoughtResponse.class));
    }

    @Test
    @DisplayName("unparseable content raises LlmParseException")
    void unparseable() {
        when(mockCallResponse.content()).thenReturn("I would rather not answer in JSON.");

        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("s", "u", ThoughtResponse.class));
    }
}
