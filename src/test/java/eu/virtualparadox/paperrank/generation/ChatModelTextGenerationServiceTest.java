package eu.virtualparadox.paperrank.generation;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.review.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatModelTextGenerationServiceTest {

    private ChatModel chatModel;
    private PipelineConfig config;
    private ChatModelTextGenerationService service;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        config = new PipelineConfig();
        config.setModelIdentifier("test-model");
        service = new ChatModelTextGenerationService(chatModel, config);
    }

    @Test
    @DisplayName("Instructions and schema go to the system message, context to the user message")
    void testPrompt() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("[\"gnn\"]")))));

        final String text = service.generate(new GenerationRequest("Do it.", "Topic: gnn", GenerationRequest.SCHEMA_SYNONYMS));

        assertEquals("[\"gnn\"]", text);
        final ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        final Prompt prompt = captor.getValue();
        assertEquals("test-model", prompt.getOptions().getModel());
        assertEquals(0.0, prompt.getOptions().getTemperature());

        final List<Message> messages = prompt.getInstructions();
        assertEquals(2, messages.size());
        assertEquals(MessageType.SYSTEM, messages.get(0).getMessageType());
        assertThat(messages.get(0).getText()).startsWith("Do it.").contains(GenerationRequest.SCHEMA_SYNONYMS);
        assertEquals(MessageType.USER, messages.get(1).getMessageType());
        assertEquals("Topic: gnn", messages.get(1).getText());
    }

    @Test
    @DisplayName("Client failures surface as UpstreamUnavailableException")
    void testFailure() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("429 Too Many Requests"));

        assertThrows(UpstreamUnavailableException.class,
                () -> service.generate(new GenerationRequest("i", "c", GenerationRequest.SCHEMA_RUBRIC)));
    }

    @Test
    @DisplayName("Missing output yields empty text")
    void testEmpty() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of()));

        assertEquals("", service.generate(new GenerationRequest("i", "c", GenerationRequest.SCHEMA_RUBRIC)));
    }
}
