package eu.virtualparadox.paperrank.generation;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.review.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link TextGenerationService} backed by a Spring AI {@link ChatModel}.
 * Instructions and the response shape go into the system message, the
 * context into the user message.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatModelTextGenerationService implements TextGenerationService {

    private static final int LOG_PREVIEW = 300;

    private final ChatModel chatModel;
    private final PipelineConfig pipelineConfig;

    @Override
    public String generate(final GenerationRequest request) {
        final String instructions = request.instructions()
                + "\n\nRespond ONLY with: " + request.responseSchemaHint();

        final ChatOptions options = ChatOptions.builder()
                .model(pipelineConfig.getModelIdentifier())
                .temperature(pipelineConfig.getTemperature())
                .build();

        final List<Message> messages = List.of(
                new SystemMessage(instructions),
                new UserMessage(request.context())
        );

        final ChatResponse response;
        try {
            response = chatModel.call(new Prompt(messages, options));
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException("Text generation failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            log.debug("Empty generation result");
            return "";
        }

        final String text = StringUtils.defaultString(response.getResult().getOutput().getText());
        log.debug("Generated: {}", StringUtils.abbreviate(text, LOG_PREVIEW));
        return text;
    }
}
