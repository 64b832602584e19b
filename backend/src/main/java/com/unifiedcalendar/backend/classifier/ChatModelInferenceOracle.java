package com.unifiedcalendar.backend.classifier;

import com.unifiedcalendar.backend.config.ClassifierConfig;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * {@link InferenceOracle} backed by whatever Spring AI {@link ChatModel} is configured.
 * With no chat model on the context the oracle reports itself unavailable and
 * the classifier runs heuristic-only.
 */
@Component
@Slf4j
public class ChatModelInferenceOracle implements InferenceOracle {

    private static final String FEW_SHOT_PREAMBLE = """
            You decide whether an email is about a specific scheduled event (meeting, call,
            appointment, interview, delivery slot). Answer with a single word: YES or NO.

            Email: "Subject: Interview with Dana - Tue 10:30am. Snippet: Looking forward to our call on Zoom."
            Answer: YES

            Email: "Subject: Your weekly digest. Snippet: Here are this week's top stories."
            Answer: NO

            Email: "Subject: Dentist appointment reminder. Snippet: See you on March 3 at 9am."
            Answer: YES

            Email: "Subject: Let's meet sometime. Snippet: We should catch up when you are free."
            Answer: NO
            """;

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ClassifierConfig classifierConfig;

    public ChatModelInferenceOracle(ObjectProvider<ChatModel> chatModelProvider, ClassifierConfig classifierConfig) {
        this.chatModelProvider = chatModelProvider;
        this.classifierConfig = classifierConfig;
    }

    @Override
    public boolean isAvailable() {
        return classifierConfig.isOracleEnabled() && chatModelProvider.getIfAvailable() != null;
    }

    @Override
    public String ask(String question) {
        ChatModel chatModel = classifierConfig.isOracleEnabled() ? chatModelProvider.getIfAvailable() : null;
        if (chatModel == null) {
            throw new OracleUnavailableException("No chat model configured");
        }

        try {
            Prompt prompt = new Prompt(List.of(new SystemMessage(FEW_SHOT_PREAMBLE), new UserMessage(question)));
            ChatResponse response = chatModel.call(prompt);
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw new OracleUnavailableException("Empty response from chat model");
            }
            String text = response.getResult().getOutput().getText();
            log.debug("Oracle verdict: {}", text);
            return text == null ? "" : text.trim();
        } catch (OracleUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new OracleUnavailableException("Chat model call failed: " + e.getMessage(), e);
        }
    }
}
