package com.triprelay.reasoner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Chat-completions response envelope; only the first choice is used
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionResponse {

    private List<Choice> choices;

    public String getText() {
        if (choices == null || choices.isEmpty()) return null;
        if (choices.get(0).message == null) return null;
        return choices.get(0).message.content;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private ChatMessage message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatMessage {
        private String role;
        private String content;
    }
}
