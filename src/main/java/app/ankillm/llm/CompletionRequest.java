package app.ankillm.llm;

import java.util.List;

public record CompletionRequest(
        String model,
        List<ChatMessage> messages,
        double temperature,
        Integer maxTokens,
        boolean jsonObject
) {
    public CompletionRequest {
        messages = List.copyOf(messages);
    }
}
