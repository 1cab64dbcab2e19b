package app.ankillm.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;

public final class OpenAiResponseParser {

    private OpenAiResponseParser() {
    }

    public static String extractText(JsonNode response) {
        if (response == null) {
            return "";
        }
        JsonNode choices = response.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            return "";
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isTextual()) {
            return content.asText().trim();
        }
        if (content.isArray()) {
            StringBuilder builder = new StringBuilder();
            for (JsonNode part : content) {
                String type = part.path("type").asText();
                if ("text".equals(type) || "output_text".equals(type)) {
                    String text = part.path("text").asText();
                    if (!text.isBlank()) {
                        if (!builder.isEmpty()) {
                            builder.append('\n');
                        }
                        builder.append(text);
                    }
                }
            }
            return builder.toString().trim();
        }
        return "";
    }

    public static long inputTokens(JsonNode response) {
        JsonNode usage = response == null ? null : response.path("usage");
        return usage != null && usage.hasNonNull("prompt_tokens") ? usage.get("prompt_tokens").asLong() : 0L;
    }

    public static long outputTokens(JsonNode response) {
        JsonNode usage = response == null ? null : response.path("usage");
        return usage != null && usage.hasNonNull("completion_tokens") ? usage.get("completion_tokens").asLong() : 0L;
    }
}
