package app.ankillm.provider.openai;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.openai")
public record OpenAiProps(
        String baseUrl,
        String apiKey,
        String geminiBaseUrl,
        String geminiApiKey,
        Integer requestTimeoutSeconds
) {
}
