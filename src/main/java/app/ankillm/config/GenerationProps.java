package app.ankillm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.generation")
public record GenerationProps(
        String model,
        Integer concurrency,
        Integer maxAttempts,
        Long backoffMs,
        Long maxBackoffMs,
        Double temperature,
        Integer maxTokens,
        Long timeoutSeconds
) {
}
