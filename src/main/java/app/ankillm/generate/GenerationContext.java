package app.ankillm.generate;

import java.time.Duration;

/**
 * Settings of one generation run, resolved once from properties and command options.
 *
 * @param timeout overall deadline for a batch; {@code null} or zero means none
 */
public record GenerationContext(
        String model,
        double temperature,
        Integer maxTokens,
        int concurrency,
        RetryPolicy retryPolicy,
        Duration timeout,
        boolean manyCards,
        String runId
) {
    public GenerationContext {
        concurrency = Math.max(concurrency, 1);
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.noDelay(1);
        }
    }

    public boolean hasDeadline() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }
}
