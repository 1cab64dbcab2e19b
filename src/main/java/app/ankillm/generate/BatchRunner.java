package app.ankillm.generate;

import app.ankillm.domain.CardCandidate;
import app.ankillm.domain.ProcessedRow;
import app.ankillm.domain.PromptTemplate;
import app.ankillm.domain.Row;
import app.ankillm.exception.AnkiLlmException;
import app.ankillm.llm.ChatMessage;
import app.ankillm.llm.CompletionClient;
import app.ankillm.llm.CompletionRequest;
import app.ankillm.llm.CompletionResult;
import app.ankillm.llm.LlmCostCalculator;
import app.ankillm.llm.TokenStats;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives render, call, parse and validate for every row with bounded concurrency and retries.
 * A row failure never stops the batch; it is reported with the row's last error.
 */
@Service
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final CompletionClient completionClient;
    private final TemplateRenderer templateRenderer;
    private final LlmJsonParser jsonParser;
    private final CardSchemaBuilder schemaBuilder;
    private final LlmCostCalculator costCalculator;
    private final BoundedTaskRunner taskRunner = new BoundedTaskRunner("generate-row-");

    public BatchRunner(CompletionClient completionClient,
                       TemplateRenderer templateRenderer,
                       LlmJsonParser jsonParser,
                       CardSchemaBuilder schemaBuilder,
                       LlmCostCalculator costCalculator) {
        this.completionClient = completionClient;
        this.templateRenderer = templateRenderer;
        this.jsonParser = jsonParser;
        this.schemaBuilder = schemaBuilder;
        this.costCalculator = costCalculator;
    }

    public BatchResult run(List<Row> rows, PromptTemplate template, GenerationContext context) {
        CardSchema schema = schemaBuilder.build(template.fieldMap());
        log.info("Batch started runId={} rows={} model={} concurrency={} maxAttempts={}",
                context.runId(), rows.size(), context.model(), context.concurrency(), context.retryPolicy().maxAttempts());

        List<RowOutcome> outcomes = taskRunner.runAll(
                rows,
                row -> processRow(row, template, schema, context),
                (row, error) -> RowOutcome.failed(row, error, TokenStats.ZERO),
                context.concurrency(),
                context.hasDeadline() ? context.timeout() : null
        );

        List<CardCandidate> candidates = new ArrayList<>();
        List<ProcessedRow> failures = new ArrayList<>();
        TokenStats tokens = TokenStats.ZERO;
        for (RowOutcome outcome : outcomes) {
            tokens = tokens.plus(outcome.tokens());
            if (outcome.error() != null) {
                failures.add(new ProcessedRow(outcome.row(), outcome.error()));
            } else {
                candidates.addAll(outcome.candidates());
            }
        }
        BigDecimal cost = costCalculator.cost(context.model(), tokens);
        log.info("Batch finished runId={} succeeded={} failed={} cards={} tokensIn={} tokensOut={} cost={}",
                context.runId(), rows.size() - failures.size(), failures.size(), candidates.size(),
                tokens.input(), tokens.output(), LlmCostCalculator.format(cost));
        return new BatchResult(candidates, failures, tokens, cost, rows.size());
    }

    private RowOutcome processRow(Row row, PromptTemplate template, CardSchema schema, GenerationContext context) {
        String prompt;
        try {
            prompt = templateRenderer.render(template.body(), row);
        } catch (AnkiLlmException ex) {
            log.warn("Row failed before calling the model rowIndex={} error={}", row.index(), safeMessage(ex));
            return RowOutcome.failed(row, ex.getMessage(), TokenStats.ZERO);
        }

        CompletionRequest request = new CompletionRequest(
                context.model(),
                List.of(ChatMessage.user(prompt)),
                context.temperature(),
                context.maxTokens(),
                false
        );
        RetryPolicy policy = context.retryPolicy();
        TokenStats tokens = TokenStats.ZERO;
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                CompletionResult result = completionClient.complete(request);
                tokens = tokens.plus(result.usage());
                JsonNode payload = jsonParser.extractJson(result.content());
                List<Map<String, String>> cards = context.manyCards()
                        ? schema.validateCards(payload)
                        : List.of(schema.validateCard(payload));
                List<CardCandidate> candidates = cards.stream()
                        .map(fields -> new CardCandidate(row.index(), fields, result.content()))
                        .toList();
                log.debug("Row done rowIndex={} attempt={} cards={}", row.index(), attempt, candidates.size());
                return RowOutcome.succeeded(row, candidates, tokens);
            } catch (RuntimeException ex) {
                lastError = ex;
                if (ex instanceof AnkiLlmException domain && !domain.isRetryable()) {
                    log.warn("Row failed rowIndex={} attempt={} errorType={} message={}",
                            row.index(), attempt, ex.getClass().getSimpleName(), safeMessage(ex));
                    break;
                }
                int remaining = policy.maxAttempts() - attempt;
                log.warn("Row attempt failed rowIndex={} attempt={} remaining={} errorType={} message={}",
                        row.index(), attempt, remaining, ex.getClass().getSimpleName(), safeMessage(ex));
                if (policy.hasAttemptsAfter(attempt) && !sleep(policy.backoff(attempt))) {
                    return RowOutcome.failed(row, BoundedTaskRunner.CANCELLED, tokens);
                }
            }
        }
        return RowOutcome.failed(row, describe(lastError), tokens);
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String describe(RuntimeException ex) {
        if (ex == null) {
            return "Unknown error";
        }
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    static String safeMessage(Exception ex) {
        if (ex == null) {
            return "";
        }
        String message = ex.getMessage();
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }

    private record RowOutcome(Row row, List<CardCandidate> candidates, String error, TokenStats tokens) {

        static RowOutcome succeeded(Row row, List<CardCandidate> candidates, TokenStats tokens) {
            return new RowOutcome(row, candidates, null, tokens);
        }

        static RowOutcome failed(Row row, String error, TokenStats tokens) {
            return new RowOutcome(row, List.of(), error, tokens);
        }
    }
}
