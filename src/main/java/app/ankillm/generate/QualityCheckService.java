package app.ankillm.generate;

import app.ankillm.domain.QualityCheckConfig;
import app.ankillm.domain.ValidatedCard;
import app.ankillm.exception.SchemaValidationException;
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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Second LLM pass over selected cards. Checks run concurrently; flagged cards are then
 * reviewed one at a time. A check that keeps failing lets the card through.
 */
@Service
public class QualityCheckService {

    private static final Logger log = LoggerFactory.getLogger(QualityCheckService.class);

    static final String TEXT_PLACEHOLDER = "{text}";

    private final CompletionClient completionClient;
    private final LlmJsonParser jsonParser;
    private final LlmCostCalculator costCalculator;
    private final BoundedTaskRunner taskRunner = new BoundedTaskRunner("quality-check-");

    public QualityCheckService(CompletionClient completionClient,
                               LlmJsonParser jsonParser,
                               LlmCostCalculator costCalculator) {
        this.completionClient = completionClient;
        this.jsonParser = jsonParser;
        this.costCalculator = costCalculator;
    }

    public QualityCheckOutcome run(List<ValidatedCard> selected,
                                   QualityCheckConfig config,
                                   GenerationContext context,
                                   ReviewPrompter prompter) {
        if (config == null || selected.isEmpty()) {
            return new QualityCheckOutcome(selected, List.of(), TokenStats.ZERO, BigDecimal.ZERO);
        }
        List<QualityCheckResult> results = check(selected, config, context);
        List<ValidatedCard> finalCards = review(selected, results, prompter);

        TokenStats tokens = TokenStats.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        for (QualityCheckResult result : results) {
            tokens = tokens.plus(result.tokens());
            cost = cost.add(result.cost());
        }
        return new QualityCheckOutcome(finalCards, results, tokens, cost);
    }

    /**
     * Runs the check for every card. Results are in card order.
     */
    public List<QualityCheckResult> check(List<ValidatedCard> cards, QualityCheckConfig config, GenerationContext context) {
        String model = config.model() == null || config.model().isBlank() ? context.model() : config.model();
        log.info("Quality check started runId={} cards={} model={}", context.runId(), cards.size(), model);
        return taskRunner.runAll(
                cards,
                card -> checkWithRetry(card, config, model, context),
                (card, error) -> {
                    log.warn("Quality check did not finish, keeping card rowIndex={} error={}", card.rowIndex(), error);
                    return QualityCheckResult.failOpen(card);
                },
                context.concurrency(),
                context.hasDeadline() ? context.timeout() : null
        );
    }

    /**
     * Asks about each flagged card in turn. The returned list keeps the order of {@code selected}.
     */
    public List<ValidatedCard> review(List<ValidatedCard> selected, List<QualityCheckResult> results, ReviewPrompter prompter) {
        Set<ValidatedCard> keep = Collections.newSetFromMap(new IdentityHashMap<>());
        List<QualityCheckResult> flagged = new ArrayList<>();
        for (QualityCheckResult result : results) {
            if (result.valid()) {
                keep.add(result.card());
            } else {
                flagged.add(result);
            }
        }
        for (int i = 0; i < flagged.size(); i++) {
            QualityCheckResult item = flagged.get(i);
            if (prompter.keep(item, i + 1, flagged.size())) {
                keep.add(item.card());
            }
        }
        return selected.stream().filter(keep::contains).toList();
    }

    private QualityCheckResult checkWithRetry(ValidatedCard card, QualityCheckConfig config, String model, GenerationContext context) {
        RetryPolicy policy = context.retryPolicy();
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return checkCard(card, config, model, context);
            } catch (RuntimeException ex) {
                int remaining = policy.maxAttempts() - attempt;
                log.warn("Quality check attempt failed rowIndex={} attempt={} remaining={} errorType={} message={}",
                        card.rowIndex(), attempt, remaining, ex.getClass().getSimpleName(), BatchRunner.safeMessage(ex));
                if (policy.hasAttemptsAfter(attempt) && !sleep(policy.backoff(attempt))) {
                    break;
                }
            }
        }
        return QualityCheckResult.failOpen(card);
    }

    private QualityCheckResult checkCard(ValidatedCard card, QualityCheckConfig config, String model, GenerationContext context) {
        String text = card.fields().get(config.field());
        if (text == null || text.isEmpty()) {
            throw new IllegalStateException("Field \"" + config.field() + "\" not found on card.");
        }
        String prompt = config.prompt().replace(TEXT_PLACEHOLDER, text);
        CompletionResult result = completionClient.complete(new CompletionRequest(
                model,
                List.of(ChatMessage.user(prompt)),
                context.temperature(),
                context.maxTokens(),
                true
        ));
        JsonNode payload = jsonParser.extractJson(result.content());

        List<String> problems = new ArrayList<>();
        JsonNode isValid = payload.get("is_valid");
        JsonNode reason = payload.get("reason");
        if (isValid == null || !isValid.isBoolean()) {
            problems.add("is_valid: expected a boolean");
        }
        if (reason == null || !reason.isTextual()) {
            problems.add("reason: expected a string");
        }
        if (!problems.isEmpty()) {
            throw new SchemaValidationException(problems);
        }

        TokenStats usage = result.usage() == null ? TokenStats.ZERO : result.usage();
        return new QualityCheckResult(card, isValid.booleanValue(), reason.asText(), usage, costCalculator.cost(model, usage));
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
