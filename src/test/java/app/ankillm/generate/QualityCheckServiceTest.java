package app.ankillm.generate;

import app.ankillm.domain.CardCandidate;
import app.ankillm.domain.QualityCheckConfig;
import app.ankillm.domain.ValidatedCard;
import app.ankillm.exception.TransportException;
import app.ankillm.llm.CompletionClient;
import app.ankillm.llm.CompletionRequest;
import app.ankillm.llm.CompletionResult;
import app.ankillm.llm.LlmCostCalculator;
import app.ankillm.llm.TokenStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QualityCheckServiceTest {

    private static final String MODEL = "gpt-4o-mini";
    private static final QualityCheckConfig CHECK = new QualityCheckConfig("jp", "Is this natural Japanese? {text}", null);

    @Test
    void passesEveryCardWithoutConfig() {
        CompletionClient client = mock(CompletionClient.class);
        List<ValidatedCard> cards = List.of(card(0, "猫"), card(1, "犬"));

        QualityCheckOutcome outcome = service(client).run(cards, null, context(), (flagged, position, total) -> false);

        assertThat(outcome.finalCards()).isEqualTo(cards);
        assertThat(outcome.cost()).isEqualByComparingTo(BigDecimal.ZERO);
        verify(client, times(0)).complete(any());
    }

    @Test
    void sendsCheckPromptInJsonModeWithRunModelByDefault() {
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any(CompletionRequest.class))).thenReturn(answer(true, "fine"));

        service(client).check(List.of(card(0, "猫")), CHECK, context());

        ArgumentCaptor<CompletionRequest> request = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(client).complete(request.capture());
        assertThat(request.getValue().model()).isEqualTo(MODEL);
        assertThat(request.getValue().jsonObject()).isTrue();
        assertThat(request.getValue().messages().get(0).content()).isEqualTo("Is this natural Japanese? 猫");
    }

    @Test
    void checkModelOverridesRunModel() {
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any(CompletionRequest.class))).thenReturn(answer(true, "fine"));
        QualityCheckConfig config = new QualityCheckConfig("jp", "{text}", "gpt-4.1");

        List<QualityCheckResult> results = service(client).check(List.of(card(0, "猫")), config, context());

        ArgumentCaptor<CompletionRequest> request = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(client).complete(request.capture());
        assertThat(request.getValue().model()).isEqualTo("gpt-4.1");
        assertThat(results.get(0).cost()).isEqualByComparingTo(new LlmCostCalculator().cost("gpt-4.1", 100, 20));
    }

    @Test
    void exhaustedRetriesFailOpen() {
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any(CompletionRequest.class))).thenThrow(new TransportException("down"));

        List<QualityCheckResult> results = service(client).check(List.of(card(0, "猫")), CHECK, context());

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.valid()).isTrue();
            assertThat(result.reason()).isEqualTo("Check failed");
            assertThat(result.cost()).isEqualByComparingTo(BigDecimal.ZERO);
        });
        verify(client, times(3)).complete(any(CompletionRequest.class));
    }

    @Test
    void malformedVerdictIsRetried() {
        CompletionClient client = mock(CompletionClient.class);
        when(client.complete(any(CompletionRequest.class))).thenReturn(
                new CompletionResult("{\"is_valid\": \"yes\"}", MODEL, new TokenStats(1, 1)),
                answer(false, "Unnatural word order")
        );

        List<QualityCheckResult> results = service(client).check(List.of(card(0, "猫")), CHECK, context());

        assertThat(results.get(0).valid()).isFalse();
        assertThat(results.get(0).reason()).isEqualTo("Unnatural word order");
    }

    @Test
    void flaggedCardsAreReviewedInOrderAndFinalListKeepsSelectionOrder() {
        ValidatedCard first = card(0, "一");
        ValidatedCard second = card(1, "二");
        ValidatedCard third = card(2, "三");
        ValidatedCard fourth = card(3, "四");
        CompletionClient client = request -> {
            String text = request.messages().get(0).content();
            boolean valid = text.endsWith("二") || text.endsWith("四");
            return answer(valid, valid ? "ok" : "flagged " + text.substring(text.length() - 1));
        };
        List<String> reviewed = new ArrayList<>();
        AtomicInteger totalSeen = new AtomicInteger();
        ReviewPrompter prompter = (flagged, position, total) -> {
            reviewed.add(position + ":" + flagged.reason());
            totalSeen.set(total);
            return flagged.card() == third;
        };

        QualityCheckOutcome outcome = service(client).run(List.of(first, second, third, fourth), CHECK, context(), prompter);

        assertThat(reviewed).containsExactly("1:flagged 一", "2:flagged 三");
        assertThat(totalSeen.get()).isEqualTo(2);
        assertThat(outcome.finalCards()).containsExactly(second, third, fourth);
        assertThat(outcome.flaggedCount()).isEqualTo(2);
        assertThat(outcome.tokens()).isEqualTo(new TokenStats(400, 80));
    }

    private static QualityCheckService service(CompletionClient client) {
        return new QualityCheckService(client, new LlmJsonParser(new ObjectMapper()), new LlmCostCalculator());
    }

    private static GenerationContext context() {
        return new GenerationContext(MODEL, 0.5, null, 2, RetryPolicy.noDelay(3), null, false, "qc-run");
    }

    private static CompletionResult answer(boolean valid, String reason) {
        return new CompletionResult("{\"is_valid\": " + valid + ", \"reason\": \"" + reason + "\"}", MODEL,
                new TokenStats(100, 20));
    }

    private static ValidatedCard card(int rowIndex, String jp) {
        CardCandidate candidate = new CardCandidate(rowIndex, Map.of("jp", jp, "en", "word " + rowIndex), "{}");
        return new ValidatedCard(candidate, false, Map.of("Japanese", jp, "English", "word " + rowIndex));
    }
}
