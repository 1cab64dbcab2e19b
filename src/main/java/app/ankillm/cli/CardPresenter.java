package app.ankillm.cli;

import app.ankillm.domain.ProcessedRow;
import app.ankillm.domain.ValidatedCard;
import app.ankillm.generate.BatchResult;
import app.ankillm.generate.QualityCheckOutcome;
import app.ankillm.llm.LlmCostCalculator;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class CardPresenter {

    private static final String RULE = "-".repeat(60);
    private static final int PREVIEW_FIELDS = 3;

    private final ConsoleIO console;

    public CardPresenter(ConsoleIO console) {
        this.console = console;
    }

    public void printBatchSummary(BatchResult result) {
        console.println();
        console.println("Generation complete: " + result.succeededRows() + " row(s) succeeded, "
                + result.failures().size() + " failed, " + result.candidates().size() + " card(s)");
        for (ProcessedRow failure : result.failures()) {
            console.println("  row " + failure.row().identifier() + ": " + failure.error());
        }
        console.println("Tokens: " + result.tokens().input() + " in, " + result.tokens().output() + " out ("
                + result.tokens().total() + " total). Cost: "
                + LlmCostCalculator.format(result.cost()));
    }

    public void printQualityCheck(QualityCheckOutcome outcome) {
        console.println();
        if (outcome.flaggedCount() == 0) {
            console.println("All cards passed the quality check.");
        }
        console.println("Quality check kept " + outcome.finalCards().size() + " of " + outcome.results().size()
                + " card(s). Cost: " + LlmCostCalculator.format(outcome.cost()));
    }

    /**
     * Full listing used for dry runs.
     */
    public void displayCards(List<ValidatedCard> cards) {
        if (cards.isEmpty()) {
            console.println("No cards generated.");
            return;
        }
        console.println();
        console.println("Generated " + cards.size() + " card(s):");
        console.println(RULE);
        for (int i = 0; i < cards.size(); i++) {
            ValidatedCard card = cards.get(i);
            console.println(card.duplicate()
                    ? "Card " + (i + 1) + " (Duplicate - already exists in Anki)"
                    : "Card " + (i + 1));
            for (Map.Entry<String, String> field : card.ankiFields().entrySet()) {
                console.println(field.getKey() + ":");
                console.println(field.getValue());
            }
            console.println(RULE);
        }
        long duplicates = cards.stream().filter(ValidatedCard::duplicate).count();
        if (duplicates > 0) {
            console.println(duplicates + " card(s) are duplicates (already exist in Anki)");
        }
        console.println("This is a dry run. No cards were added to Anki.");
    }

    /**
     * Short form: header plus the first fields as plain text.
     */
    public String preview(ValidatedCard card, int number) {
        StringBuilder text = new StringBuilder();
        text.append(card.duplicate() ? "Card " + number + " (Duplicate)" : "Card " + number);
        int shown = 0;
        for (Map.Entry<String, String> field : card.ankiFields().entrySet()) {
            if (shown == PREVIEW_FIELDS) {
                text.append("\n  ... and ").append(card.ankiFields().size() - PREVIEW_FIELDS).append(" more field(s)");
                break;
            }
            text.append("\n  ").append(field.getKey()).append(": ").append(plainText(field.getValue()));
            shown++;
        }
        return text.toString();
    }

    static String plainText(String html) {
        return Jsoup.parseBodyFragment(html).text();
    }
}
