package app.ankillm.cli;

import app.ankillm.domain.ValidatedCard;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Lets the user pick which generated cards to keep by number.
 */
@Component
public class CardSelector {

    private final ConsoleIO console;
    private final CardPresenter presenter;

    public CardSelector(ConsoleIO console, CardPresenter presenter) {
        this.console = console;
        this.presenter = presenter;
    }

    public List<ValidatedCard> select(List<ValidatedCard> cards) {
        if (cards.isEmpty()) {
            return List.of();
        }
        console.println();
        for (int i = 0; i < cards.size(); i++) {
            console.println(presenter.preview(cards.get(i), i + 1));
        }
        while (true) {
            String line = console.readLine("\nCards to keep (e.g. 1,3-5, all, none): ");
            if (line == null) {
                return List.of();
            }
            try {
                return parseSelection(line, cards.size()).stream().map(cards::get).toList();
            } catch (IllegalArgumentException ex) {
                console.println(ex.getMessage());
            }
        }
    }

    /**
     * @return sorted distinct 0-based indices
     */
    static List<Integer> parseSelection(String input, int count) {
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        TreeSet<Integer> selected = new TreeSet<>();
        if (normalized.equals("all") || normalized.equals("a")) {
            for (int i = 0; i < count; i++) {
                selected.add(i);
            }
            return List.copyOf(selected);
        }
        if (normalized.isEmpty() || normalized.equals("none") || normalized.equals("n")) {
            return List.of();
        }
        for (String part : normalized.split("[,\\s]+")) {
            if (part.isEmpty()) {
                continue;
            }
            int dash = part.indexOf('-');
            int from = parseNumber(dash < 0 ? part : part.substring(0, dash), count);
            int to = dash < 0 ? from : parseNumber(part.substring(dash + 1), count);
            if (to < from) {
                throw new IllegalArgumentException("Invalid range: " + part);
            }
            for (int number = from; number <= to; number++) {
                selected.add(number - 1);
            }
        }
        return List.copyOf(selected);
    }

    private static int parseNumber(String value, int count) {
        int number;
        try {
            number = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Not a card number: " + value);
        }
        if (number < 1 || number > count) {
            throw new IllegalArgumentException("Card number out of range (1-" + count + "): " + number);
        }
        return number;
    }
}
