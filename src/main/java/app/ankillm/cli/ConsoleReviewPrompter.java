package app.ankillm.cli;

import app.ankillm.generate.QualityCheckResult;
import app.ankillm.generate.ReviewPrompter;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ConsoleReviewPrompter implements ReviewPrompter {

    private final ConsoleIO console;

    public ConsoleReviewPrompter(ConsoleIO console) {
        this.console = console;
    }

    @Override
    public boolean keep(QualityCheckResult flagged, int position, int total) {
        console.println();
        console.println("--- Flagged Card " + position + "/" + total + " ---");
        for (Map.Entry<String, String> field : flagged.card().fields().entrySet()) {
            console.println(field.getKey() + ": " + field.getValue());
        }
        console.println("Reason: " + flagged.reason());
        return console.confirm("Keep this card anyway?", false);
    }
}
