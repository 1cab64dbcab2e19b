package app.ankillm.generate;

import app.ankillm.domain.ValidatedCard;
import app.ankillm.llm.TokenStats;

import java.math.BigDecimal;
import java.util.List;

public record QualityCheckOutcome(
        List<ValidatedCard> finalCards,
        List<QualityCheckResult> results,
        TokenStats tokens,
        BigDecimal cost
) {
    public long flaggedCount() {
        return results.stream().filter(result -> !result.valid()).count();
    }
}
