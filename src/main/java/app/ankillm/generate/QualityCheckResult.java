package app.ankillm.generate;

import app.ankillm.domain.ValidatedCard;
import app.ankillm.llm.TokenStats;

import java.math.BigDecimal;

public record QualityCheckResult(
        ValidatedCard card,
        boolean valid,
        String reason,
        TokenStats tokens,
        BigDecimal cost
) {
    static final String CHECK_FAILED = "Check failed";

    static QualityCheckResult failOpen(ValidatedCard card) {
        return new QualityCheckResult(card, true, CHECK_FAILED, TokenStats.ZERO, BigDecimal.ZERO);
    }
}
