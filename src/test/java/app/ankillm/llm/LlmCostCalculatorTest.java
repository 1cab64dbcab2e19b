package app.ankillm.llm;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmCostCalculatorTest {

    private final LlmCostCalculator calculator = new LlmCostCalculator();

    @Test
    void costUsesPerMillionPrices() {
        BigDecimal cost = calculator.cost("gpt-4o-mini", 1_000, 500);

        assertEquals(0, new BigDecimal("0.00045").compareTo(cost));
    }

    @Test
    void costOfOneMillionEachIsSumOfPrices() {
        BigDecimal cost = calculator.cost("gemini-2.5-pro", new TokenStats(1_000_000, 1_000_000));

        assertEquals(0, new BigDecimal("11.25").compareTo(cost));
    }

    @Test
    void unknownModelCostsNothing() {
        assertEquals(0, BigDecimal.ZERO.compareTo(calculator.cost("my-local-model", 10_000, 10_000)));
        assertFalse(calculator.isKnown("my-local-model"));
        assertTrue(calculator.isKnown("gpt-5-nano"));
    }

    @Test
    void everyListedModelHasPricing() {
        for (String model : new String[]{"gpt-4.1", "gpt-4o", "gpt-4o-mini", "gpt-5", "gpt-5-mini", "gpt-5-nano",
                "gemini-2.0-flash", "gemini-2.5-flash", "gemini-2.5-flash-lite", "gemini-2.5-pro"}) {
            assertTrue(calculator.isKnown(model), model);
        }
    }

    @Test
    void formatRendersFourDecimals() {
        assertEquals("$0.0005", LlmCostCalculator.format(new BigDecimal("0.00045")));
        assertEquals("$0.0000", LlmCostCalculator.format(BigDecimal.ZERO));
        assertEquals("$12.3457", LlmCostCalculator.format(new BigDecimal("12.345678")));
    }

    @Test
    void tokenStatsClampAndSum() {
        TokenStats stats = new TokenStats(-5, 7).plus(new TokenStats(3, 2));

        assertEquals(3, stats.input());
        assertEquals(9, stats.output());
        assertEquals(12, stats.total());
    }
}
