package app.ankillm.llm;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;

@Component
public class LlmCostCalculator {

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);

    static final Map<String, ModelPricing> DEFAULT_PRICING = Map.ofEntries(
            Map.entry("gpt-4.1", ModelPricing.of("2.00", "8.00")),
            Map.entry("gpt-4o", ModelPricing.of("2.50", "10.00")),
            Map.entry("gpt-4o-mini", ModelPricing.of("0.15", "0.60")),
            Map.entry("gpt-5", ModelPricing.of("1.25", "10.00")),
            Map.entry("gpt-5-mini", ModelPricing.of("0.25", "2.00")),
            Map.entry("gpt-5-nano", ModelPricing.of("0.05", "0.40")),
            Map.entry("gemini-2.0-flash", ModelPricing.of("0.10", "0.40")),
            Map.entry("gemini-2.5-flash", ModelPricing.of("0.30", "2.50")),
            Map.entry("gemini-2.5-flash-lite", ModelPricing.of("0.10", "0.40")),
            Map.entry("gemini-2.5-pro", ModelPricing.of("1.25", "10.00"))
    );

    private final Map<String, ModelPricing> pricing;

    public LlmCostCalculator() {
        this(DEFAULT_PRICING);
    }

    public LlmCostCalculator(Map<String, ModelPricing> pricing) {
        this.pricing = Map.copyOf(pricing);
    }

    /**
     * Unknown models cost zero.
     */
    public BigDecimal cost(String model, long inputTokens, long outputTokens) {
        ModelPricing price = model == null ? null : pricing.get(model);
        if (price == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal input = BigDecimal.valueOf(Math.max(inputTokens, 0))
                .multiply(price.inputCostPerMillion())
                .divide(MILLION, MathContext.DECIMAL64);
        BigDecimal output = BigDecimal.valueOf(Math.max(outputTokens, 0))
                .multiply(price.outputCostPerMillion())
                .divide(MILLION, MathContext.DECIMAL64);
        return input.add(output);
    }

    public BigDecimal cost(String model, TokenStats stats) {
        return stats == null ? BigDecimal.ZERO : cost(model, stats.input(), stats.output());
    }

    public boolean isKnown(String model) {
        return model != null && pricing.containsKey(model);
    }

    public static String format(BigDecimal cost) {
        BigDecimal value = cost == null ? BigDecimal.ZERO : cost;
        return "$" + value.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }
}
