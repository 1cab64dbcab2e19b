package app.ankillm.llm;

import java.math.BigDecimal;

/**
 * USD per one million tokens.
 */
public record ModelPricing(
        BigDecimal inputCostPerMillion,
        BigDecimal outputCostPerMillion
) {
    public static ModelPricing of(String input, String output) {
        return new ModelPricing(new BigDecimal(input), new BigDecimal(output));
    }
}
