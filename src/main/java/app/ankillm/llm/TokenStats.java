package app.ankillm.llm;

public record TokenStats(
        long input,
        long output
) {
    public static final TokenStats ZERO = new TokenStats(0, 0);

    public TokenStats {
        input = Math.max(input, 0);
        output = Math.max(output, 0);
    }

    public TokenStats plus(TokenStats other) {
        if (other == null) {
            return this;
        }
        return new TokenStats(input + other.input, output + other.output);
    }

    public long total() {
        return input + output;
    }
}
