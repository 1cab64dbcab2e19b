package app.ankillm.llm;

public record CompletionResult(
        String content,
        String model,
        TokenStats usage
) {
}
