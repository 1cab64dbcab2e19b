package app.ankillm.llm;

/**
 * A chat completion service. Implementations throw
 * {@link app.ankillm.exception.TransportException} for network failures and non-2xx replies.
 */
public interface CompletionClient {

    CompletionResult complete(CompletionRequest request);

    default boolean hasApiKey(String model) {
        return true;
    }
}
