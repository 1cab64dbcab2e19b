package app.ankillm.provider.openai;

import app.ankillm.exception.TransportException;
import app.ankillm.llm.ChatMessage;
import app.ankillm.llm.CompletionClient;
import app.ankillm.llm.CompletionRequest;
import app.ankillm.llm.CompletionResult;
import app.ankillm.llm.TokenStats;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Locale;

/**
 * Chat completions against an OpenAI-compatible endpoint. Models whose name starts
 * with {@code gemini-} go to the Gemini compatibility endpoint with the Gemini key.
 */
@Component
public class OpenAiClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiClient.class);
    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DEFAULT_GEMINI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai";

    private final RestClient openAiRestClient;
    private final RestClient geminiRestClient;
    private final OpenAiProps props;
    private final ObjectMapper objectMapper;

    public OpenAiClient(RestClient.Builder restClientBuilder,
                        OpenAiProps props,
                        ObjectMapper objectMapper) {
        this.openAiRestClient = restClientBuilder
                .baseUrl(orDefault(props.baseUrl(), DEFAULT_BASE_URL))
                .build();
        this.geminiRestClient = restClientBuilder
                .baseUrl(orDefault(props.geminiBaseUrl(), DEFAULT_GEMINI_BASE_URL))
                .build();
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletionResult complete(CompletionRequest request) {
        String apiKey = resolveApiKey(request.model());
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("No API key configured for model " + request.model()
                    + ". Set " + apiKeyVariable(request.model()));
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", request.model());
        ArrayNode messages = payload.putArray("messages");
        for (ChatMessage message : request.messages()) {
            ObjectNode node = messages.addObject();
            node.put("role", message.role());
            node.put("content", message.content());
        }
        payload.put("temperature", request.temperature());
        if (request.maxTokens() != null && request.maxTokens() > 0) {
            payload.put("max_tokens", request.maxTokens());
        }
        if (request.jsonObject()) {
            payload.putObject("response_format").put("type", "json_object");
        }

        JsonNode response;
        try {
            response = restClientFor(request.model()).post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            log.debug("Completion request failed model={} status={}", request.model(), ex.getStatusCode().value());
            throw new TransportException("Completion request failed with status " + ex.getStatusCode().value()
                    + ": " + abbreviate(ex.getResponseBodyAsString()), ex);
        } catch (RestClientException ex) {
            throw new TransportException("Completion request failed: " + ex.getMessage(), ex);
        }

        if (response == null) {
            throw new TransportException("Completion response is empty");
        }

        String content = OpenAiResponseParser.extractText(response);
        String model = response.path("model").asText(request.model());
        TokenStats usage = new TokenStats(
                OpenAiResponseParser.inputTokens(response),
                OpenAiResponseParser.outputTokens(response)
        );
        return new CompletionResult(content, model, usage);
    }

    @Override
    public boolean hasApiKey(String model) {
        String key = resolveApiKey(model);
        return key != null && !key.isBlank();
    }

    public static String apiKeyVariable(String model) {
        return isGemini(model) ? "GEMINI_API_KEY" : "OPENAI_API_KEY";
    }

    private RestClient restClientFor(String model) {
        return isGemini(model) ? geminiRestClient : openAiRestClient;
    }

    private String resolveApiKey(String model) {
        return isGemini(model) ? props.geminiApiKey() : props.apiKey();
    }

    private static boolean isGemini(String model) {
        return model != null && model.toLowerCase(Locale.ROOT).startsWith("gemini-");
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.replaceAll("[\\r\\n]+", " ").trim();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }
}
