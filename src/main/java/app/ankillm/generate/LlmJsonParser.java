package app.ankillm.generate;

import app.ankillm.exception.MalformedResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the JSON payload inside a model completion. Surrounding prose and Markdown
 * fences are skipped; the payload itself is parsed as-is and never repaired. Content after
 * the first JSON value inside the extracted span is an error.
 */
@Component
public class LlmJsonParser {

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*([\\s\\S]+?)\\s*```");

    private final ObjectReader jsonReader;

    public LlmJsonParser(ObjectMapper objectMapper) {
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonNode extractJson(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedResponseException("Empty response from model");
        }
        String text = raw;
        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            text = fence.group(1);
        }

        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0 && bracket < 0) {
            throw new MalformedResponseException("Could not find a JSON object or array in the response. Response preview: "
                    + preview(text));
        }

        // Prose may contain a stray bracket before the payload, so both openers are tried in order.
        MalformedResponseException failure = null;
        for (int start : openers(brace, bracket)) {
            char close = text.charAt(start) == '{' ? '}' : ']';
            int end = text.lastIndexOf(close);
            if (end < start) {
                failure = new MalformedResponseException("Could not find the end of the JSON payload. Response preview: "
                        + preview(text));
                continue;
            }
            String candidate = text.substring(start, end + 1);
            try {
                return jsonReader.readTree(candidate);
            } catch (JsonProcessingException ex) {
                failure = new MalformedResponseException("Failed to parse extracted JSON: " + ex.getOriginalMessage()
                        + ". Extracted text: " + preview(candidate), ex);
            }
        }
        throw failure;
    }

    private int[] openers(int brace, int bracket) {
        if (brace < 0) {
            return new int[]{bracket};
        }
        if (bracket < 0) {
            return new int[]{brace};
        }
        return brace < bracket ? new int[]{brace, bracket} : new int[]{bracket, brace};
    }

    private String preview(String text) {
        String trimmed = text.replaceAll("[\\r\\n]+", " ").trim();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }
}
