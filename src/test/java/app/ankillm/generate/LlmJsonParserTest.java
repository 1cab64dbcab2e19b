package app.ankillm.generate;

import app.ankillm.exception.MalformedResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmJsonParserTest {

    private final LlmJsonParser parser = new LlmJsonParser(new ObjectMapper());

    @Test
    void extractsPlainObject() {
        JsonNode node = parser.extractJson("{\"front\": \"cat\", \"back\": \"neko\"}");

        assertThat(node.path("front").asText()).isEqualTo("cat");
    }

    @Test
    void extractsObjectFromMarkdownFence() {
        String raw = """
                Here is your card:

                ```json
                {"front": "dog", "back": "inu"}
                ```
                Let me know if you need more.""";

        assertThat(parser.extractJson(raw).path("back").asText()).isEqualTo("inu");
    }

    @Test
    void extractsArrayWithSurroundingProse() {
        JsonNode node = parser.extractJson("Sure! [{\"front\": \"a\"}, {\"front\": \"b\"}] Hope this helps.");

        assertThat(node.isArray()).isTrue();
        assertThat(node).hasSize(2);
    }

    @Test
    void skipsStrayBracketInProse() {
        JsonNode node = parser.extractJson("Answer [draft]: {\"front\": \"x\"}");

        assertThat(node.isObject()).isTrue();
        assertThat(node.path("front").asText()).isEqualTo("x");
    }

    @Test
    void keepsHtmlInsideStrings() {
        JsonNode node = parser.extractJson("{\"back\": \"<b>bold</b> and {braces}\"}");

        assertThat(node.path("back").asText()).isEqualTo("<b>bold</b> and {braces}");
    }

    @Test
    void failsWhenNoJsonPresent() {
        assertThatThrownBy(() -> parser.extractJson("I cannot help with that."))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("Could not find a JSON object or array");
    }

    @Test
    void failsOnBlankResponse() {
        assertThatThrownBy(() -> parser.extractJson("   "))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void rejectsTrailingContentAfterFirstObject() {
        assertThatThrownBy(() -> parser.extractJson("{\"front\":\"a\",\"back\":\"b\"} oops, also {\"front\":\"c\"}"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageStartingWith("Failed to parse extracted JSON");
    }

    @Test
    void doesNotRepairBrokenJson() {
        assertThatThrownBy(() -> parser.extractJson("{\"front\": \"cat\", }"))
                .isInstanceOf(MalformedResponseException.class)
                .satisfies(ex -> assertThat(((MalformedResponseException) ex).isRetryable()).isTrue());
    }
}
