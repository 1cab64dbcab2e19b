package app.ankillm.generate;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlSanitizerTest {

    private final HtmlSanitizer sanitizer = new HtmlSanitizer();

    @Test
    void keepsFormattingTags() {
        assertThat(sanitizer.sanitize("<b>bold</b> and <i>italic</i><br>"))
                .isEqualTo("<b>bold</b> and <i>italic</i><br>");
    }

    @Test
    void removesScriptsAndEventHandlers() {
        String cleaned = sanitizer.sanitize("<p onclick=\"steal()\">hi</p><script>alert(1)</script>");

        assertThat(cleaned).isEqualTo("<p>hi</p>");
    }

    @Test
    void dropsJavascriptLinks() {
        String cleaned = sanitizer.sanitize("<a href=\"javascript:alert(1)\" title=\"t\">x</a>");

        assertThat(cleaned).doesNotContain("javascript").contains("title=\"t\"");
    }

    @Test
    void keepsHttpLinksAndImages() {
        String cleaned = sanitizer.sanitize("<a href=\"https://example.com\">x</a><img src=\"https://example.com/a.png\" alt=\"a\">");

        assertThat(cleaned).contains("href=\"https://example.com\"").contains("src=\"https://example.com/a.png\"");
    }

    @Test
    void filtersStyleDeclarations() {
        String cleaned = sanitizer.sanitize("<span style=\"color: #ff0000; position: absolute\">red</span>");

        assertThat(cleaned).isEqualTo("<span style=\"color:#ff0000\">red</span>");
    }

    @Test
    void removesStyleWhenNothingIsAllowed() {
        assertThat(sanitizer.sanitize("<span style=\"position: fixed\">x</span>")).isEqualTo("<span>x</span>");
    }

    @Test
    void sanitizesEveryField() {
        Map<String, String> cleaned = sanitizer.sanitizeFields(Map.of("front", "<iframe src=\"x\"></iframe>cat"));

        assertThat(cleaned).containsEntry("front", "cat");
    }
}
