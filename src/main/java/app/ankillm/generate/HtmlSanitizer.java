package app.ankillm.generate;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Strips markup that is unsafe to sync (scripts, frames, event handlers, foreign URL schemes)
 * from model output while keeping the formatting tags cards normally use.
 */
@Component
public class HtmlSanitizer {

    private static final Pattern COLOR = Pattern.compile("(?i)^(#[0-9a-f]{3,6}|rgba?\\(.*)$");
    private static final Map<String, List<Pattern>> ALLOWED_STYLES = Map.of(
            "color", List.of(COLOR),
            "background-color", List.of(COLOR),
            "text-align", List.of(Pattern.compile("(?i)^(left|right|center)$")),
            "font-size", List.of(Pattern.compile("^\\d+(?:px|em|%)$"))
    );

    private final Safelist safelist;
    private final Document.OutputSettings outputSettings;

    public HtmlSanitizer() {
        this.safelist = new Safelist()
                .addTags("b", "i", "u", "strong", "em", "mark", "small", "del", "ins", "sub", "sup",
                        "p", "br", "div", "span", "hr",
                        "ul", "ol", "li",
                        "table", "thead", "tbody", "tr", "th", "td",
                        "a", "img",
                        "code", "pre",
                        "h1", "h2", "h3", "h4", "h5", "h6")
                .addAttributes(":all", "class", "style")
                .addAttributes("a", "href", "title")
                .addAttributes("img", "src", "alt", "title", "width", "height")
                .addProtocols("a", "href", "http", "https", "data")
                .addProtocols("img", "src", "http", "https", "data");
        this.outputSettings = new Document.OutputSettings().prettyPrint(false);
    }

    public String sanitize(String dirtyHtml) {
        if (dirtyHtml == null || dirtyHtml.isEmpty()) {
            return "";
        }
        String cleaned = Jsoup.clean(dirtyHtml, "", safelist, outputSettings);
        if (!cleaned.contains("style=")) {
            return cleaned;
        }
        Document document = Jsoup.parseBodyFragment(cleaned);
        document.outputSettings(outputSettings);
        for (Element element : document.body().select("[style]")) {
            String style = filterStyle(element.attr("style"));
            if (style.isEmpty()) {
                element.removeAttr("style");
            } else {
                element.attr("style", style);
            }
        }
        return document.body().html();
    }

    public Map<String, String> sanitizeFields(Map<String, String> fields) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        fields.forEach((key, value) -> sanitized.put(key, sanitize(value)));
        return sanitized;
    }

    private String filterStyle(String style) {
        List<String> kept = new ArrayList<>();
        for (String declaration : style.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String property = declaration.substring(0, colon).trim().toLowerCase();
            String value = declaration.substring(colon + 1).trim();
            List<Pattern> patterns = ALLOWED_STYLES.get(property);
            if (patterns != null && patterns.stream().anyMatch(pattern -> pattern.matcher(value).matches())) {
                kept.add(property + ":" + value);
            }
        }
        return String.join(";", kept);
    }
}
