package app.ankillm.generate;

import app.ankillm.domain.Row;
import app.ankillm.exception.TemplateException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Literal {@code {column}} substitution. Column names match case-insensitively.
 */
@Component
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    public String render(String template, Row row) {
        return render(template, row.values());
    }

    public String render(String template, Map<String, String> values) {
        Map<String, String> byLowerKey = new HashMap<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String lowerKey = entry.getKey().toLowerCase(Locale.ROOT);
            if (byLowerKey.containsKey(lowerKey)) {
                throw new TemplateException("Ambiguous key in row data: \"" + entry.getKey()
                        + "\" conflicts with another key when case is ignored");
            }
            byLowerKey.put(lowerKey, entry.getValue());
        }

        List<String> missing = new ArrayList<>();
        for (String placeholder : placeholders(template)) {
            if (!byLowerKey.containsKey(placeholder.toLowerCase(Locale.ROOT))) {
                missing.add("{" + placeholder + "}");
            }
        }
        if (!missing.isEmpty()) {
            throw new TemplateException("Missing data for template placeholders: " + String.join(", ", missing)
                    + ". Available fields: " + String.join(", ", values.keySet()));
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder buffer = new StringBuilder();
        while (matcher.find()) {
            String value = byLowerKey.get(matcher.group(1).toLowerCase(Locale.ROOT));
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(buffer);
        return buffer.toString();
    }

    /**
     * Distinct placeholder names in order of first appearance.
     */
    public Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Placeholders that no column of {@code columns} satisfies.
     */
    public List<String> unresolvedPlaceholders(String template, Iterable<String> columns) {
        Set<String> available = new HashSet<>();
        for (String column : columns) {
            available.add(column.toLowerCase(Locale.ROOT));
        }
        List<String> unresolved = new ArrayList<>();
        for (String placeholder : placeholders(template)) {
            if (!available.contains(placeholder.toLowerCase(Locale.ROOT))) {
                unresolved.add(placeholder);
            }
        }
        return unresolved;
    }
}
