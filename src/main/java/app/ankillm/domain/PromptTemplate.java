package app.ankillm.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parsed prompt file: front matter settings plus the prompt body.
 * {@code fieldMap} keeps the declaration order of the file.
 */
public record PromptTemplate(
        String deck,
        String noteType,
        Map<String, String> fieldMap,
        QualityCheckConfig qualityCheck,
        String body
) {
    public PromptTemplate {
        fieldMap = Collections.unmodifiableMap(new LinkedHashMap<>(fieldMap));
    }

    public boolean hasQualityCheck() {
        return qualityCheck != null;
    }
}
