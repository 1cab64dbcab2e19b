package app.ankillm.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CardCandidate(
        int rowIndex,
        Map<String, String> fields,
        String rawResponse
) {
    public CardCandidate {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public CardCandidate withFields(Map<String, String> replacement) {
        return new CardCandidate(rowIndex, replacement, rawResponse);
    }
}
