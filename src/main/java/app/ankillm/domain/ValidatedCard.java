package app.ankillm.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ValidatedCard(
        CardCandidate candidate,
        boolean duplicate,
        Map<String, String> ankiFields
) {
    public ValidatedCard {
        ankiFields = Collections.unmodifiableMap(new LinkedHashMap<>(ankiFields));
    }

    public Map<String, String> fields() {
        return candidate.fields();
    }

    public int rowIndex() {
        return candidate.rowIndex();
    }
}
