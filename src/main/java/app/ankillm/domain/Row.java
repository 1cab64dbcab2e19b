package app.ankillm.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One source record. {@code index} is the 0-based position in the source file and
 * is carried through the pipeline so callers can restore the original order.
 */
public record Row(
        int index,
        Map<String, String> values
) {
    public Row {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String identifier() {
        for (String key : new String[]{"noteId", "id", "Id"}) {
            String value = values.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "#" + (index + 1);
    }
}
