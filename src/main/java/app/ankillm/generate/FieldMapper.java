package app.ankillm.generate;

import app.ankillm.domain.CardCandidate;
import app.ankillm.exception.MissingFieldException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class FieldMapper {

    /**
     * Translates model-output keys to store field names. Partial cards are rejected.
     */
    public Map<String, String> mapFields(CardCandidate candidate, Map<String, String> fieldMap) {
        Map<String, String> ankiFields = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : fieldMap.entrySet()) {
            String value = candidate.fields().get(entry.getKey());
            if (value == null) {
                throw new MissingFieldException(entry.getKey(), fieldMap.keySet());
            }
            ankiFields.put(entry.getValue(), value);
        }
        return ankiFields;
    }
}
