package app.ankillm.generate;

import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class CardSchemaBuilder {

    public CardSchema build(Map<String, String> fieldMap) {
        if (fieldMap == null || fieldMap.isEmpty()) {
            throw new IllegalArgumentException("fieldMap must have at least one entry");
        }
        return new CardSchema(fieldMap.keySet());
    }
}
