package app.ankillm.client.anki;

import java.util.List;
import java.util.Map;

public record AnkiNote(
        String deckName,
        String modelName,
        Map<String, String> fields,
        List<String> tags
) {
}
