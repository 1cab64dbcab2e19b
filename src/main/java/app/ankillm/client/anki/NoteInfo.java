package app.ankillm.client.anki;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stored note as returned by {@code notesInfo}; {@code fields} follows the note type's field order.
 */
public record NoteInfo(
        long noteId,
        String modelName,
        Map<String, String> fields,
        List<String> tags
) {
    public NoteInfo {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        tags = List.copyOf(tags);
    }
}
