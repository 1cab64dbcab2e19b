package app.ankillm.client.anki;

import app.ankillm.exception.AnkiConnectException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AnkiConnectClient implements FlashcardStore {

    private static final Logger log = LoggerFactory.getLogger(AnkiConnectClient.class);
    private static final String DEFAULT_BASE_URL = "http://127.0.0.1:8765";
    private static final int API_VERSION = 6;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public AnkiConnectClient(RestClient.Builder restClientBuilder,
                             AnkiConnectProps props,
                             ObjectMapper objectMapper) {
        String baseUrl = props.baseUrl() == null || props.baseUrl().isBlank() ? DEFAULT_BASE_URL : props.baseUrl();
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> listDecks() {
        return textList(invoke("deckNames", null), "deckNames");
    }

    @Override
    public List<String> listNoteTypes() {
        return textList(invoke("modelNames", null), "modelNames");
    }

    @Override
    public List<String> fieldsForNoteType(String noteType) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("modelName", noteType);
        return textList(invoke("modelFieldNames", params), "modelFieldNames");
    }

    @Override
    public List<Long> findNotes(String query) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("query", query);
        JsonNode result = invoke("findNotes", params);
        if (!result.isArray()) {
            throw new AnkiConnectException("AnkiConnect findNotes returned a non-array result");
        }
        List<Long> ids = new ArrayList<>(result.size());
        for (JsonNode id : result) {
            ids.add(id.asLong());
        }
        return ids;
    }

    @Override
    public List<NoteInfo> notesInfo(List<Long> noteIds) {
        ObjectNode params = objectMapper.createObjectNode();
        ArrayNode notes = params.putArray("notes");
        noteIds.forEach(notes::add);
        JsonNode result = invoke("notesInfo", params);
        if (!result.isArray()) {
            throw new AnkiConnectException("AnkiConnect notesInfo returned a non-array result");
        }
        List<NoteInfo> infos = new ArrayList<>(result.size());
        for (JsonNode note : result) {
            List<Map.Entry<String, JsonNode>> fieldNodes = new ArrayList<>();
            note.path("fields").fields().forEachRemaining(fieldNodes::add);
            fieldNodes.sort(Comparator.comparingInt(entry -> entry.getValue().path("order").asInt()));
            Map<String, String> fields = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> field : fieldNodes) {
                fields.put(field.getKey(), field.getValue().path("value").asText(""));
            }
            List<String> tags = new ArrayList<>();
            note.path("tags").forEach(tag -> tags.add(tag.asText()));
            infos.add(new NoteInfo(note.path("noteId").asLong(), note.path("modelName").asText(""), fields, tags));
        }
        return infos;
    }

    @Override
    public List<Long> addNotes(List<AnkiNote> notes) {
        ObjectNode params = objectMapper.createObjectNode();
        ArrayNode notesNode = params.putArray("notes");
        for (AnkiNote note : notes) {
            ObjectNode noteNode = notesNode.addObject();
            noteNode.put("deckName", note.deckName());
            noteNode.put("modelName", note.modelName());
            ObjectNode fields = noteNode.putObject("fields");
            for (Map.Entry<String, String> field : note.fields().entrySet()) {
                fields.put(field.getKey(), field.getValue());
            }
            ArrayNode tags = noteNode.putArray("tags");
            note.tags().forEach(tags::add);
        }
        JsonNode result = invoke("addNotes", params);
        if (!result.isArray()) {
            throw new AnkiConnectException("AnkiConnect addNotes returned a non-array result");
        }
        List<Long> ids = new ArrayList<>(result.size());
        for (JsonNode id : result) {
            ids.add(id.isNull() ? null : id.asLong());
        }
        return ids;
    }

    @Override
    public void updateNoteFields(long noteId, Map<String, String> fields) {
        ObjectNode params = objectMapper.createObjectNode();
        ObjectNode note = params.putObject("note");
        note.put("id", noteId);
        ObjectNode fieldsNode = note.putObject("fields");
        fields.forEach(fieldsNode::put);
        // Success is a null result.
        call("updateNoteFields", params);
    }

    @Override
    public JsonNode invoke(String action, JsonNode params) {
        JsonNode result = call(action, params);
        if (result == null || result.isNull()) {
            throw new AnkiConnectException("AnkiConnect returned null result for action: " + action);
        }
        return result;
    }

    private JsonNode call(String action, JsonNode params) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("action", action);
        payload.put("version", API_VERSION);
        payload.set("params", params == null ? objectMapper.createObjectNode() : params);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException ex) {
            throw new AnkiConnectException("Could not connect to AnkiConnect. Is Anki running? Details: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new AnkiConnectException("AnkiConnect request failed: " + ex.getMessage(), ex);
        }

        if (response == null || !response.isObject()) {
            throw new AnkiConnectException("AnkiConnect response is empty for action: " + action);
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            log.debug("AnkiConnect action={} error={}", action, error.asText());
            throw new AnkiConnectException("AnkiConnect API error: " + error.asText());
        }
        return response.get("result");
    }

    private List<String> textList(JsonNode result, String action) {
        if (!result.isArray()) {
            throw new AnkiConnectException("AnkiConnect " + action + " returned a non-array result");
        }
        List<String> values = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            values.add(node.asText());
        }
        return values;
    }
}
