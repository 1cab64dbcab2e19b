package app.ankillm.io;

import app.ankillm.domain.PromptTemplate;
import app.ankillm.domain.QualityCheckConfig;
import app.ankillm.exception.PromptFileException;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a prompt file: YAML front matter between {@code ---} lines followed by the prompt body.
 */
@Component
public class PromptFileParser {

    private static final Pattern FRONT_MATTER = Pattern.compile("^---[ \\t]*\\n([\\s\\S]+?)\\n---[ \\t]*(?:\\n([\\s\\S]*))?$");

    static final String EXAMPLE = """
            ---
            deck: My Deck
            noteType: Basic
            fieldMap:
              front: Front
              back: Back
            ---

            Your prompt text here...""";

    public PromptTemplate parse(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PromptFileException("Prompt file not found: " + path);
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new PromptFileException("Failed to read prompt file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public PromptTemplate parse(String content) {
        String normalized = content == null ? "" : content.replace("\r\n", "\n");
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }
        Matcher matcher = FRONT_MATTER.matcher(normalized);
        if (!matcher.matches()) {
            throw new PromptFileException("Invalid prompt file format. Expected YAML frontmatter enclosed by --- markers.\n\n"
                    + "Example:\n" + EXAMPLE);
        }
        String body = matcher.group(2) == null ? "" : matcher.group(2).trim();

        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(matcher.group(1));
        } catch (YAMLException ex) {
            throw new PromptFileException("Failed to parse YAML frontmatter: " + ex.getMessage(), ex);
        }
        if (!(loaded instanceof Map<?, ?> frontMatter)) {
            throw invalid(List.of("(root): expected a mapping"));
        }

        List<String> issues = new ArrayList<>();
        String deck = requiredString(frontMatter.get("deck"), "deck", "Deck name is required", issues);
        String noteType = requiredString(frontMatter.get("noteType"), "noteType", "Note type is required", issues);
        Map<String, String> fieldMap = fieldMap(frontMatter.get("fieldMap"), issues);
        QualityCheckConfig qualityCheck = qualityCheck(frontMatter.get("qualityCheck"), issues);
        if (!issues.isEmpty()) {
            throw invalid(issues);
        }
        return new PromptTemplate(deck, noteType, fieldMap, qualityCheck, body);
    }

    private Map<String, String> fieldMap(Object raw, List<String> issues) {
        if (!(raw instanceof Map<?, ?> map)) {
            issues.add("fieldMap: " + (raw == null ? "Required" : "expected a mapping of JSON keys to Anki fields"));
            return Map.of();
        }
        if (map.isEmpty()) {
            issues.add("fieldMap: fieldMap must have at least one key-value pair");
            return Map.of();
        }
        Map<String, String> fieldMap = new LinkedHashMap<>();
        Set<String> targets = new HashSet<>();
        map.forEach((key, value) -> {
            String llmKey = String.valueOf(key);
            if (!(value instanceof String field) || field.isBlank()) {
                issues.add("fieldMap." + llmKey + ": expected a non-empty Anki field name");
                return;
            }
            if (!targets.add(field)) {
                issues.add("fieldMap." + llmKey + ": Anki field \"" + field + "\" is already mapped by another key");
                return;
            }
            fieldMap.put(llmKey, field);
        });
        return fieldMap;
    }

    private QualityCheckConfig qualityCheck(Object raw, List<String> issues) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            issues.add("qualityCheck: expected a mapping");
            return null;
        }
        String field = requiredString(map.get("field"), "qualityCheck.field",
                "The target field for the quality check is required.", issues);
        String prompt = requiredString(map.get("prompt"), "qualityCheck.prompt",
                "A prompt for the quality check is required.", issues);
        Object model = map.get("model");
        if (model != null && !(model instanceof String)) {
            issues.add("qualityCheck.model: expected a string");
            model = null;
        }
        return new QualityCheckConfig(field, prompt, (String) model);
    }

    private String requiredString(Object raw, String path, String message, List<String> issues) {
        if (raw instanceof String value && !value.isBlank()) {
            return value;
        }
        issues.add(path + ": " + message);
        return null;
    }

    private PromptFileException invalid(List<String> issues) {
        StringBuilder message = new StringBuilder("Invalid frontmatter structure:\n");
        for (String issue : issues) {
            message.append("  - ").append(issue).append('\n');
        }
        message.append("\nRequired fields: deck, noteType, fieldMap");
        return new PromptFileException(message.toString());
    }
}
