package app.ankillm.io;

import app.ankillm.domain.PromptTemplate;
import app.ankillm.domain.QualityCheckConfig;
import app.ankillm.exception.PromptFileException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptFileParserTest {

    private final PromptFileParser parser = new PromptFileParser();

    @Test
    void parsesFrontMatterAndBody() {
        String content = """
                ---
                deck: Japanese::Vocab
                noteType: Basic
                fieldMap:
                  jp: Front
                  en: Back
                qualityCheck:
                  field: jp
                  prompt: "Check {text}"
                ---

                Make a card for {term}.
                """;

        PromptTemplate template = parser.parse(content);

        assertThat(template.deck()).isEqualTo("Japanese::Vocab");
        assertThat(template.noteType()).isEqualTo("Basic");
        assertThat(template.fieldMap()).containsExactly(Map.entry("jp", "Front"), Map.entry("en", "Back"));
        assertThat(template.qualityCheck()).isEqualTo(new QualityCheckConfig("jp", "Check {text}", null));
        assertThat(template.body()).isEqualTo("Make a card for {term}.");
    }

    @Test
    void acceptsWindowsLineEndingsAndByteOrderMark() {
        String content = "\uFEFF---\r\ndeck: D\r\nnoteType: Basic\r\nfieldMap:\r\n  f: Front\r\n---\r\nBody {x}\r\n";

        PromptTemplate template = parser.parse(content);

        assertThat(template.body()).isEqualTo("Body {x}");
        assertThat(template.hasQualityCheck()).isFalse();
    }

    @Test
    void missingFrontMatterShowsExample() {
        assertThatThrownBy(() -> parser.parse("Just a prompt"))
                .isInstanceOf(PromptFileException.class)
                .hasMessageContaining("Expected YAML frontmatter")
                .hasMessageContaining("fieldMap:");
    }

    @Test
    void collectsEveryStructuralIssue() {
        String content = """
                ---
                noteType: ""
                fieldMap:
                  a: Front
                  b: Front
                qualityCheck:
                  field: a
                ---
                body
                """;

        assertThatThrownBy(() -> parser.parse(content))
                .isInstanceOf(PromptFileException.class)
                .hasMessageContaining("  - deck: Deck name is required")
                .hasMessageContaining("  - noteType: Note type is required")
                .hasMessageContaining("fieldMap.b: Anki field \"Front\" is already mapped")
                .hasMessageContaining("qualityCheck.prompt")
                .hasMessageEndingWith("Required fields: deck, noteType, fieldMap");
    }

    @Test
    void emptyFieldMapIsRejected() {
        String content = "---\ndeck: D\nnoteType: Basic\nfieldMap: {}\n---\nbody";

        assertThatThrownBy(() -> parser.parse(content))
                .hasMessageContaining("fieldMap must have at least one key-value pair");
    }

    @Test
    void brokenYamlIsReported() {
        String content = "---\ndeck: [unclosed\n---\nbody";

        assertThatThrownBy(() -> parser.parse(content))
                .isInstanceOf(PromptFileException.class)
                .hasMessageStartingWith("Failed to parse YAML frontmatter");
    }

    @Test
    void writtenFileParsesBack(@TempDir Path tempDir) {
        Map<String, String> fieldMap = new LinkedHashMap<>();
        fieldMap.put("term", "Expression");
        fieldMap.put("meaning", "Meaning");
        PromptTemplate original = new PromptTemplate("Japanese: Core", "Japanese (recognition)", fieldMap,
                new QualityCheckConfig("term", "Is {text} natural?", "gpt-4o"), "Explain {term}.\n\nReturn JSON.");
        Path path = tempDir.resolve("prompts/vocab.md");

        new PromptFileWriter().write(original, path);

        assertThat(parser.parse(path)).isEqualTo(original);
    }
}
