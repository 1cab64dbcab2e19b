package app.ankillm.io;

import app.ankillm.domain.PromptTemplate;
import app.ankillm.exception.PromptFileException;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class PromptFileWriter {

    public String format(PromptTemplate template) {
        Map<String, Object> frontMatter = new LinkedHashMap<>();
        frontMatter.put("deck", template.deck());
        frontMatter.put("noteType", template.noteType());
        frontMatter.put("fieldMap", new LinkedHashMap<>(template.fieldMap()));
        if (template.hasQualityCheck()) {
            Map<String, Object> check = new LinkedHashMap<>();
            check.put("field", template.qualityCheck().field());
            check.put("prompt", template.qualityCheck().prompt());
            if (template.qualityCheck().model() != null) {
                check.put("model", template.qualityCheck().model());
            }
            frontMatter.put("qualityCheck", check);
        }

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setSplitLines(false);
        String yaml = new Yaml(options).dump(frontMatter);
        return "---\n" + yaml + "---\n\n" + template.body().trim() + "\n";
    }

    public void write(PromptTemplate template, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, format(template), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new PromptFileException("Failed to write prompt file " + output + ": " + ex.getMessage(), ex);
        }
    }
}
