package app.ankillm.io;

import app.ankillm.domain.Row;
import app.ankillm.exception.DataFileException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads tabular source files: CSV with a header row, or YAML holding a list of maps.
 */
@Component
public class DataFileReader {

    public List<Row> readRows(Path path) {
        List<Map<String, String>> records = readRecords(path);
        List<Row> rows = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            rows.add(new Row(i, records.get(i)));
        }
        return rows;
    }

    /**
     * Column names across all rows, in first-seen order.
     */
    public static Set<String> columns(List<Row> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Row row : rows) {
            columns.addAll(row.values().keySet());
        }
        return columns;
    }

    public List<Map<String, String>> readRecords(Path path) {
        return readTable(path).records();
    }

    /**
     * Reads the header and records. A CSV header is kept even when no record follows it; for YAML the header is
     * the first record's keys.
     */
    public Table readTable(Path path) {
        DataFileFormat format = DataFileFormat.fromPath(path);
        if (!Files.isRegularFile(path)) {
            throw new DataFileException("File not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return format == DataFileFormat.CSV ? readCsv(reader) : readYaml(reader);
        } catch (IOException | UncheckedIOException ex) {
            throw new DataFileException("Failed to read " + path + ": " + ex.getMessage(), ex);
        }
    }

    private Table readCsv(Reader reader) throws IOException {
        // Values are kept verbatim so appended files round-trip.
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .build();
        try (CSVParser parser = CSVParser.parse(reader, format)) {
            List<String> headers = parser.getHeaderNames();
            List<Map<String, String>> records = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> values = new LinkedHashMap<>();
                for (String header : headers) {
                    values.put(header, record.isSet(header) ? record.get(header) : "");
                }
                records.add(values);
            }
            return new Table(List.copyOf(headers), records);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            throw new DataFileException("CSV parsing error: " + ex.getMessage(), ex);
        }
    }

    private Table readYaml(Reader reader) {
        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException ex) {
            throw new DataFileException("YAML parsing error: " + ex.getMessage(), ex);
        }
        if (loaded == null) {
            return new Table(List.of(), List.of());
        }
        if (!(loaded instanceof List<?> items)) {
            throw new DataFileException("YAML content is not an array");
        }
        List<Map<String, String>> records = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof Map<?, ?> item)) {
                throw new DataFileException("YAML item " + (i + 1) + " is not a mapping");
            }
            Map<String, String> values = new LinkedHashMap<>();
            item.forEach((key, value) -> values.put(String.valueOf(key), value == null ? "" : String.valueOf(value)));
            records.add(values);
        }
        List<String> headers = records.isEmpty() ? List.of() : List.copyOf(records.get(0).keySet());
        return new Table(headers, records);
    }

    public record Table(List<String> headers, List<Map<String, String>> records) {
    }
}
