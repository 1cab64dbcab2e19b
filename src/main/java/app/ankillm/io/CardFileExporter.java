package app.ankillm.io;

import app.ankillm.domain.ValidatedCard;
import app.ankillm.exception.DataFileException;
import app.ankillm.exception.SchemaMismatchException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes cards keyed by store field names to CSV or YAML, appending when the file exists.
 * Also writes plain record lists for deck exports.
 */
@Component
public class CardFileExporter {

    private static final Logger log = LoggerFactory.getLogger(CardFileExporter.class);

    private final DataFileReader dataFileReader;

    public CardFileExporter(DataFileReader dataFileReader) {
        this.dataFileReader = dataFileReader;
    }

    public ExportResult export(List<ValidatedCard> cards, Path output) {
        DataFileFormat format = DataFileFormat.fromPath(output);
        List<Map<String, String>> newRecords = cards.stream().map(ValidatedCard::ankiFields).toList();

        List<Map<String, String>> existing = List.of();
        List<String> existingHeaders = List.of();
        boolean appending = Files.exists(output);
        if (appending) {
            try {
                DataFileReader.Table table = dataFileReader.readTable(output);
                existing = table.records();
                existingHeaders = table.headers();
            } catch (DataFileException ex) {
                throw new DataFileException("Failed to parse existing file at " + output
                        + ". It may be corrupted or in the wrong format. Error: " + ex.getMessage(), ex);
            }
        }
        if (newRecords.isEmpty()) {
            log.info("Nothing to export output={}", output);
            return new ExportResult(output, existing.size(), 0, appending);
        }

        List<String> headers = new ArrayList<>(newRecords.get(0).keySet());
        // A header-only CSV still fixes the columns.
        if (!existingHeaders.isEmpty()) {
            if (!new HashSet<>(existingHeaders).equals(new HashSet<>(headers))) {
                throw new SchemaMismatchException(existingHeaders, headers);
            }
            headers = existingHeaders;
        }

        List<Map<String, String>> combined = new ArrayList<>(existing.size() + newRecords.size());
        combined.addAll(existing);
        combined.addAll(newRecords);
        try {
            writeAtomically(output, combined, headers, format);
        } catch (IOException ex) {
            throw new DataFileException("Failed to write " + output + ": " + ex.getMessage(), ex);
        }
        log.info("Exported cards output={} existing={} added={}", output, existing.size(), newRecords.size());
        return new ExportResult(output, existing.size(), newRecords.size(), appending);
    }

    /**
     * Replaces {@code output} with the given records. Columns follow {@code headers}.
     */
    public void writeRecords(List<Map<String, String>> records, List<String> headers, Path output) {
        DataFileFormat format = DataFileFormat.fromPath(output);
        try {
            writeAtomically(output, records, headers, format);
        } catch (IOException ex) {
            throw new DataFileException("Failed to write " + output + ": " + ex.getMessage(), ex);
        }
        log.info("Wrote records output={} count={}", output, records.size());
    }

    private void writeAtomically(Path output,
                                 List<Map<String, String>> records,
                                 List<String> headers,
                                 DataFileFormat format) throws IOException {
        Path directory = output.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + output.getFileName(), ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                if (format == DataFileFormat.CSV) {
                    writeCsv(writer, records, headers);
                } else {
                    writeYaml(writer, records);
                }
            }
            try {
                Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void writeCsv(BufferedWriter writer, List<Map<String, String>> records, List<String> headers) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(headers.toArray(String[]::new))
                .setRecordSeparator('\n')
                .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Map<String, String> record : records) {
                List<String> values = new ArrayList<>(headers.size());
                for (String header : headers) {
                    values.add(record.getOrDefault(header, ""));
                }
                printer.printRecord(values);
            }
        }
    }

    private void writeYaml(BufferedWriter writer, List<Map<String, String>> records) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setSplitLines(false);
        List<Map<String, String>> plain = records.stream().<Map<String, String>>map(LinkedHashMap::new).toList();
        new Yaml(options).dump(plain, writer);
    }

    public record ExportResult(Path output, int existingCount, int addedCount, boolean appended) {
    }
}
