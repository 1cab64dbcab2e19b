package app.ankillm.io;

import app.ankillm.exception.DataFileException;

import java.nio.file.Path;
import java.util.Locale;

public enum DataFileFormat {
    CSV,
    YAML;

    public static DataFileFormat fromPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return CSV;
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "(none)" : name.substring(dot);
        throw new DataFileException("Unsupported file extension: " + extension + ". Use .csv, .yaml, or .yml");
    }
}
