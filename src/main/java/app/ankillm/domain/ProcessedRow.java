package app.ankillm.domain;

public record ProcessedRow(
        Row row,
        String error
) {
    public boolean failed() {
        return error != null && !error.isBlank();
    }
}
