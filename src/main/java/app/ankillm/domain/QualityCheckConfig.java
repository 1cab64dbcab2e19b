package app.ankillm.domain;

public record QualityCheckConfig(
        String field,
        String prompt,
        String model
) {
}
