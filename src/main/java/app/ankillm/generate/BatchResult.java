package app.ankillm.generate;

import app.ankillm.domain.CardCandidate;
import app.ankillm.domain.ProcessedRow;
import app.ankillm.llm.TokenStats;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Aggregate of one batch. Candidates are ordered by source row index; every row that
 * produced no candidate appears in {@code failures} with its error.
 */
public record BatchResult(
        List<CardCandidate> candidates,
        List<ProcessedRow> failures,
        TokenStats tokens,
        BigDecimal cost,
        int totalRows
) {
    public BatchResult {
        candidates = candidates.stream()
                .sorted(Comparator.comparingInt(CardCandidate::rowIndex))
                .toList();
        failures = failures.stream()
                .sorted(Comparator.comparingInt(failure -> failure.row().index()))
                .toList();
    }

    public int succeededRows() {
        return totalRows - failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
