package app.ankillm.generate;

/**
 * Asks a human whether a card flagged by the quality check should be kept.
 * Calls happen one at a time.
 */
public interface ReviewPrompter {

    /**
     * @param position 1-based position among the flagged cards
     */
    boolean keep(QualityCheckResult flagged, int position, int total);
}
