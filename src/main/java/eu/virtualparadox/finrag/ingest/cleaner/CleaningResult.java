package eu.virtualparadox.finrag.ingest.cleaner;

import java.util.List;

/**
 * Result of text cleaning operation.
 */
public class CleaningResult {
    private final String cleanText;
    private final int originalChars;
    private final CleaningStats stats;
    private final List<StageFailure> stageFailures;

    public CleaningResult(String cleanText, int originalChars, CleaningStats stats, List<StageFailure> stageFailures) {
        this.cleanText = cleanText;
        this.originalChars = originalChars;
        this.stats = stats;
        this.stageFailures = List.copyOf(stageFailures);
    }

    public String getCleanText() {
        return cleanText;
    }

    public int getOriginalChars() {
        return originalChars;
    }

    public int getCleanedChars() {
        return cleanText.length();
    }

    /**
     * Share of the raw text removed as noise, in percent.
     */
    public double getReductionPercent() {
        if (originalChars == 0) {
            return 0.0;
        }
        return (1.0 - (double) cleanText.length() / originalChars) * 100.0;
    }

    public CleaningStats getStats() {
        return stats;
    }

    public List<StageFailure> getStageFailures() {
        return stageFailures;
    }
}
