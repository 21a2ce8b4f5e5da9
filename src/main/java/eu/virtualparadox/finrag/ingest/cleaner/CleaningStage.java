package eu.virtualparadox.finrag.ingest.cleaner;

/**
 * One step of the normalization pipeline: text in, text out.
 * <p>Implementations are stateless; counters go to the per-document {@link CleaningStats}.</p>
 */
public interface CleaningStage {

    /**
     * @return short stable name used in logs and in recorded stage failures
     */
    String name();

    /**
     * @param text  output of the previous stage
     * @param stats per-document counters
     * @return transformed text
     */
    String apply(String text, CleaningStats stats);
}
