package eu.virtualparadox.finrag.ingest.cleaner;

/**
 * A cleaning stage that failed for one document and was skipped.
 *
 * @param stage   stage name
 * @param message failure description
 */
public record StageFailure(String stage, String message) {

    public static StageFailure of(final NormalizationStageException e) {
        final Throwable cause = e.getCause();
        final String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        return new StageFailure(e.getStage(), message);
    }
}
