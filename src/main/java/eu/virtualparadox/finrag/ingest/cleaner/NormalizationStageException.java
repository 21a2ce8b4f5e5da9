package eu.virtualparadox.finrag.ingest.cleaner;

import lombok.Getter;

/**
 * A cleaning stage could not process its input. The stage is skipped for that document only.
 */
@Getter
public class NormalizationStageException extends RuntimeException {

    private final String stage;

    public NormalizationStageException(final String stage, final Throwable cause) {
        super("Cleaning stage '" + stage + "' failed: " + cause, cause);
        this.stage = stage;
    }
}
