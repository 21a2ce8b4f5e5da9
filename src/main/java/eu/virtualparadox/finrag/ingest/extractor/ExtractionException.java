package eu.virtualparadox.finrag.ingest.extractor;

/**
 * A source document could not be turned into text: unreadable, encrypted or not a valid PDF.
 */
public class ExtractionException extends Exception {

    public ExtractionException(final String message) {
        super(message);
    }

    public ExtractionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
