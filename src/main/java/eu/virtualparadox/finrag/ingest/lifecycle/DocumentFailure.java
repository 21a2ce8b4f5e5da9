package eu.virtualparadox.finrag.ingest.lifecycle;

/**
 * A document that could not be processed.
 *
 * @param sourceFile path relative to the input root
 * @param reason     why processing stopped
 */
public record DocumentFailure(String sourceFile, String reason) {
}
