package eu.virtualparadox.finrag.ingest.output;

import java.nio.file.Path;

/**
 * Locations of the artifacts written for one document.
 *
 * @param normalizedText the {@code .txt} file holding the normalized text
 * @param chunks         the {@code _chunks.json} file
 */
public record DocumentArtifacts(Path normalizedText, Path chunks) {
}
