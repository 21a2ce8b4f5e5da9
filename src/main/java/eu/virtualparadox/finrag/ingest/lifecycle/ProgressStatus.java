package eu.virtualparadox.finrag.ingest.lifecycle;

/**
 * Progress status of an ingestion run.
 *
 * @param finished     documents finished so far, processed or failed
 * @param total        documents discovered
 * @param totalPercent overall progress percentage (0-100)
 */
public record ProgressStatus(int finished, int total, int totalPercent) {

}
