package eu.virtualparadox.finrag.ingest.lifecycle;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Aggregate record of one ingestion run. Built once, after every document has finished.
 */
@JsonPropertyOrder({"startedAt", "elapsedMillis", "documentsDiscovered", "documentsProcessed", "documentsFailed",
        "totalPages", "totalChunks", "documents", "failures"})
public record IngestionRun(String startedAt,
                           long elapsedMillis,
                           int documentsDiscovered,
                           int documentsProcessed,
                           int documentsFailed,
                           long totalPages,
                           long totalChunks,
                           List<DocumentOutcome> documents,
                           List<DocumentFailure> failures) {

    public IngestionRun {
        documents = List.copyOf(documents);
        failures = List.copyOf(failures);
    }

    /**
     * Merges per-document results into the run record. Both lists are ordered by source file.
     */
    public static IngestionRun of(final Instant startedAt,
                                  final Duration elapsed,
                                  final List<DocumentOutcome> outcomes,
                                  final List<DocumentFailure> failures) {
        final List<DocumentOutcome> sortedOutcomes = outcomes.stream()
                .sorted(Comparator.comparing(DocumentOutcome::sourceFile))
                .toList();
        final List<DocumentFailure> sortedFailures = failures.stream()
                .sorted(Comparator.comparing(DocumentFailure::sourceFile))
                .toList();

        return new IngestionRun(
                startedAt.toString(),
                elapsed.toMillis(),
                outcomes.size() + failures.size(),
                outcomes.size(),
                failures.size(),
                outcomes.stream().mapToLong(DocumentOutcome::pages).sum(),
                outcomes.stream().mapToLong(DocumentOutcome::chunks).sum(),
                sortedOutcomes,
                sortedFailures
        );
    }
}
