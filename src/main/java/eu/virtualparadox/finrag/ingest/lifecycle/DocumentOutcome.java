package eu.virtualparadox.finrag.ingest.lifecycle;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import eu.virtualparadox.finrag.ingest.cleaner.StageFailure;

import java.util.List;

/**
 * Per-document line of the run summary for a document that was processed.
 * A document whose normalized text is empty is still an outcome, with zero chunks.
 */
@JsonPropertyOrder({"sourceFile", "documentId", "company", "region", "reportType", "year", "metadataResolved",
        "pages", "chunks", "originalChars", "cleanedChars", "stageFailures"})
public record DocumentOutcome(String sourceFile,
                              String documentId,
                              String company,
                              String region,
                              String reportType,
                              String year,
                              boolean metadataResolved,
                              int pages,
                              int chunks,
                              int originalChars,
                              int cleanedChars,
                              List<StageFailure> stageFailures) {

    public DocumentOutcome {
        stageFailures = List.copyOf(stageFailures);
    }
}
