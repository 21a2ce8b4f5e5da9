package eu.virtualparadox.finrag.ingest.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Immutable representation of a text chunk produced by cleaning + chunking.
 * <p>Offsets are half-open and refer to the document's normalized text. The identity fields
 * are copied from the document so a chunk is self-describing once it leaves the pipeline.</p>
 */
@JsonPropertyOrder({"chunkId", "chunkIndex", "startOffset", "endOffset", "text",
        "company", "region", "reportType", "year", "charCount"})
public record Chunk(String chunkId,
                    int chunkIndex,
                    int startOffset,
                    int endOffset,
                    String text,
                    String company,
                    String region,
                    String reportType,
                    String year,
                    int charCount) {
}
