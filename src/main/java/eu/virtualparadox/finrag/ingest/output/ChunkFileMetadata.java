package eu.virtualparadox.finrag.ingest.output;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import eu.virtualparadox.finrag.ingest.cleaner.StageFailure;

import java.util.List;

/**
 * Header of a {@code *_chunks.json} artifact. Holds no wall-clock values, so reprocessing
 * unchanged input writes the same bytes.
 */
@JsonPropertyOrder({"sourceFile", "company", "region", "reportType", "year", "metadataResolved",
        "totalPages", "originalChars", "cleanedChars", "reductionPercent",
        "boilerplateLinesRemoved", "pageNumberLinesRemoved", "tableLinesFlagged",
        "totalChunks", "avgChunkSize", "chunkSize", "chunkOverlap", "stageFailures"})
public record ChunkFileMetadata(String sourceFile,
                                String company,
                                String region,
                                String reportType,
                                String year,
                                boolean metadataResolved,
                                int totalPages,
                                int originalChars,
                                int cleanedChars,
                                double reductionPercent,
                                int boilerplateLinesRemoved,
                                int pageNumberLinesRemoved,
                                int tableLinesFlagged,
                                int totalChunks,
                                long avgChunkSize,
                                int chunkSize,
                                int chunkOverlap,
                                List<StageFailure> stageFailures) {
}
