package eu.virtualparadox.finrag.ingest.output;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import eu.virtualparadox.finrag.ingest.model.Chunk;

import java.util.List;

/**
 * Content of a {@code *_chunks.json} artifact.
 */
@JsonPropertyOrder({"metadata", "chunks"})
public record ChunkFile(ChunkFileMetadata metadata, List<Chunk> chunks) {
}
