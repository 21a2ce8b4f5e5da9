package eu.virtualparadox.finrag.ingest.output;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningResult;
import eu.virtualparadox.finrag.ingest.lifecycle.IngestionRun;
import eu.virtualparadox.finrag.ingest.model.Chunk;
import eu.virtualparadox.finrag.ingest.model.DocumentMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes ingestion artifacts under the configured output root.
 *
 * <p>Layout, mirroring the input tree:</p>
 * <pre>
 *     processed/us/annual/nvidia/nvidia_2024_annual.txt
 *     processed/us/annual/nvidia/nvidia_2024_annual_chunks.json
 *     processed/ingestion_summary.json
 * </pre>
 *
 * <p>Every file is written to a temporary file in its target directory and then moved over
 * the target, so a reader never observes a partially written artifact and a rerun replaces
 * the previous output instead of appending to it.</p>
 */
@Component
@Slf4j
public class IngestionOutputWriter {

    public static final String SUMMARY_FILE = "ingestion_summary.json";

    private static final String TEXT_SUFFIX = ".txt";
    private static final String CHUNKS_SUFFIX = "_chunks.json";

    /** Temporary file prefix for atomic writes. */
    private static final String TEMP_FILE_PREFIX = ".write-";

    /** Temporary file suffix for atomic writes. */
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private final ApplicationConfig config;
    private final ObjectWriter jsonWriter;

    public IngestionOutputWriter(final ApplicationConfig config) {
        this.config = config;
        // fixed "\n" line feeds keep artifacts byte-identical across platforms
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("  ", "\n"));
        printer.indentArraysWith(new DefaultIndenter("  ", "\n"));
        this.jsonWriter = new ObjectMapper().writer(printer);
    }

    /**
     * Writes the normalized text and the chunk list of one document.
     *
     * @param metadata   document identity
     * @param pageCount  number of pages in the source
     * @param cleaning   cleaning result holding the normalized text
     * @param chunks     chunks in index order
     * @return where the artifacts were written
     * @throws IOException if a file cannot be written
     */
    public DocumentArtifacts writeDocument(final DocumentMetadata metadata,
                                           final int pageCount,
                                           final CleaningResult cleaning,
                                           final List<Chunk> chunks) throws IOException {
        final Path targetDir = targetDirectory(metadata.sourceFile());
        Files.createDirectories(targetDir);

        final String stem = stem(metadata.sourceFile());
        final Path textPath = targetDir.resolve(stem + TEXT_SUFFIX);
        final Path chunksPath = targetDir.resolve(stem + CHUNKS_SUFFIX);

        final long totalChars = chunks.stream().mapToLong(Chunk::charCount).sum();
        final ChunkFileMetadata fileMetadata = new ChunkFileMetadata(
                metadata.sourceFile(),
                metadata.company(),
                metadata.region(),
                metadata.reportType(),
                metadata.year(),
                metadata.resolved(),
                pageCount,
                cleaning.getOriginalChars(),
                cleaning.getCleanedChars(),
                Math.round(cleaning.getReductionPercent() * 100.0) / 100.0,
                cleaning.getStats().getBoilerplateLinesRemoved(),
                cleaning.getStats().getPageNumberLinesRemoved(),
                cleaning.getStats().getTableLinesFlagged(),
                chunks.size(),
                chunks.isEmpty() ? 0 : Math.round((double) totalChars / chunks.size()),
                config.getChunking().getChunkSize(),
                config.getChunking().getChunkOverlap(),
                cleaning.getStageFailures()
        );

        writeAtomically(textPath, cleaning.getCleanText().getBytes(StandardCharsets.UTF_8));
        writeAtomically(chunksPath, jsonWriter.writeValueAsBytes(new ChunkFile(fileMetadata, chunks)));

        log.info("Saved {} and {}", textPath.getFileName(), chunksPath.getFileName());
        return new DocumentArtifacts(textPath, chunksPath);
    }

    /**
     * Writes the run summary to {@value #SUMMARY_FILE} under the output root.
     *
     * @param run the finished run
     * @return path of the summary file
     * @throws IOException if the file cannot be written
     */
    public Path writeSummary(final IngestionRun run) throws IOException {
        final Path outputRoot = config.getOutputRoot();
        Files.createDirectories(outputRoot);
        final Path summaryPath = outputRoot.resolve(SUMMARY_FILE);
        writeAtomically(summaryPath, jsonWriter.writeValueAsBytes(run));
        log.info("Summary saved to {}", summaryPath);
        return summaryPath;
    }

    private Path targetDirectory(final String sourceFile) {
        Path dir = config.getOutputRoot();
        final String[] parts = sourceFile.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            dir = dir.resolve(parts[i]);
        }
        return dir;
    }

    private static String stem(final String sourceFile) {
        final String name = sourceFile.substring(sourceFile.lastIndexOf('/') + 1);
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void writeAtomically(final Path target, final byte[] content) throws IOException {
        final Path temp = Files.createTempFile(target.getParent(), TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
