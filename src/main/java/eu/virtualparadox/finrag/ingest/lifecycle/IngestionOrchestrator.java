package eu.virtualparadox.finrag.ingest.lifecycle;

import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.application.executor.ExtractionExecutor;
import eu.virtualparadox.finrag.application.executor.IngestionExecutor;
import eu.virtualparadox.finrag.ingest.chunker.ChunkSpan;
import eu.virtualparadox.finrag.ingest.chunker.Chunker;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningResult;
import eu.virtualparadox.finrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.finrag.ingest.extractor.ExtractedDocument;
import eu.virtualparadox.finrag.ingest.extractor.ExtractionException;
import eu.virtualparadox.finrag.ingest.extractor.TextExtractor;
import eu.virtualparadox.finrag.ingest.metadata.MetadataAttacher;
import eu.virtualparadox.finrag.ingest.model.Chunk;
import eu.virtualparadox.finrag.ingest.model.DocumentMetadata;
import eu.virtualparadox.finrag.ingest.output.IngestionOutputWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Runs the ingestion pipeline over every PDF under the input root:
 * <ol>
 *     <li>Extract per-page text (bounded by the extraction timeout)</li>
 *     <li>Clean the joined pages into normalized text</li>
 *     <li>Split the normalized text into overlapping spans</li>
 *     <li>Attach document identity and statistics to each span</li>
 *     <li>Write the normalized text and chunk list atomically</li>
 * </ol>
 * <p>Documents are independent and run on the ingestion worker pool. A document that fails
 * at any step is recorded as a failure and the batch continues; only invalid configuration
 * aborts a run, and it does so before any document is touched. Results are merged into one
 * {@link IngestionRun} after every worker has finished.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private static final String PDF_EXTENSION = ".pdf";

    private final ApplicationConfig config;
    private final TextExtractor textExtractor;
    private final TextCleaner textCleaner;
    private final Chunker chunker;
    private final MetadataAttacher metadataAttacher;
    private final IngestionOutputWriter outputWriter;
    private final IngestionExecutor ingestionExecutor;
    private final ExtractionExecutor extractionExecutor;

    /**
     * Processes every document under the configured input root and writes the run summary.
     *
     * @return the run summary
     * @throws eu.virtualparadox.finrag.application.config.ConfigurationException if the configuration is invalid
     * @throws IOException if the input tree cannot be listed or the summary cannot be written
     */
    public IngestionRun run() throws IOException {
        config.validate();

        final Instant startedAt = Instant.now();
        final long startNs = System.nanoTime();
        final Path inputRoot = config.getInputRoot();

        final List<Path> documents = discover(inputRoot);
        log.info("Ingestion started: {} PDFs under {} (chunk size {}, overlap {})",
                documents.size(), inputRoot, chunker.getChunkSize(), chunker.getOverlap());

        final IngestionProgressTracker tracker = new IngestionProgressTracker(documents.size());
        final List<Future<DocumentResult>> futures = new ArrayList<>(documents.size());
        for (Path document : documents) {
            futures.add(ingestionExecutor.submit(() -> processSafely(inputRoot, document, tracker)));
        }

        final List<DocumentOutcome> outcomes = new ArrayList<>();
        final List<DocumentFailure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            final DocumentResult result = await(futures.get(i), relativeName(inputRoot, documents.get(i)));
            if (result.outcome() != null) {
                outcomes.add(result.outcome());
            } else {
                failures.add(result.failure());
            }
        }

        final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNs);
        final IngestionRun run = IngestionRun.of(startedAt, elapsed, outcomes, failures);
        outputWriter.writeSummary(run);

        log.info("Ingestion complete: {}/{} processed, {} failed, {} chunks, {} pages in {}s",
                run.documentsProcessed(), run.documentsDiscovered(), run.documentsFailed(),
                run.totalChunks(), run.totalPages(),
                String.format(Locale.ROOT, "%.1f", elapsed.toMillis() / 1000.0));
        return run;
    }

    /**
     * Runs the pipeline for a single document and writes its artifacts.
     *
     * @param inputRoot root the document was discovered under
     * @param source    the PDF
     * @return the document's summary line
     * @throws ExtractionException if the document cannot be extracted in time
     * @throws IOException if the artifacts cannot be written
     */
    public DocumentOutcome process(final Path inputRoot, final Path source) throws ExtractionException, IOException {
        final DocumentMetadata metadata = metadataAttacher.resolve(inputRoot, source);
        final String documentId = metadataAttacher.documentId(inputRoot, source);

        log.info("Processing {} [{}/{}]", metadata.sourceFile(), metadata.company(), metadata.year());

        final ExtractedDocument extracted = extractWithTimeout(source);
        final CleaningResult cleaning = textCleaner.clean(documentId, TextCleaner.joinPages(extracted.pages()));
        final List<ChunkSpan> spans = chunker.split(cleaning.getCleanText());
        final List<Chunk> chunks = metadataAttacher.attach(documentId, metadata, cleaning.getCleanText(), spans);

        outputWriter.writeDocument(metadata, extracted.pageCount(), cleaning, chunks);
        log.info("Chunked {} into {} chunks", metadata.sourceFile(), chunks.size());

        return new DocumentOutcome(
                metadata.sourceFile(),
                documentId,
                metadata.company(),
                metadata.region(),
                metadata.reportType(),
                metadata.year(),
                metadata.resolved(),
                extracted.pageCount(),
                chunks.size(),
                cleaning.getOriginalChars(),
                cleaning.getCleanedChars(),
                cleaning.getStageFailures()
        );
    }

    /**
     * Lists PDFs (extension matched case-insensitively) below the root, sorted by path.
     */
    List<Path> discover(final Path inputRoot) throws IOException {
        try (Stream<Path> paths = Files.walk(inputRoot)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION))
                    .sorted()
                    .toList();
        }
    }

    private DocumentResult processSafely(final Path inputRoot, final Path source, final IngestionProgressTracker tracker) {
        final String name = relativeName(inputRoot, source);
        DocumentResult result;
        try {
            result = DocumentResult.processed(process(inputRoot, source));
        } catch (ExtractionException e) {
            log.warn("Extraction failed for {}: {}", name, e.getMessage());
            result = DocumentResult.failed(name, "Extraction failed: " + e.getMessage());
        } catch (IOException | UncheckedIOException e) {
            log.error("Could not write output for {}", name, e);
            result = DocumentResult.failed(name, "Output could not be written: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing {}", name, e);
            result = DocumentResult.failed(name, "Unexpected error: " + e);
        }
        tracker.step(name, result.failure() != null);
        return result;
    }

    private ExtractedDocument extractWithTimeout(final Path source) throws ExtractionException {
        final Duration timeout = config.getIngest().getExtractionTimeout();
        final Future<ExtractedDocument> extraction = extractionExecutor.submit(() -> textExtractor.extract(source));
        try {
            return extraction.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            extraction.cancel(true);
            throw new ExtractionException("Extraction timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            extraction.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while extracting", e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ExtractionException extractionException) {
                throw extractionException;
            }
            throw new ExtractionException(String.valueOf(cause), cause);
        }
    }

    private DocumentResult await(final Future<DocumentResult> future, final String name) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DocumentResult.failed(name, "Interrupted before completion");
        } catch (ExecutionException e) {
            log.error("Worker failed for {}", name, e.getCause());
            return DocumentResult.failed(name, "Unexpected error: " + e.getCause());
        }
    }

    private String relativeName(final Path inputRoot, final Path source) {
        return metadataAttacher.sourceFile(inputRoot, source);
    }

    private record DocumentResult(DocumentOutcome outcome, DocumentFailure failure) {

        static DocumentResult processed(final DocumentOutcome outcome) {
            return new DocumentResult(outcome, null);
        }

        static DocumentResult failed(final String sourceFile, final String reason) {
            return new DocumentResult(null, new DocumentFailure(sourceFile, reason));
        }
    }
}
