package eu.virtualparadox.finrag.ingest.extractor;

import java.nio.file.Path;

public interface TextExtractor {

    /**
     * Extracts the raw text of every page of a document, in page order.
     *
     * @param path source document
     * @return page texts and page count
     * @throws ExtractionException if the file is unreadable, encrypted or not a valid document
     */
    ExtractedDocument extract(final Path path) throws ExtractionException;

}
