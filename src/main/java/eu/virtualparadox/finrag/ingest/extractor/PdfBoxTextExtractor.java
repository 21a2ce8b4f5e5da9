package eu.virtualparadox.finrag.ingest.extractor;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF extractor backed by Apache PDFBox.
 * <p>Pages are stripped one at a time so that the page sequence survives into the cleaner,
 * which needs page boundaries to detect repeated headers and footers.</p>
 */
@Service
@Slf4j
public final class PdfBoxTextExtractor implements TextExtractor {

    @Override
    public ExtractedDocument extract(final Path path) throws ExtractionException {
        if (!Files.isReadable(path)) {
            throw new ExtractionException("File is not readable: " + path);
        }

        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            if (pdf.isEncrypted() && !pdf.getCurrentAccessPermission().canExtractContent()) {
                throw new ExtractionException("PDF is encrypted and does not permit text extraction: " + path);
            }

            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            final List<String> pages = new ArrayList<>(pageCount);

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(stripper.getText(pdf));
            }

            final long emptyPages = pages.stream().filter(String::isBlank).count();
            log.info("Extracted {} pages ({} without text) from {}", pageCount, emptyPages, path.getFileName());

            return new ExtractedDocument(pages, pageCount);
        }
        catch (InvalidPasswordException e) {
            throw new ExtractionException("PDF is password protected: " + path, e);
        }
        catch (IOException e) {
            throw new ExtractionException("Failed to read PDF " + path + ": " + e.getMessage(), e);
        }
    }
}
