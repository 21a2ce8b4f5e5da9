package eu.virtualparadox.finrag.ingest.extractor;

import java.util.List;

/**
 * Raw per-page text of one source document.
 *
 * @param pages     page texts ordered by page number (a page without text is an empty string)
 * @param pageCount number of pages in the source document
 */
public record ExtractedDocument(List<String> pages, int pageCount) {

    public ExtractedDocument {
        pages = List.copyOf(pages);
        if (pageCount != pages.size()) {
            throw new IllegalArgumentException(
                    "pageCount " + pageCount + " does not match number of page texts " + pages.size());
        }
    }

    public static ExtractedDocument ofPages(final List<String> pages) {
        return new ExtractedDocument(pages, pages.size());
    }
}
