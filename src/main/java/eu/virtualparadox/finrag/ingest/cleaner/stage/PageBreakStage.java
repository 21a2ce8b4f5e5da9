package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;
import eu.virtualparadox.finrag.ingest.cleaner.TextCleaner;

/**
 * Drops the page-break markers once header detection is done. The newlines around each
 * marker remain, so a page boundary becomes a paragraph break.
 */
public final class PageBreakStage implements CleaningStage {

    @Override
    public String name() {
        return "page-breaks";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        return text.replace(String.valueOf(TextCleaner.PAGE_BREAK), "");
    }
}
