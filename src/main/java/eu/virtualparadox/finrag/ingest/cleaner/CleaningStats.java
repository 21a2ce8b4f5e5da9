package eu.virtualparadox.finrag.ingest.cleaner;

import lombok.Getter;

/**
 * Counters collected while one document is cleaned. Confined to the thread cleaning that document.
 */
@Getter
public final class CleaningStats {

    private int boilerplateLinesRemoved;
    private int pageNumberLinesRemoved;
    private int tableLinesFlagged;

    public void addBoilerplateLinesRemoved(final int count) {
        boilerplateLinesRemoved += count;
    }

    public void addPageNumberLinesRemoved(final int count) {
        pageNumberLinesRemoved += count;
    }

    public void addTableLinesFlagged(final int count) {
        tableLinesFlagged += count;
    }
}
