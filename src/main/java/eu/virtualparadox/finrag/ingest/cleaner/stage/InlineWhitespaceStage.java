package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.regex.Pattern;

/**
 * Collapses runs of spaces and tabs within a line to one space.
 */
public final class InlineWhitespaceStage implements CleaningStage {

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("\\h+");

    @Override
    public String name() {
        return "inline-whitespace";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        return HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
    }
}
