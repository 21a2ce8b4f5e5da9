package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.regex.Pattern;

/**
 * Collapses three or more consecutive newlines to exactly two. Lines holding only
 * horizontal whitespace or Unicode line/paragraph separators count as blank.
 */
public final class BlankLineCollapseStage implements CleaningStage {

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n(?:[\\h\\u2028\\u2029]*\\n){2,}");

    @Override
    public String name() {
        return "blank-lines";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        return EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
    }
}
