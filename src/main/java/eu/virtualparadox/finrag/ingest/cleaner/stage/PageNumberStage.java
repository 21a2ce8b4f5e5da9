package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deletes lines that hold nothing but a page number: {@code "42"}, {@code "Page 42"},
 * {@code "Page 42 of 300"} or {@code "- 42 -"}. The line and its newline go away together.
 */
public final class PageNumberStage implements CleaningStage {

    private static final Pattern PAGE_NUMBER_LINE = Pattern.compile(
            "^\\h*[-–—]*\\h*(?:page\\h*)?\\d{1,4}(?:\\h*of\\h*\\d+)?\\h*[-–—]*\\h*(?:\\n|$)",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "page-numbers";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        final Matcher matcher = PAGE_NUMBER_LINE.matcher(text);
        final StringBuilder sb = new StringBuilder(text.length());
        int removed = 0;
        while (matcher.find()) {
            matcher.appendReplacement(sb, "");
            removed++;
        }
        matcher.appendTail(sb);
        stats.addPageNumberLinesRemoved(removed);
        return sb.toString();
    }
}
