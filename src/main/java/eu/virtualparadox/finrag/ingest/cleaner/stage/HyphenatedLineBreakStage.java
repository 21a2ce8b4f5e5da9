package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.regex.Pattern;

/**
 * Rejoins words broken across a line wrap: {@code "com-\npany"} becomes {@code "company"}.
 * Only horizontal whitespace may surround the newline, so a page break is never crossed.
 */
public final class HyphenatedLineBreakStage implements CleaningStage {

    private static final Pattern HYPHENATED_BREAK = Pattern.compile(
            "(\\w)-\\h*\\n\\h*(\\w)", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public String name() {
        return "hyphenated-line-break";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        return HYPHENATED_BREAK.matcher(text).replaceAll("$1$2");
    }
}
