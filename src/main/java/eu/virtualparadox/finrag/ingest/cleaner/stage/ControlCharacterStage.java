package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.regex.Pattern;

/**
 * Normalizes line endings to {@code \n} and removes control characters such as NUL bytes.
 * Newlines, tabs and the page-break marker are kept.
 */
public final class ControlCharacterStage implements CleaningStage {

    private static final Pattern LINE_ENDINGS = Pattern.compile("\\r\\n?");

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\n\\t\\f]]");

    @Override
    public String name() {
        return "control-characters";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        final String unixLines = LINE_ENDINGS.matcher(text).replaceAll("\n");
        return CONTROL_CHARS.matcher(unixLines).replaceAll("");
    }
}
