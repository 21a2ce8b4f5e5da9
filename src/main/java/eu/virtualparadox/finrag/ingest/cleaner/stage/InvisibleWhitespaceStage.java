package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.regex.Pattern;

/**
 * Replaces non-breaking and invisible spaces with an ordinary space and drops soft hyphens.
 */
public final class InvisibleWhitespaceStage implements CleaningStage {

    // NBSP, ogham space, en/em/thin/hair spaces, zero-width space and joiners,
    // narrow NBSP, medium math space, word joiner, ideographic space, BOM
    private static final Pattern INVISIBLE_WHITESPACE = Pattern.compile(
            "[\\u00A0\\u1680\\u2000-\\u200D\\u202F\\u205F\\u2060\\u3000\\uFEFF]");

    private static final char SOFT_HYPHEN = '\u00AD';

    @Override
    public String name() {
        return "invisible-whitespace";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        final String spaced = INVISIBLE_WHITESPACE.matcher(text).replaceAll(" ");
        return spaced.indexOf(SOFT_HYPHEN) < 0 ? spaced : spaced.replace(String.valueOf(SOFT_HYPHEN), "");
    }
}
