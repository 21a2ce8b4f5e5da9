package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;
import eu.virtualparadox.finrag.ingest.cleaner.TextCleaner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Removes running headers and footers.
 *
 * <h2>Detection</h2>
 * The text is split at page-break markers. Each trimmed, non-blank line is counted at most once
 * per page. A line is boilerplate when it occurs on more than {@code frequencyThreshold} of the
 * pages that carry any text. Detection only happens per document, and only when the document
 * has at least {@code minPages} text pages; with fewer pages every line of a one-page document
 * would look like a header.
 *
 * <h2>Removal</h2>
 * Every line whose trimmed form is boilerplate is dropped from every page. Page-break markers
 * are kept for the stages that follow.
 */
public final class RepeatedHeaderFooterStage implements CleaningStage {

    private static final Pattern PAGE_SPLIT = Pattern.compile(Pattern.quote(String.valueOf(TextCleaner.PAGE_BREAK)));

    private final double frequencyThreshold;
    private final int minPages;

    /**
     * @param frequencyThreshold share of text pages a line must exceed to count as boilerplate, in (0, 1)
     * @param minPages           minimum number of text pages before detection runs (at least 2)
     */
    public RepeatedHeaderFooterStage(final double frequencyThreshold, final int minPages) {
        if (!(frequencyThreshold > 0.0 && frequencyThreshold < 1.0)) {
            throw new IllegalArgumentException("frequencyThreshold must be in (0, 1)");
        }
        if (minPages < 2) {
            throw new IllegalArgumentException("minPages must be at least 2");
        }
        this.frequencyThreshold = frequencyThreshold;
        this.minPages = minPages;
    }

    @Override
    public String name() {
        return "repeated-header-footer";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        final String[] pages = PAGE_SPLIT.split(text, -1);
        final Set<String> boilerplate = detectBoilerplate(pages);
        if (boilerplate.isEmpty()) {
            return text;
        }

        int removed = 0;
        final List<String> cleanedPages = new ArrayList<>(pages.length);
        for (String page : pages) {
            final String[] lines = page.split("\n", -1);
            final StringBuilder kept = new StringBuilder(page.length());
            boolean first = true;
            for (String line : lines) {
                if (boilerplate.contains(line.strip())) {
                    removed++;
                    continue;
                }
                if (!first) {
                    kept.append('\n');
                }
                kept.append(line);
                first = false;
            }
            cleanedPages.add(kept.toString());
        }

        stats.addBoilerplateLinesRemoved(removed);
        return String.join(String.valueOf(TextCleaner.PAGE_BREAK), cleanedPages);
    }

    /**
     * Finds the lines that recur on more than the threshold share of text pages.
     *
     * @param pages page texts
     * @return trimmed boilerplate lines, empty when the document is too short to judge
     */
    Set<String> detectBoilerplate(final String[] pages) {
        final Map<String, Integer> pageFrequency = new HashMap<>();
        int textPages = 0;

        for (String page : pages) {
            if (page.isBlank()) {
                continue;
            }
            textPages++;
            final Set<String> seenOnPage = new HashSet<>();
            for (String line : page.split("\n")) {
                final String key = line.strip();
                if (!key.isEmpty() && seenOnPage.add(key)) {
                    pageFrequency.merge(key, 1, Integer::sum);
                }
            }
        }

        if (textPages < minPages) {
            return Set.of();
        }

        final Set<String> boilerplate = new HashSet<>();
        for (Map.Entry<String, Integer> entry : pageFrequency.entrySet()) {
            if ((double) entry.getValue() / textPages > frequencyThreshold) {
                boilerplate.add(entry.getKey());
            }
        }
        return boilerplate;
    }
}
