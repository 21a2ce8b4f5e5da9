package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Best-effort cleanup of table remnants. No table structure is reconstructed.
 * <ul>
 *   <li>A line of at least {@value #MIN_TOKENS} tokens where at least 60% of the tokens are
 *       numeric or at most two characters long is flagged and rebuilt with single spaces.</li>
 *   <li>A run of at least {@value #MIN_COLUMN_RUN} consecutive lines that each hold one such
 *       token (a column spilled one cell per line) is flagged and joined into one line.</li>
 * </ul>
 */
public final class GarbledTableStage implements CleaningStage {

    static final int MIN_TOKENS = 4;
    static final int MIN_COLUMN_RUN = 3;
    static final double CELL_RATIO = 0.6;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // 1,234.5 | (12.3) | -4% | $60.9 | €1.2
    private static final Pattern NUMERIC_TOKEN = Pattern.compile("[-+(]?[$€£₹¥]?\\d[\\d.,]*%?\\)?");

    @Override
    public String name() {
        return "garbled-tables";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        final String[] lines = text.split("\n", -1);
        final List<String> out = new ArrayList<>(lines.length);
        int flagged = 0;

        int i = 0;
        while (i < lines.length) {
            final int runEnd = columnRunEnd(lines, i);
            if (runEnd - i >= MIN_COLUMN_RUN) {
                final List<String> cells = new ArrayList<>(runEnd - i);
                for (int j = i; j < runEnd; j++) {
                    cells.add(lines[j].strip());
                }
                out.add(String.join(" ", cells));
                flagged += runEnd - i;
                i = runEnd;
                continue;
            }

            final String line = lines[i];
            final String[] tokens = tokens(line);
            if (isTableRow(tokens)) {
                out.add(String.join(" ", tokens));
                flagged++;
            } else {
                out.add(line);
            }
            i++;
        }

        stats.addTableLinesFlagged(flagged);
        return String.join("\n", out);
    }

    private static int columnRunEnd(final String[] lines, final int from) {
        int end = from;
        while (end < lines.length) {
            final String[] tokens = tokens(lines[end]);
            if (tokens.length != 1 || !isCell(tokens[0])) {
                break;
            }
            end++;
        }
        return end;
    }

    private static boolean isTableRow(final String[] tokens) {
        if (tokens.length < MIN_TOKENS) {
            return false;
        }
        int cells = 0;
        for (String token : tokens) {
            if (isCell(token)) {
                cells++;
            }
        }
        return (double) cells / tokens.length >= CELL_RATIO;
    }

    static boolean isCell(final String token) {
        return token.length() <= 2 || NUMERIC_TOKEN.matcher(token).matches();
    }

    private static String[] tokens(final String line) {
        final String stripped = line.strip();
        if (stripped.isEmpty()) {
            return new String[0];
        }
        return WHITESPACE.split(stripped);
    }
}
