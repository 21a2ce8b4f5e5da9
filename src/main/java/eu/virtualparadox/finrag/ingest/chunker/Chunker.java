package eu.virtualparadox.finrag.ingest.chunker;

import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window {@code Chunker} producing overlapping spans over normalized text.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Window:</strong> each window starts at offset {@code start} and naively ends at
 *       {@code min(start + chunkSize, length)}.</li>
 *   <li><strong>Boundary snapping:</strong> unless the window already reaches the end of the text,
 *       the cut point moves backward to a natural boundary found within the last
 *       {@code snapWindowRatio} of the window. Boundaries are tried by priority: paragraph break
 *       ({@code \n\n}), sentence terminator ({@code .}, {@code !}, {@code ?}) followed by whitespace,
 *       then a single line break. The cut lands just after the boundary.</li>
 *   <li><strong>Overlap:</strong> the next window starts at {@code end - overlap}, so consecutive spans
 *       share exactly {@code overlap} characters.</li>
 *   <li><strong>Progress:</strong> if a snapped cut would not move the next window forward, the naive
 *       end is used for that window. Every window therefore starts strictly after the previous one.</li>
 *   <li><strong>Tail:</strong> the span that reaches the end of the text is the last one, however short.</li>
 * </ul>
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction. The same text always yields the same spans.
 */
@Component
@Getter
public class Chunker {

    /**
     * Upper bound on a span's length in characters.
     */
    private final int chunkSize;

    /**
     * Characters shared by consecutive spans.
     */
    private final int overlap;

    /**
     * Tail share of each window searched for a boundary.
     */
    private final double snapWindowRatio;

    /**
     * Constructs a {@code Chunker} from the {@code finrag.chunking.*} settings.
     *
     * @param config application settings
     * @throws eu.virtualparadox.finrag.application.config.ConfigurationException if the chunking settings are invalid
     */
    @Autowired
    public Chunker(final ApplicationConfig config) {
        this(config.getChunking().getChunkSize(),
                config.getChunking().getChunkOverlap(),
                config.getChunking().getSnapWindowRatio());
    }

    /**
     * Constructs a {@code Chunker}.
     *
     * @param chunkSize       maximum span length (must be {@code > 0})
     * @param overlap         overlap between consecutive spans ({@code 0 <= overlap < chunkSize})
     * @param snapWindowRatio tail share of the window searched for a boundary, in {@code (0, 1]}
     * @throws eu.virtualparadox.finrag.application.config.ConfigurationException if constraints are violated
     */
    public Chunker(final int chunkSize, final int overlap, final double snapWindowRatio) {
        ApplicationConfig.validateChunking(chunkSize, overlap, snapWindowRatio);
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.snapWindowRatio = snapWindowRatio;
    }

    public Chunker(final int chunkSize, final int overlap) {
        this(chunkSize, overlap, 0.2);
    }

    /**
     * Splits {@code text} into overlapping spans.
     *
     * @param text normalized text (non-null, may be empty)
     * @return ordered spans; empty for empty text
     */
    public List<ChunkSpan> split(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }

        final List<ChunkSpan> spans = new ArrayList<>();
        final int length = text.length();
        int start = 0;
        int index = 0;

        while (start < length) {
            final int naiveEnd = Math.min(start + chunkSize, length);
            int end = naiveEnd;

            if (naiveEnd < length) {
                final int snapped = snapToBoundary(text, start, naiveEnd);
                // a snapped cut must still push the next window forward
                if (snapped - overlap > start) {
                    end = snapped;
                }
            }

            spans.add(new ChunkSpan(index++, start, end));

            if (end == length) {
                break;
            }
            start = end - overlap;
        }

        return spans;
    }

    /**
     * Finds the cut point for the window {@code [start, naiveEnd)}.
     *
     * @return offset just after the best boundary, or {@code naiveEnd} when none is found
     */
    int snapToBoundary(final String text, final int start, final int naiveEnd) {
        final int searchFrom = Math.max(start, naiveEnd - (int) ((naiveEnd - start) * snapWindowRatio));

        final int paragraph = text.lastIndexOf("\n\n", naiveEnd - 2);
        if (paragraph >= searchFrom) {
            return paragraph + 2;
        }

        for (int i = naiveEnd - 2; i >= searchFrom; i--) {
            if (isSentenceTerminator(text.charAt(i)) && Character.isWhitespace(text.charAt(i + 1))) {
                return i + 2;
            }
        }

        final int newline = text.lastIndexOf('\n', naiveEnd - 1);
        if (newline >= searchFrom) {
            return newline + 1;
        }

        return naiveEnd;
    }

    private static boolean isSentenceTerminator(final char c) {
        return c == '.' || c == '!' || c == '?';
    }
}
