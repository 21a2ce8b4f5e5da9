package eu.virtualparadox.finrag.ingest.chunker;

import eu.virtualparadox.finrag.application.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ChunkerTest {

    private static final int TARGET = 1000;
    private static final int OVERLAP = 200;

    private final Chunker chunker = new Chunker(TARGET, OVERLAP);

    // ---------- Helpers ----------

    private static String repeat(char c, int count) {
        return String.valueOf(c).repeat(count);
    }

    /**
     * Build prose of N sentences with a paragraph break every fifth sentence.
     */
    private static String buildProse(int sentences) {
        StringBuilder sb = new StringBuilder();
        Random rnd = new Random(42);
        for (int i = 1; i <= sentences; i++) {
            int words = 5 + rnd.nextInt(15);
            for (int w = 0; w < words; w++) {
                int len = 2 + rnd.nextInt(8);
                for (int k = 0; k < len; k++) {
                    sb.append((char) ('a' + rnd.nextInt(26)));
                }
                sb.append(w == words - 1 ? "." : " ");
            }
            sb.append(i % 5 == 0 ? "\n\n" : " ");
        }
        return sb.toString().strip();
    }

    private static void assertWellFormed(String text, List<ChunkSpan> spans, int size, int overlap) {
        assertFalse(spans.isEmpty());
        assertEquals(0, spans.get(0).start(), "first span must start at 0");
        assertEquals(text.length(), spans.get(spans.size() - 1).end(), "last span must reach the end");

        for (int i = 0; i < spans.size(); i++) {
            ChunkSpan span = spans.get(i);
            assertEquals(i, span.index());
            assertTrue(span.length() <= size, "span " + i + " longer than chunk size: " + span.length());
            assertTrue(span.length() > 0, "span " + i + " is empty");
            if (i > 0) {
                ChunkSpan prev = spans.get(i - 1);
                assertTrue(span.start() > prev.start(), "starts must strictly increase");
                assertEquals(prev.end() - overlap, span.start(), "consecutive spans must share the overlap");
            }
        }
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Text without boundaries is cut at fixed windows")
    void split_noBoundaries_naiveWindows() {
        String text = repeat('x', 2300);

        List<ChunkSpan> spans = chunker.split(text);

        assertEquals(List.of(
                new ChunkSpan(0, 0, 1000),
                new ChunkSpan(1, 800, 1800),
                new ChunkSpan(2, 1600, 2300)), spans);
    }

    @Test
    @DisplayName("Empty text yields no spans")
    void split_emptyText_noSpans() {
        assertTrue(chunker.split("").isEmpty());
    }

    @Test
    @DisplayName("Null text is rejected")
    void split_nullText_throws() {
        assertThrows(IllegalArgumentException.class, () -> chunker.split(null));
    }

    @Test
    @DisplayName("Text shorter than the chunk size is a single span")
    void split_shortText_singleSpan() {
        String text = "Revenue grew 12% year over year.";

        List<ChunkSpan> spans = chunker.split(text);

        assertEquals(List.of(new ChunkSpan(0, 0, text.length())), spans);
    }

    @Test
    @DisplayName("Text of exactly the chunk size is a single span")
    void split_exactSize_singleSpan() {
        List<ChunkSpan> spans = chunker.split(repeat('y', TARGET));

        assertEquals(1, spans.size());
        assertEquals(TARGET, spans.get(0).end());
    }

    @Test
    @DisplayName("Cut snaps to a paragraph break inside the tail window")
    void split_paragraphBreak_snapsAfterIt() {
        String text = repeat('a', 900) + "\n\n" + repeat('b', 2000);

        List<ChunkSpan> spans = chunker.split(text);

        assertEquals(902, spans.get(0).end());
        assertEquals(702, spans.get(1).start());
        assertWellFormed(text, spans, TARGET, OVERLAP);
    }

    @Test
    @DisplayName("Paragraph break wins over a later sentence end")
    void split_paragraphBeatsSentence() {
        String text = repeat('a', 820) + "\n\n" + repeat('a', 128) + ". " + repeat('a', 1000);

        assertEquals(822, chunker.split(text).get(0).end());
    }

    @Test
    @DisplayName("Sentence end wins over a later line break")
    void split_sentenceBeatsLineBreak() {
        String text = repeat('a', 850) + ". " + repeat('a', 98) + "\n" + repeat('a', 1000);

        assertEquals(852, chunker.split(text).get(0).end());
    }

    @Test
    @DisplayName("Line break is used when nothing better is in the window")
    void split_lineBreakFallback() {
        String text = repeat('a', 900) + "\n" + repeat('a', 1000);

        assertEquals(901, chunker.split(text).get(0).end());
    }

    @Test
    @DisplayName("Boundaries before the tail window are ignored")
    void split_boundaryOutsideWindow_naiveCut() {
        String text = repeat('a', 500) + "\n\n" + repeat('a', 1000);

        assertEquals(1000, chunker.split(text).get(0).end());
    }

    @Test
    @DisplayName("A snap that would stall the window falls back to the naive cut")
    void split_snapWithoutProgress_usesNaiveEnd() {
        Chunker tight = new Chunker(10, 8, 1.0);
        String text = "a\n" + repeat('b', 20);

        List<ChunkSpan> spans = tight.split(text);

        assertEquals(new ChunkSpan(0, 0, 10), spans.get(0));
        assertWellFormed(text, spans, 10, 8);
    }

    @Test
    @DisplayName("Zero overlap tiles the text without gaps")
    void split_zeroOverlap_contiguous() {
        Chunker noOverlap = new Chunker(300, 0);
        String text = buildProse(80);

        List<ChunkSpan> spans = noOverlap.split(text);

        assertWellFormed(text, spans, 300, 0);
        StringBuilder rebuilt = new StringBuilder();
        for (ChunkSpan span : spans) {
            rebuilt.append(text, span.start(), span.end());
        }
        assertEquals(text, rebuilt.toString());
    }

    @Test
    @DisplayName("Prose is covered completely with overlapping spans")
    void split_prose_coverageAndOverlap() {
        String text = buildProse(300);

        List<ChunkSpan> spans = chunker.split(text);

        assertTrue(spans.size() > 3);
        assertWellFormed(text, spans, TARGET, OVERLAP);

        // every cut except the last lands after a boundary character
        for (int i = 0; i < spans.size() - 1; i++) {
            char before = text.charAt(spans.get(i).end() - 1);
            assertTrue(Character.isWhitespace(before),
                    "span " + i + " should end after whitespace but ended with '" + before + "'");
        }
    }

    @Test
    @DisplayName("Splitting is deterministic")
    void split_sameText_sameSpans() {
        String text = buildProse(200);

        assertEquals(chunker.split(text), new Chunker(TARGET, OVERLAP).split(text));
    }

    @Test
    @DisplayName("Invalid size and overlap combinations are rejected")
    void constructor_invalidConfig_throws() {
        assertThrows(ConfigurationException.class, () -> new Chunker(0, 0));
        assertThrows(ConfigurationException.class, () -> new Chunker(100, 100));
        assertThrows(ConfigurationException.class, () -> new Chunker(100, 150));
        assertThrows(ConfigurationException.class, () -> new Chunker(100, -1));
        assertThrows(ConfigurationException.class, () -> new Chunker(100, 10, 0.0));
        assertThrows(ConfigurationException.class, () -> new Chunker(100, 10, 1.5));
    }

    @Test
    @DisplayName("Snap search returns the naive end when no boundary exists")
    void snapToBoundary_noBoundary() {
        String text = repeat('z', 50);

        assertEquals(40, chunker.snapToBoundary(text, 0, 40));
    }
}
