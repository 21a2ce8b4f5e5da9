package eu.virtualparadox.finrag.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the normalized text.
 *
 * @param index 0-based position of the span within its document
 * @param start inclusive start offset
 * @param end   exclusive end offset
 */
public record ChunkSpan(int index, int start, int end) {

    public ChunkSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Length of the span in characters.
     *
     * @return {@code end - start}
     */
    public int length() {
        return end - start;
    }
}
