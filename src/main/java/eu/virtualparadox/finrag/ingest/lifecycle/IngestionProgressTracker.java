package eu.virtualparadox.finrag.ingest.lifecycle;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks how many documents of one run have finished. Safe to call from any worker thread.
 */
@Slf4j
final class IngestionProgressTracker {

    /**
     * Number of documents discovered for the run.
     */
    private final int total;

    /**
     * Documents finished so far (processed or failed).
     */
    private final AtomicInteger finished = new AtomicInteger();

    IngestionProgressTracker(final int total) {
        this.total = total;
    }

    /**
     * Called by a worker when a document is done, whatever the result.
     */
    void step(final String sourceFile, final boolean failed) {
        final int done = finished.incrementAndGet();
        final ProgressStatus status = statusOf(done);
        log.info("[{}/{} {}%] {} {}", status.finished(), status.total(), status.totalPercent(),
                failed ? "failed" : "processed", sourceFile);
    }

    ProgressStatus getProgressStatus() {
        return statusOf(finished.get());
    }

    private ProgressStatus statusOf(final int done) {
        final int percent = total == 0 ? 100 : (int) ((done * 100L) / total);
        return new ProgressStatus(done, total, percent);
    }
}
