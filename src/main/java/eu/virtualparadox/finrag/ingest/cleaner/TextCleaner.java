package eu.virtualparadox.finrag.ingest.cleaner;

import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.ingest.cleaner.stage.BlankLineCollapseStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.BulletNormalizationStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.ControlCharacterStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.GarbledTableStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.HyphenatedLineBreakStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.InlineWhitespaceStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.InvisibleWhitespaceStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.PageBreakStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.PageNumberStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.RepeatedHeaderFooterStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.TrimStage;
import eu.virtualparadox.finrag.ingest.cleaner.stage.UnicodeNormalizationStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the raw text of one document into normalized text.
 *
 * <p>The stages run in a fixed order. Each one relies on what the earlier ones guarantee:
 * regex stages expect NFC-composed characters, the hyphenation repair expects plain {@code \n}
 * line endings, header detection needs the page-break markers that are only dropped after it,
 * and the final trim runs last so no later stage reintroduces edge whitespace.</p>
 *
 * <p>A stage that throws is skipped for the current document; its input flows on to the
 * next stage unchanged and the failure is recorded on the {@link CleaningResult}.</p>
 */
@Component
@Slf4j
public class TextCleaner {

    /**
     * Marker placed between pages by {@link #joinPages(List)}; removed by {@link PageBreakStage}.
     */
    public static final char PAGE_BREAK = '\f';

    private static final String PAGE_SEPARATOR = "\n" + PAGE_BREAK + "\n";

    private final List<CleaningStage> stages;

    @Autowired
    public TextCleaner(final ApplicationConfig config) {
        this(config.getCleaning().getHeaderFrequencyThreshold(), config.getCleaning().getHeaderMinPages());
    }

    public TextCleaner(final double headerFrequencyThreshold, final int headerMinPages) {
        this(defaultStages(headerFrequencyThreshold, headerMinPages));
    }

    public TextCleaner(final List<CleaningStage> stages) {
        this.stages = List.copyOf(stages);
    }

    /**
     * The production stage order.
     */
    public static List<CleaningStage> defaultStages(final double headerFrequencyThreshold, final int headerMinPages) {
        ApplicationConfig.validateHeaderDetection(headerFrequencyThreshold, headerMinPages);
        return List.of(
                new UnicodeNormalizationStage(),
                new InvisibleWhitespaceStage(),
                new ControlCharacterStage(),
                new HyphenatedLineBreakStage(),
                new RepeatedHeaderFooterStage(headerFrequencyThreshold, headerMinPages),
                new PageBreakStage(),
                new PageNumberStage(),
                new BulletNormalizationStage(),
                new BlankLineCollapseStage(),
                new InlineWhitespaceStage(),
                new GarbledTableStage(),
                new TrimStage()
        );
    }

    /**
     * Concatenates page texts with a page-break marker between consecutive pages.
     *
     * @param pages page texts in page order
     * @return raw document text ready for {@link #clean(String, String)}
     */
    public static String joinPages(final List<String> pages) {
        return String.join(PAGE_SEPARATOR, pages);
    }

    /**
     * Cleans text that carries no page structure.
     *
     * @param input raw text
     * @return cleaned text
     */
    public String cleanText(final String input) {
        return clean("text", input).getCleanText();
    }

    /**
     * Runs every stage over the raw text of one document.
     *
     * @param documentId identifier used in log messages
     * @param rawText    pages joined by {@link #joinPages(List)}
     * @return normalized text, counters and any skipped stages
     */
    public CleaningResult clean(final String documentId, final String rawText) {
        final CleaningStats stats = new CleaningStats();
        final List<StageFailure> failures = new ArrayList<>();

        if (rawText == null || rawText.isEmpty()) {
            return new CleaningResult("", 0, stats, failures);
        }

        String workingText = rawText;
        for (CleaningStage stage : stages) {
            try {
                workingText = applyStage(stage, workingText, stats);
            } catch (NormalizationStageException e) {
                log.warn("Skipping cleaning stage '{}' for {}", e.getStage(), documentId, e.getCause());
                failures.add(StageFailure.of(e));
            }
        }

        final CleaningResult result = new CleaningResult(workingText, rawText.length(), stats, failures);
        log.info("Cleaned {}: {} -> {} chars ({}% reduced, {} boilerplate lines removed, {} stage failures)",
                documentId,
                result.getOriginalChars(),
                result.getCleanedChars(),
                String.format(Locale.ROOT, "%.1f", result.getReductionPercent()),
                stats.getBoilerplateLinesRemoved(),
                failures.size());
        return result;
    }

    private static String applyStage(final CleaningStage stage, final String text, final CleaningStats stats) {
        try {
            return stage.apply(text, stats);
        } catch (RuntimeException e) {
            throw new NormalizationStageException(stage.name(), e);
        }
    }
}
