package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.regex.Pattern;

/**
 * Maps the assorted bullet glyphs used in reports to {@code •}.
 */
public final class BulletNormalizationStage implements CleaningStage {

    private static final Pattern BULLETS = Pattern.compile("[●▪▸►◆◇○]");

    @Override
    public String name() {
        return "bullets";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        return BULLETS.matcher(text).replaceAll("•");
    }
}
