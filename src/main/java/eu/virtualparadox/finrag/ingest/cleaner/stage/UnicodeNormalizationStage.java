package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.text.Normalizer;

/**
 * Canonical composition (NFC), so a glyph built from a base letter and combining marks
 * is a single character for every later regex.
 */
public final class UnicodeNormalizationStage implements CleaningStage {

    @Override
    public String name() {
        return "unicode-nfc";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        return Normalizer.normalize(text, Normalizer.Form.NFC);
    }
}
