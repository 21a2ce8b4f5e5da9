package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Stages that rewrite characters or whitespace without keeping any counters.
 */
class LineStagesTest {

    private final CleaningStats stats = new CleaningStats();

    @Test
    void hyphenationIsRepairedAcrossLineBreak() {
        assertThat(new HyphenatedLineBreakStage().apply("opera-  \n  tions and long-term", stats))
                .isEqualTo("operations and long-term");
    }

    @Test
    void hyphenBeforeBlankIsKept() {
        assertThat(new HyphenatedLineBreakStage().apply("Revenue -\n12", stats))
                .isEqualTo("Revenue -\n12");
    }

    @Test
    void carriageReturnsBecomeLineFeeds() {
        assertThat(new ControlCharacterStage().apply("a\r\nb\rc\u0000d", stats))
                .isEqualTo("a\nb\ncd");
    }

    @Test
    void pageBreakMarkerSurvivesControlCharacterRemoval() {
        assertThat(new ControlCharacterStage().apply("a\n\f\nb\tc", stats))
                .isEqualTo("a\n\f\nb\tc");
    }

    @Test
    void invisibleSpacesBecomeSpaces() {
        assertThat(new InvisibleWhitespaceStage().apply("a\u00A0b\u2009c\uFEFFd", stats))
                .isEqualTo("a b c d");
    }

    @Test
    void pageBreaksAreRemoved() {
        assertThat(new PageBreakStage().apply("one\n\f\ntwo", stats)).isEqualTo("one\n\ntwo");
    }

    @Test
    void unicodeIsComposed() {
        assertThat(new UnicodeNormalizationStage().apply("A\u030A", stats)).isEqualTo("\u00C5");
    }

    @Test
    void blankLinesWithSpacesCollapse() {
        assertThat(new BlankLineCollapseStage().apply("a\n \n\t\n\nb\n\nc", stats))
                .isEqualTo("a\n\nb\n\nc");
    }

    @Test
    void lineSeparatorsCountAsBlank() {
        assertThat(new BlankLineCollapseStage().apply("a\n\u2028\n\u2029 \n\nb", stats))
                .isEqualTo("a\n\nb");
    }

    @Test
    void linesAreTrimmed() {
        assertThat(new TrimStage().apply("\n  a  \n b\n\n", stats)).isEqualTo("a\nb");
    }
}
