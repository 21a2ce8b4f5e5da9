package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepeatedHeaderFooterStageTest {

    private final RepeatedHeaderFooterStage stage = new RepeatedHeaderFooterStage(0.5, 3);

    @Test
    void removesLineAboveThresholdFromEveryPage() {
        String text = "Header\nalpha\fHeader\nbeta\f  Header  \ngamma\fdelta";
        CleaningStats stats = new CleaningStats();

        String out = stage.apply(text, stats);

        assertThat(out).isEqualTo("alpha\fbeta\fgamma\fdelta");
        assertThat(stats.getBoilerplateLinesRemoved()).isEqualTo(3);
    }

    @Test
    void lineOnExactlyHalfThePagesIsKept() {
        String text = "Footer\na\fFooter\nb\fc\fd";

        assertThat(stage.apply(text, new CleaningStats())).isEqualTo(text);
    }

    @Test
    void tooFewPagesSkipsDetection() {
        String text = "Header\nalpha\fHeader\nbeta";
        CleaningStats stats = new CleaningStats();

        assertThat(stage.apply(text, stats)).isEqualTo(text);
        assertThat(stats.getBoilerplateLinesRemoved()).isZero();
    }

    @Test
    void blankPagesDoNotCountTowardsFrequency() {
        // 3 text pages out of 5, header on 2 of them (67%)
        String[] pages = {"Header\na", " \n ", "Header\nb", "", "c"};

        assertThat(stage.detectBoilerplate(pages)).containsExactly("Header");
    }

    @Test
    void lineRepeatedWithinOnePageCountsOnce() {
        String[] pages = {"Note\nNote\nNote", "x", "y", "z"};

        assertThat(stage.detectBoilerplate(pages)).isEmpty();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RepeatedHeaderFooterStage(0.0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RepeatedHeaderFooterStage(0.5, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
