package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GarbledTableStageTest {

    private final GarbledTableStage stage = new GarbledTableStage();

    @Test
    @DisplayName("Numeric row is flagged and rebuilt with single spaces")
    void numericRowIsNormalized() {
        CleaningStats stats = new CleaningStats();

        String out = stage.apply("Revenue   1,234  (5.6)   12%\nRevenue grew strongly this year.", stats);

        assertThat(out).isEqualTo("Revenue 1,234 (5.6) 12%\nRevenue grew strongly this year.");
        assertThat(stats.getTableLinesFlagged()).isEqualTo(1);
    }

    @Test
    @DisplayName("Column spilled one cell per line is joined into one line")
    void columnRunIsJoined() {
        CleaningStats stats = new CleaningStats();

        String out = stage.apply("Segment revenue\n$1,200\n$1,350\n$1,410\nAll figures in millions.", stats);

        assertThat(out).isEqualTo("Segment revenue\n$1,200 $1,350 $1,410\nAll figures in millions.");
        assertThat(stats.getTableLinesFlagged()).isEqualTo(3);
    }

    @Test
    void twoCellLinesAreNotAColumn() {
        String text = "Total\n1,200\n1,350\nEnd of table.";

        assertThat(stage.apply(text, new CleaningStats())).isEqualTo(text);
    }

    @Test
    void proseIsUntouched() {
        String text = "The company reported revenue of $60.9 billion in fiscal 2024.";
        CleaningStats stats = new CleaningStats();

        assertThat(stage.apply(text, stats)).isEqualTo(text);
        assertThat(stats.getTableLinesFlagged()).isZero();
    }

    @Test
    void recognizesFinancialCells() {
        assertThat(GarbledTableStage.isCell("(12.3)")).isTrue();
        assertThat(GarbledTableStage.isCell("-4%")).isTrue();
        assertThat(GarbledTableStage.isCell("€1.2")).isTrue();
        assertThat(GarbledTableStage.isCell("Q4")).isTrue();
        assertThat(GarbledTableStage.isCell("revenue")).isFalse();
    }
}
