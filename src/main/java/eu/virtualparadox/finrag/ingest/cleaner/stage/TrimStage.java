package eu.virtualparadox.finrag.ingest.cleaner.stage;

import eu.virtualparadox.finrag.ingest.cleaner.CleaningStage;
import eu.virtualparadox.finrag.ingest.cleaner.CleaningStats;

import java.util.Arrays;
import java.util.stream.Collectors;

public final class TrimStage implements CleaningStage {

    @Override
    public String name() {
        return "trim";
    }

    @Override
    public String apply(final String text, final CleaningStats stats) {
        return Arrays.stream(text.split("\n", -1))
                .map(String::strip)
                .collect(Collectors.joining("\n"))
                .strip();
    }
}
