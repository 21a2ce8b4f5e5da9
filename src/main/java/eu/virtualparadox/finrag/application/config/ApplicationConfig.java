package eu.virtualparadox.finrag.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Ingestion settings bound from {@code finrag.*} properties.
 * <p>Passed explicitly to the components that need it; nothing reads settings from a static holder.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "finrag")
@Getter @Setter
public class ApplicationConfig {

    private Path inputRoot = Path.of("data");
    private Path outputRoot = Path.of("processed");

    private Chunking chunking = new Chunking();
    private Cleaning cleaning = new Cleaning();
    private Ingest ingest = new Ingest();

    @Getter @Setter
    public static class Chunking {
        private int chunkSize = 1000;
        private int chunkOverlap = 200;
        private double snapWindowRatio = 0.2;
    }

    @Getter @Setter
    public static class Cleaning {
        private double headerFrequencyThreshold = 0.5;
        private int headerMinPages = 3;
    }

    @Getter @Setter
    public static class Ingest {
        private int workers = Runtime.getRuntime().availableProcessors();
        private Duration extractionTimeout = Duration.ofSeconds(120);
        private boolean runOnStartup = true;
    }

    /**
     * Checks every setting an ingestion run depends on.
     *
     * @throws ConfigurationException on the first invalid setting
     */
    public void validate() {
        if (inputRoot == null) {
            throw new ConfigurationException("finrag.input-root is not set");
        }
        if (!Files.isDirectory(inputRoot)) {
            throw new ConfigurationException("finrag.input-root is not a directory: " + inputRoot);
        }
        if (outputRoot == null) {
            throw new ConfigurationException("finrag.output-root is not set");
        }
        validateChunking(chunking.getChunkSize(), chunking.getChunkOverlap(), chunking.getSnapWindowRatio());
        validateHeaderDetection(cleaning.getHeaderFrequencyThreshold(), cleaning.getHeaderMinPages());
        if (ingest.getWorkers() < 1) {
            throw new ConfigurationException("finrag.ingest.workers must be at least 1");
        }
        if (ingest.getExtractionTimeout() == null
                || ingest.getExtractionTimeout().isZero()
                || ingest.getExtractionTimeout().isNegative()) {
            throw new ConfigurationException("finrag.ingest.extraction-timeout must be positive");
        }
    }

    public static void validateChunking(final int chunkSize, final int overlap, final double snapWindowRatio) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunk size must be positive, was " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new ConfigurationException(
                    "chunk overlap must be non-negative and less than chunk size (" + overlap + " vs " + chunkSize + ")");
        }
        if (!(snapWindowRatio > 0.0 && snapWindowRatio <= 1.0)) {
            throw new ConfigurationException("snap window ratio must be in (0, 1], was " + snapWindowRatio);
        }
    }

    public static void validateHeaderDetection(final double threshold, final int minPages) {
        if (!(threshold > 0.0 && threshold < 1.0)) {
            throw new ConfigurationException("header frequency threshold must be in (0, 1), was " + threshold);
        }
        if (minPages < 2) {
            throw new ConfigurationException("header detection needs at least 2 pages, was " + minPages);
        }
    }
}
