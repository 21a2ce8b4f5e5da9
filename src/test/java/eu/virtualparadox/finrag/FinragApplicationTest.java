package eu.virtualparadox.finrag;

import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.application.runner.IngestionRunner;
import eu.virtualparadox.finrag.ingest.chunker.Chunker;
import eu.virtualparadox.finrag.ingest.extractor.PdfBoxTextExtractor;
import eu.virtualparadox.finrag.ingest.extractor.TextExtractor;
import eu.virtualparadox.finrag.ingest.lifecycle.IngestionOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "finrag.ingest.run-on-startup=false",
        "finrag.chunking.chunk-size=800",
        "finrag.chunking.chunk-overlap=100",
        "finrag.ingest.extraction-timeout=45s"
})
class FinragApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ApplicationConfig config;

    @Autowired
    private Chunker chunker;

    @Test
    void contextWiresThePipeline() {
        assertThat(context.getBean(IngestionOrchestrator.class)).isNotNull();
        assertThat(context.getBean(TextExtractor.class)).isInstanceOf(PdfBoxTextExtractor.class);
        assertThat(context.getBeansOfType(IngestionRunner.class)).isEmpty();
    }

    @Test
    void propertiesAreBound() {
        assertThat(config.getChunking().getChunkSize()).isEqualTo(800);
        assertThat(config.getIngest().getExtractionTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(config.getCleaning().getHeaderMinPages()).isEqualTo(3);
        assertThat(chunker.getChunkSize()).isEqualTo(800);
        assertThat(chunker.getOverlap()).isEqualTo(100);
    }
}
