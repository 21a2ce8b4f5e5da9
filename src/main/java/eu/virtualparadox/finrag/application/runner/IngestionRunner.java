package eu.virtualparadox.finrag.application.runner;

import eu.virtualparadox.finrag.ingest.lifecycle.DocumentFailure;
import eu.virtualparadox.finrag.ingest.lifecycle.DocumentOutcome;
import eu.virtualparadox.finrag.ingest.lifecycle.IngestionOrchestrator;
import eu.virtualparadox.finrag.ingest.lifecycle.IngestionRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts one ingestion run when the application starts and logs its summary.
 * <p>Disable with {@code finrag.ingest.run-on-startup=false}. A configuration error fails startup.</p>
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "finrag.ingest", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class IngestionRunner implements ApplicationRunner {

    private final IngestionOrchestrator orchestrator;

    @Override
    public void run(final ApplicationArguments args) throws Exception {
        final IngestionRun run = orchestrator.run();

        for (DocumentOutcome doc : run.documents()) {
            log.info(String.format("%-45s %6d pages %7d chunks %10d chars",
                    doc.sourceFile(), doc.pages(), doc.chunks(), doc.cleanedChars()));
        }
        for (DocumentFailure failure : run.failures()) {
            log.warn("{} failed: {}", failure.sourceFile(), failure.reason());
        }
    }
}
