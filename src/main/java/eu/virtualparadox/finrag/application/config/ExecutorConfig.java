package eu.virtualparadox.finrag.application.config;

import eu.virtualparadox.finrag.application.executor.ExtractionExecutor;
import eu.virtualparadox.finrag.application.executor.IngestionExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IngestionExecutor ingestionExecutor(final ApplicationConfig config) {
        final int workers = Math.max(1, config.getIngest().getWorkers());
        IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE); // documents wait for a free worker
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public ExtractionExecutor extractionExecutor() {
        ExtractionExecutor executor = new ExtractionExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(Integer.MAX_VALUE); // a timed out extraction must not block the next one
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(30);
        executor.setThreadNamePrefix("extract-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
