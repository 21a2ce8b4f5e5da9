package eu.virtualparadox.finrag.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool running one document pipeline per task.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
