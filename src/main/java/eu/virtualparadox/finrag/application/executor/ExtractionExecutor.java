package eu.virtualparadox.finrag.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for PDF extraction calls, so a worker can stop waiting on an extraction that hangs.
 */
public class ExtractionExecutor extends ThreadPoolTaskExecutor {
}
