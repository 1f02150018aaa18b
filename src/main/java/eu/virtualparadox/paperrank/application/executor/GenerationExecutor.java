package eu.virtualparadox.paperrank.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for text-generation calls guarded by a timeout.
 */
public class GenerationExecutor extends ThreadPoolTaskExecutor {
}
