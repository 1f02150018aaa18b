package eu.virtualparadox.paperrank.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for per-keyword synonym expansion.
 */
public class ExpansionExecutor extends ThreadPoolTaskExecutor {
}
