package eu.virtualparadox.paperrank.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for asynchronously submitted review runs.
 */
public class RunExecutor extends ThreadPoolTaskExecutor {
}
