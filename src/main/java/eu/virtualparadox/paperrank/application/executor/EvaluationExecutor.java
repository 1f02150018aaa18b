package eu.virtualparadox.paperrank.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for per-candidate rubric calls.
 */
public class EvaluationExecutor extends ThreadPoolTaskExecutor {
}
