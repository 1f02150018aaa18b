package eu.virtualparadox.paperrank.application.config;

import eu.virtualparadox.paperrank.application.executor.EvaluationExecutor;
import eu.virtualparadox.paperrank.application.executor.ExpansionExecutor;
import eu.virtualparadox.paperrank.application.executor.GenerationExecutor;
import eu.virtualparadox.paperrank.application.executor.RunExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final PipelineConfig pipelineConfig;

    @Bean
    public RunExecutor runExecutor() {
        // one review run at a time, the rest wait in the queue
        return configure(new RunExecutor(), 1, "run-");
    }

    @Bean
    public ExpansionExecutor expansionExecutor() {
        return configure(new ExpansionExecutor(), pipelineConfig.getExpansionWorkers(), "expand-");
    }

    @Bean
    public EvaluationExecutor evaluationExecutor() {
        return configure(new EvaluationExecutor(), pipelineConfig.getEvaluationWorkers(), "evaluate-");
    }

    @Bean
    public GenerationExecutor generationExecutor() {
        return configure(new GenerationExecutor(), pipelineConfig.getGenerationWorkers(), "generate-");
    }

    private static <T extends ThreadPoolTaskExecutor> T configure(final T executor,
                                                                  final int workers,
                                                                  final String prefix) {
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
