package com.missionpilot.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the orchestration core.
 *
 * taskWorkers : fixed pool; one task attempt (or research unit) per thread
 * toolExecutor: unbounded; each tool call gets its own thread so its timeout can fire
 * totExecutor : fixed pool for scoring the candidates of one Tree-of-Thoughts level
 */
@Configuration
public class OrchestratorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService taskWorkers(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerCount(), named("task-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool(named("tool"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService totExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(
                Math.max(properties.getTot().getBeamWidth(), properties.getWorkerCount()), named("tot-eval"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
