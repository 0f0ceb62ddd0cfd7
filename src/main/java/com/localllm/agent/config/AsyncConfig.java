package com.localllm.agent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools kept apart from the web and WebSocket I/O threads.
 *
 * - conversationTaskExecutor: one task per running turn. A slow LLM never
 *   blocks message delivery for other conversations.
 * - toolTaskExecutor: independent tool calls of a single LLM reply.
 *   Separate from the turn pool so a turn waiting on its tools cannot
 *   starve the tools themselves.
 * - historyTaskExecutor: fire-and-forget history writes.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "conversationTaskExecutor")
    public ThreadPoolTaskExecutor conversationTaskExecutor() {
        return pool("turn-", 4, 32, 100);
    }

    @Bean(name = "toolTaskExecutor")
    public ThreadPoolTaskExecutor toolTaskExecutor() {
        return pool("tool-", 4, 16, 200);
    }

    @Bean(name = "historyTaskExecutor")
    public Executor historyTaskExecutor() {
        return pool("history-", 1, 2, 500);
    }

    private ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
