package com.github.salilvnair.researchengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ResearchEngineAsyncConfiguration {

    public static final String ENGINE_EXECUTOR = "researchEngineExecutor";
    public static final String ENGINE_SCHEDULER = "researchEngineScheduler";

    @Bean(name = ENGINE_EXECUTOR)
    public ThreadPoolTaskExecutor researchEngineExecutor(ResearchEngineAsyncConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix(config.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = ENGINE_SCHEDULER, destroyMethod = "shutdownNow")
    public ScheduledExecutorService researchEngineScheduler() {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "research-engine-timer-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newScheduledThreadPool(1, threadFactory);
    }
}
