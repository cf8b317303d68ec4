package com.budgetpilot.config;

import com.budgetpilot.categorization.config.CategorizationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. categorization-executor runs one sequential batch loop per user run; the pool size
 * bounds how many users are categorized at the same time. Scheduling is enabled here for the stalled-run watchdog,
 * which runs on Boot's task scheduler.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    public static final String CATEGORIZATION_EXECUTOR = "categorization-executor";

    @Bean(name = CATEGORIZATION_EXECUTOR)
    public Executor categorizationExecutor(CategorizationProperties properties) {
        int threads = Math.max(1, properties.getExecutorThreads());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setQueueCapacity(500);
        e.setThreadNamePrefix("categorize-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
