package com.gt.studyplanner.conf;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class BeanConfig {

    // Runs history queries for interactive requests so that callers can stop waiting on them
    @Bean(name = "historyQueryExecutor")
    public Executor getHistoryQueryExecutor(@Value("${planner.metrics.queryThreads:4}") int queryThreads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(queryThreads);
        executor.setMaxPoolSize(queryThreads);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("history-query-");
        executor.initialize();

        return executor;
    }
}
