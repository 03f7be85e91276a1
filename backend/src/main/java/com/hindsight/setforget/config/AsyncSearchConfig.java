package com.hindsight.setforget.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncSearchConfig {

    // Runs whole search jobs; each job blocks on its weights, so it must not share the weight pool.
    @Bean(name = "searchJobExecutor")
    public ThreadPoolTaskExecutor searchJobExecutor() {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(2);
        exec.setMaxPoolSize(2);
        exec.setQueueCapacity(20);
        exec.setThreadNamePrefix("HindsightJob-");
        exec.initialize();
        return exec;
    }

    @Bean(name = "searchExecutor")
    public ThreadPoolTaskExecutor searchExecutor(@Value("${hindsight.search.threads:4}") int threads) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(threads);
        exec.setMaxPoolSize(threads);
        exec.setQueueCapacity(100);
        exec.setThreadNamePrefix("HindsightWeight-");
        exec.initialize();
        return exec;
    }
}
