package com.herzen.assurance.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ReasoningExecutorConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ReasoningExecutorConfiguration.class);

    @Bean(name = "reasoningExecutor")
    public ThreadPoolTaskExecutor reasoningExecutor(AssuranceProperties properties) {
        int size = Math.max(1, properties.getReasoningPoolSize());
        log.info("Configuring reasoning executor with {} threads", size);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("clarissa-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
