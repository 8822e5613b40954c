package com.medform.backend.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    /**
     * Fixed-size pool for blocking PDF/image work (rasterization, form I/O, dual-format fills).
     */
    @Bean(name = "pipelineTaskExecutor")
    public ThreadPoolTaskExecutor pipelineTaskExecutor(PipelineProperties pipelineProperties) {
        int workers = Math.max(1, pipelineProperties.getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("form-pipeline-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
