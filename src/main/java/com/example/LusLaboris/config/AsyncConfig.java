package com.example.LusLaboris.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String JOB_EXECUTOR = "jobExecutor";

    /**
     * Runs ingestion jobs away from request threads. A full queue rejects the
     * submission, which the job tracker records as a failed job.
     */
    @Bean(name = JOB_EXECUTOR)
    public ThreadPoolTaskExecutor jobExecutor(RagProperties properties) {
        RagProperties.Jobs jobs = properties.getJobs();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(jobs.getCorePoolSize());
        executor.setMaxPoolSize(jobs.getMaxPoolSize());
        executor.setQueueCapacity(jobs.getQueueCapacity());
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
