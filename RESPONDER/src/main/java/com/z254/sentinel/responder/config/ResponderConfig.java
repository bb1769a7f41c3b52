package com.z254.sentinel.responder.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor beans for incident processing.
 */
@Slf4j
@Configuration
public class ResponderConfig {

    public static final String PIPELINE_EXECUTOR = "pipelineExecutor";

    /**
     * Bounded pool running incident pipelines and apply-and-verify, off the monitor thread.
     * Shutdown waits for in-flight work so no incident is left half-written.
     */
    @Bean(name = PIPELINE_EXECUTOR)
    public ThreadPoolTaskExecutor pipelineExecutor(ResponderProperties properties) {
        ResponderProperties.Monitor monitor = properties.getMonitor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("incident-pipeline-");
        executor.setCorePoolSize(monitor.getPipelineThreads());
        executor.setMaxPoolSize(monitor.getPipelineThreads());
        executor.setQueueCapacity(monitor.getPipelineQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getVerify().getMaxTotalTime().toSeconds() + 10);
        executor.initialize();
        log.info("Incident pipeline executor: {} threads, queue {}", monitor.getPipelineThreads(),
                monitor.getPipelineQueueCapacity());
        return executor;
    }
}
