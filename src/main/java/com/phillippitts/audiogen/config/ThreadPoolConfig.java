package com.phillippitts.audiogen.config;

import com.phillippitts.audiogen.config.properties.PipelineProperties;
import com.phillippitts.audiogen.config.properties.ThreadPoolProperties;
import com.phillippitts.audiogen.util.LogContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool used when chunks are synthesized concurrently.
 *
 * <p>The pool is sized to {@code audiogen.pipeline.parallelism}, so it never runs more backend
 * calls at once than configured. With parallelism 1 the pool exists but stays idle: chunks
 * run on the caller thread.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final PipelineProperties pipelineProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties, PipelineProperties pipelineProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.pipelineProperties = pipelineProperties;
    }

    /**
     * Creates the bounded executor for chunk synthesis.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: the request's Log4j2 ThreadContext is copied to the worker thread so
     * chunk log lines carry the request id.
     *
     * @return configured executor for chunk synthesis
     */
    @Bean(name = "synthesisExecutor")
    public Executor synthesisExecutor() {
        int size = pipelineProperties.parallelism();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(threadPoolProperties.queueCapacity());
        executor.setThreadNamePrefix(threadPoolProperties.threadNamePrefix());
        executor.setKeepAliveSeconds(threadPoolProperties.keepAliveSeconds());
        executor.setAllowCoreThreadTimeOut(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(LogContext::propagating);
        executor.initialize();
        return executor;
    }
}
