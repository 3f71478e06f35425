package com.phillippitts.voicegate.config;

import com.phillippitts.voicegate.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used off the request thread.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on database pool size and traffic.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for admission checks that must finish within a deadline.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A saturated pool rejects the
     * submission and the caller denies admission instead of running storage work on the request thread.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request correlation IDs in async logs.
     *
     * @return Configured executor for storage work
     */
    @Bean(name = "storageExecutor")
    public Executor storageExecutor() {
        return build(threadPoolProperties.getStorage(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for size-triggered conversation flushes.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.DiscardPolicy}. Dropping a flush trigger loses
     * nothing because queued turns stay queued until the next timer tick.
     *
     * @return Configured executor for batch writes
     */
    @Bean(name = "flushExecutor")
    public Executor flushExecutor() {
        return build(threadPoolProperties.getFlush(), new ThreadPoolExecutor.DiscardPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        // Propagate MDC to worker threads
        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        });

        executor.initialize();
        return executor;
    }
}
