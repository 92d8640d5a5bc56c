package com.phillippitts.graphicrecorder.config;

import com.phillippitts.graphicrecorder.config.logging.ConnectionMdc;
import com.phillippitts.graphicrecorder.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind connection handling, provider calls and
 * persistence writes, plus the scheduler used for reconnect and analysis timers.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties}.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Shared pool under every connection's {@code SerialExecutor}.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and
     * queue are full the WebSocket container thread runs the task itself, which throttles
     * the reading of further frames instead of dropping them.
     */
    @Bean(name = "connectionExecutor")
    public Executor connectionExecutor() {
        return newExecutor(threadPoolProperties.getConnection());
    }

    /**
     * Pool for transcription, analysis, image and meta-summary provider calls.
     */
    @Bean(name = "providerExecutor")
    public Executor providerExecutor() {
        return newExecutor(threadPoolProperties.getProvider());
    }

    /**
     * Pool for persistence writes and media loads. Writes are further serialized by
     * {@code PersistenceWriter}.
     */
    @Bean(name = "persistenceExecutor")
    public Executor persistenceExecutor() {
        return newExecutor(threadPoolProperties.getPersistence());
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.Pool pool) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(pool.getThreadNamePrefix());
        executor.setKeepAliveSeconds(pool.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread
     * so connection and meeting ids survive the hop. Scheduled timers get the same through
     * {@code TaskSchedulerTimers}.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return ConnectionMdc::propagating;
    }
}
