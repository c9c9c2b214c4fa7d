package com.positionkeeper.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for async event listeners, bounded exchange calls and protective order placement.
 *
 * <p>A protective placement task blocks on an exchange call that runs on {@code exchangeExecutor},
 * so the two must stay separate pools. The exchange pool aborts when saturated: running a remote
 * call on the caller's thread would escape the call timeout.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${positionkeeper.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${positionkeeper.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${positionkeeper.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return executor("event-", corePoolSize, maxPoolSize, queueCapacity, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean("exchangeExecutor")
    public ThreadPoolTaskExecutor exchangeExecutor() {
        return executor("exchange-", corePoolSize, maxPoolSize, queueCapacity, new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean("protectionExecutor")
    public ThreadPoolTaskExecutor protectionExecutor() {
        // One batch places three orders at a time
        return executor(
                "protection-", 3, Math.max(3, maxPoolSize), queueCapacity, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }

    private ThreadPoolTaskExecutor executor(
            String prefix, int core, int max, int queue, RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
