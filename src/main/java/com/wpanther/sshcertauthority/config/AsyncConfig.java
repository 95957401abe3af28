package com.wpanther.sshcertauthority.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the signing worker pool and the shared randomness and clock sources
 */
@Configuration
public class AsyncConfig {

    @Value("${app.async.core-pool-size:5}")
    private int corePoolSize;

    @Value("${app.async.max-pool-size:10}")
    private int maxPoolSize;

    @Value("${app.async.queue-capacity:100}")
    private int queueCapacity;

    @Value("${app.async.thread-name-prefix:async-signing-}")
    private String threadNamePrefix;

    /**
     * Creates the thread pool that runs calls to the signing backend, so that a
     * request can stop waiting on a backend that does not answer
     *
     * @return configured executor for signing tasks
     */
    @Bean(name = "asyncSigningExecutor")
    @Primary
    public ThreadPoolTaskExecutor asyncSigningExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // A saturated pool rejects the task; backend calls never run on the request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.initialize();
        return executor;
    }

    /**
     * Provides a SecureRandom bean for nonces and serial numbers
     *
     * @return a new SecureRandom instance
     */
    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
