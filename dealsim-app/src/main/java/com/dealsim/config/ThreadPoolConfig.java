package com.dealsim.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools.
 * <ul>
 *   <li>commonThreadPoolExecutor: evaluation hook calls</li>
 *   <li>simulationDrainWorker: one thread per draining queue, blocked on the engine most of the time</li>
 * </ul>
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "commonThreadPoolExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "commonThreadPoolExecutor")
    public ThreadPoolExecutor threadPoolExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        return new ThreadPoolExecutor(
                coreSize,
                Math.max(properties.getMaxPoolSize(), coreSize),
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                namedThreadFactory("evaluation-worker-", true),
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    /**
     * Queue capacity 0 hands a drain loop straight to a thread; when every thread is busy the
     * loop is rejected and the next tick tries again.
     */
    @Bean(name = "simulationDrainWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "simulationDrainWorker")
    public ThreadPoolExecutor simulationDrainWorker(
            @Value("${executor.drain.core-size:4}") int coreSize,
            @Value("${executor.drain.max-size:32}") int maxSize,
            @Value("${executor.drain.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.drain.queue-capacity:0}") int queueCapacity,
            @Value("${executor.drain.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.drain.thread-name-prefix:queue-drain-}") String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                namedThreadFactory(threadNamePrefix, false),
                buildRejectedExecutionHandler(rejectionPolicy));
        executor.allowCoreThreadTimeOut(false);
        return executor;
    }

    private ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
        AtomicInteger threadIndex = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + threadIndex.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
