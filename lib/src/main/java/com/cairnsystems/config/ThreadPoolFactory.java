package com.cairnsystems.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for creating thread pools used in the actor system.
 * This class provides centralized creation and configuration for all thread pools used in the system,
 * making it easier to tune performance and resource usage.
 */
public class ThreadPoolFactory {
    private static final int DEFAULT_SCHEDULER_THREADS = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    private static final int DEFAULT_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final int DEFAULT_ACTOR_BATCH_SIZE = 10;

    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    private int schedulerShutdownTimeoutSeconds = DEFAULT_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS;
    private boolean useNamedThreads = true;
    private boolean daemonThreads = true;
    private int actorBatchSize = DEFAULT_ACTOR_BATCH_SIZE;

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates a scheduled executor service for delayed messages and timeouts.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new scheduled executor service
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        return Executors.newScheduledThreadPool(schedulerThreads, createThreadFactory(poolName + "-scheduler"));
    }

    /**
     * Creates a fixed-size executor service for blocking work such as storage I/O.
     *
     * @param poolName Name prefix for the threads in this pool
     * @param size     Number of threads in the pool
     * @return A new executor service
     */
    public ExecutorService createFixedExecutorService(String poolName, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Pool size must be positive, got " + size);
        }
        return Executors.newFixedThreadPool(size, createThreadFactory(poolName + "-worker"));
    }

    /**
     * Creates a thread factory for the given prefix, naming threads for easier identification in
     * logs and profilers.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory
     */
    public ThreadFactory createThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = useNamedThreads
                        ? new Thread(r, prefix + "-" + threadNumber.getAndIncrement())
                        : new Thread(r);
                t.setDaemon(daemonThreads);
                return t;
            }
        };
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
        return this;
    }

    public int getSchedulerShutdownTimeoutSeconds() {
        return schedulerShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setSchedulerShutdownTimeoutSeconds(int schedulerShutdownTimeoutSeconds) {
        this.schedulerShutdownTimeoutSeconds = schedulerShutdownTimeoutSeconds;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public int getActorBatchSize() {
        return actorBatchSize;
    }

    public ThreadPoolFactory setActorBatchSize(int actorBatchSize) {
        this.actorBatchSize = actorBatchSize;
        return this;
    }
}
