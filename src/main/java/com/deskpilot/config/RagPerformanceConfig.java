package com.deskpilot.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for query retrieval, remote model calls and batch ingestion.
 *
 * <p>Model calls run on their own pool, separate from the retrieval tasks that wait on them.
 * Rejected tasks are logged and fail with {@link RejectedExecutionException}.</p>
 */
@Configuration
public class RagPerformanceConfig {

    private static final Logger log = LoggerFactory.getLogger(RagPerformanceConfig.class);

    @Bean(name = {"ragExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor ragExecutor(
            @Value("${deskpilot.performance.rag-core-threads:4}") int coreThreads,
            @Value("${deskpilot.performance.rag-max-threads:8}") int maxThreads,
            @Value("${deskpilot.performance.rag-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("rag-exec-", coreThreads, maxThreads, queueCapacity);
    }

    @Bean(name = {"modelExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor modelExecutor(
            @Value("${deskpilot.performance.model-threads:8}") int threads,
            @Value("${deskpilot.performance.model-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("model-exec-", threads, threads, queueCapacity);
    }

    @Bean(name = {"ingestExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor ingestExecutor(
            @Value("${deskpilot.performance.ingest-threads:2}") int threads) {
        return this.buildExecutor("ingest-exec-", threads, threads, Math.max(50, threads * 10));
    }

    ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadFactory threadFactory = new NamedThreadFactory(prefix);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), threadFactory, new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    /**
     * Logs overload and throws {@link RejectedExecutionException}; callers degrade the
     * affected work instead of queueing it on their own thread.
     */
    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}', queue full: active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(),
                    executor.getQueue().size(), count);
            throw new RejectedExecutionException(
                    "Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
