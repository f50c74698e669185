package com.example.nfse.retrieval.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RetrievalExecutorConfiguration {

    /**
     * One worker per concurrent browser. The FIFO queue is bounded; a full
     * queue rejects the submission instead of growing.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService retrievalExecutor(AutomationProperties properties) {
        int workers = properties.workerCount();
        int capacity = Math.max(1, properties.getQueueCapacity());
        log.info("Creating retrieval executor workers={} queueCapacity={}", workers, capacity);
        return new ThreadPoolExecutor(
                workers,
                workers,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity),
                namedThreads("retrieval-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
