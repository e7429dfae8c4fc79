package com.example.waterrights.infrastructure.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool parsing reports in parallel. Each task handles one whole report.
 */
public final class ParserExecutors implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParserExecutors.class);

    private final ExecutorService reportPool;

    private ParserExecutors(ExecutorService reportPool) {
        this.reportPool = reportPool;
    }

    public static ParserExecutors create(int threads) {
        ThreadFactory reportTf = new ThreadFactory() {
            private final AtomicInteger n = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "report-worker-" + n.getAndIncrement());
                t.setDaemon(false);
                return t;
            }
        };
        return new ParserExecutors(Executors.newFixedThreadPool(Math.max(1, threads), reportTf));
    }

    public ExecutorService reportPool() {
        return reportPool;
    }

    @Override
    public void close() {
        reportPool.shutdown();
        try {
            if (!reportPool.awaitTermination(1, TimeUnit.MINUTES)) {
                reportPool.shutdownNow();
                if (!reportPool.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Report pool did not terminate");
                }
            }
        } catch (InterruptedException e) {
            reportPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
