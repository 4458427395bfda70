package com.eainde.admission.thread;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool that carries the submitting thread's MDC into each task.
 */
public class MdcAwareExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(MdcAwareExecutor.class);

    private final ExecutorService delegate;
    private final Duration shutdownTimeout;

    public MdcAwareExecutor(int threads, String namePrefix, Duration shutdownTimeout) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        this.delegate = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), namedThreads(namePrefix));
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    /**
     * Stops accepting work and waits for running tasks up to the shutdown timeout.
     */
    public void shutdown() {
        if (delegate.isShutdown()) {
            return;
        }
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still busy after {}, interrupting", shutdownTimeout);
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            delegate.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
