package com.eainde.policylens.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool that carries the submitting thread's MDC (trace id included) into each task.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads, String namePrefix) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.delegate = Executors.newFixedThreadPool(threads, factory);
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                // pool threads are reused
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        });
    }

    @Override
    public void close() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(30, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
