package net.jobsy.core.service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class Threads {
    private Threads() {}

    static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Returns false if tasks were still running after the timeout. */
    static boolean shutdown(ExecutorService es, long timeoutSeconds) {
        es.shutdown();
        try {
            if (es.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        es.shutdownNow();
        return false;
    }
}
