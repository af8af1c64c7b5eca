package net.jobsy.core.spi;

import java.util.concurrent.Callable;

/**
 * Unit-of-work boundary for repository calls. {@code required} joins a unit already open on the
 * current thread, {@code requiresNew} always opens its own and commits it before returning.
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
}
