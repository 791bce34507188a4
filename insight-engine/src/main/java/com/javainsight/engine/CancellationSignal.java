package com.javainsight.engine;

/**
 * Host-owned cancellation flag, polled between units of work. The engine never sets it.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancellationRequested();
}
