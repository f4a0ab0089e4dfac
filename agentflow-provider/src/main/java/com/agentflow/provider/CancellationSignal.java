package com.agentflow.provider;

/**
 * Read side of an execution's cancellation flag.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();
}
