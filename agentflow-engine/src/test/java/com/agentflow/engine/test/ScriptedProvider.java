package com.agentflow.engine.test;

import com.agentflow.provider.CapabilityProvider;
import com.agentflow.provider.ProviderException;
import com.agentflow.provider.ProviderRequest;
import com.agentflow.provider.ProviderResult;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Capability provider with per-step scripted behavior for scheduler tests.
 * Unscripted steps succeed with output "{stepId}-done" and {@link #DEFAULT_TOKENS} tokens.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ScriptedProvider provider = new ScriptedProvider()
 *     .failTimes("fetch", 2)         // two transient failures, then success
 *     .alwaysFail("publish")
 *     .blockUntil("review", latch);
 * }</pre>
 */
public class ScriptedProvider implements CapabilityProvider {

    public static final long DEFAULT_TOKENS = 10;

    @FunctionalInterface
    public interface Behavior {
        ProviderResult apply(ProviderRequest request, int invocation) throws Exception;
    }

    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final List<String> startOrder = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    public ScriptedProvider on(String stepId, Behavior behavior) {
        behaviors.put(stepId, behavior);
        return this;
    }

    public ScriptedProvider succeed(String stepId, long tokens) {
        return on(stepId, (r, n) -> ProviderResult.of(TextNode.valueOf(stepId + "-done"), tokens));
    }

    /**
     * Fail the first {@code failures} invocations with a retryable error, then succeed.
     */
    public ScriptedProvider failTimes(String stepId, int failures) {
        return on(stepId, (r, n) -> {
            if (n <= failures) {
                throw ProviderException.retryable("TRANSIENT", stepId + " failure " + n);
            }
            return ProviderResult.of(TextNode.valueOf(stepId + "-done"), DEFAULT_TOKENS);
        });
    }

    public ScriptedProvider alwaysFail(String stepId) {
        return on(stepId, (r, n) -> {
            throw ProviderException.retryable("TRANSIENT", stepId + " failure " + n);
        });
    }

    public ScriptedProvider failPermanently(String stepId) {
        return on(stepId, (r, n) -> {
            throw ProviderException.permanent("BAD_REQUEST", stepId + " rejected");
        });
    }

    public ScriptedProvider blockUntil(String stepId, CountDownLatch latch) {
        return on(stepId, (r, n) -> {
            latch.await();
            return ProviderResult.of(TextNode.valueOf(stepId + "-done"), DEFAULT_TOKENS);
        });
    }

    /**
     * Succeed only once every party of the barrier has arrived, proving the steps overlap.
     */
    public ScriptedProvider meetAt(String stepId, CyclicBarrier barrier) {
        return on(stepId, (r, n) -> {
            barrier.await(5, TimeUnit.SECONDS);
            return ProviderResult.of(TextNode.valueOf(stepId + "-done"), DEFAULT_TOKENS);
        });
    }

    public ScriptedProvider sleep(String stepId, long millis) {
        return on(stepId, (r, n) -> {
            Thread.sleep(millis);
            return ProviderResult.of(TextNode.valueOf(stepId + "-done"), DEFAULT_TOKENS);
        });
    }

    @Override
    public ProviderResult invoke(ProviderRequest request) throws ProviderException {
        String stepId = request.stepId();
        int n = invocations.computeIfAbsent(stepId, k -> new AtomicInteger()).incrementAndGet();
        startOrder.add(stepId);
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            Behavior behavior = behaviors.get(stepId);
            if (behavior == null) {
                return ProviderResult.of(TextNode.valueOf(stepId + "-done"), DEFAULT_TOKENS);
            }
            return behavior.apply(request, n);
        } catch (ProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.retryable("INTERRUPTED", stepId + " interrupted");
        } catch (Exception e) {
            throw new ProviderException("SCRIPT_ERROR", e.toString(), e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public int invocations(String stepId) {
        AtomicInteger count = invocations.get(stepId);
        return count == null ? 0 : count.get();
    }

    public List<String> startOrder() {
        synchronized (startOrder) {
            return List.copyOf(startOrder);
        }
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    public int inFlight() {
        return inFlight.get();
    }
}
