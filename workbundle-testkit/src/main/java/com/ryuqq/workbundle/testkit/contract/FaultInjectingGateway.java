package com.ryuqq.workbundle.testkit.contract;

import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RemoteStoreGateway} decorator that injects failures and hooks in front of a real gateway.
 *
 * <p>Queued failures are consumed one per call, in order. Hooks run once, right before
 * the delegate is invoked, which lets a test mutate the remote store between the engine's
 * read and write (e.g. a peer creating the same bundle).</p>
 *
 * <pre>
 * FaultInjectingGateway faulty = new FaultInjectingGateway(gateway);
 * faulty.failNext(Operation.GET, new RemoteStoreException("connection reset"));
 * </pre>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class FaultInjectingGateway implements RemoteStoreGateway {

    /**
     * Gateway operations that can be intercepted.
     */
    public enum Operation {
        GET, CREATE, UPDATE, DELETE
    }

    private final RemoteStoreGateway delegate;
    private final Map<Operation, Queue<RuntimeException>> failures = new ConcurrentHashMap<>();
    private final Map<Operation, Queue<Runnable>> hooks = new ConcurrentHashMap<>();
    private final Map<Operation, AtomicInteger> calls = new ConcurrentHashMap<>();

    public FaultInjectingGateway(RemoteStoreGateway delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * Makes the next call of the given operation throw {@code failure} instead of reaching the delegate.
     *
     * @param operation operation to intercept
     * @param failure exception to throw
     * @return this gateway
     */
    public FaultInjectingGateway failNext(Operation operation, RuntimeException failure) {
        if (operation == null || failure == null) {
            throw new IllegalArgumentException("operation and failure cannot be null");
        }
        failures.computeIfAbsent(operation, op -> new ConcurrentLinkedQueue<>()).add(failure);
        return this;
    }

    /**
     * Runs {@code hook} once before the next call of the given operation reaches the delegate.
     *
     * @param operation operation to intercept
     * @param hook action to run
     * @return this gateway
     */
    public FaultInjectingGateway beforeNext(Operation operation, Runnable hook) {
        if (operation == null || hook == null) {
            throw new IllegalArgumentException("operation and hook cannot be null");
        }
        hooks.computeIfAbsent(operation, op -> new ConcurrentLinkedQueue<>()).add(hook);
        return this;
    }

    /**
     * Number of calls received for the given operation, including failed ones.
     *
     * @param operation operation
     * @return call count
     */
    public int callCount(Operation operation) {
        AtomicInteger count = calls.get(operation);
        return count == null ? 0 : count.get();
    }

    /**
     * Drops all pending failures and hooks and resets the call counters.
     */
    public void reset() {
        failures.clear();
        hooks.clear();
        calls.clear();
    }

    @Override
    public WorkBundle get(OperationContext ctx, BundleKey key) {
        intercept(Operation.GET);
        return delegate.get(ctx, key);
    }

    @Override
    public WorkBundle create(OperationContext ctx, WorkBundle bundle) {
        intercept(Operation.CREATE);
        return delegate.create(ctx, bundle);
    }

    @Override
    public WorkBundle update(OperationContext ctx, WorkBundle bundle) {
        intercept(Operation.UPDATE);
        return delegate.update(ctx, bundle);
    }

    @Override
    public void delete(OperationContext ctx, BundleKey key) {
        intercept(Operation.DELETE);
        delegate.delete(ctx, key);
    }

    private void intercept(Operation operation) {
        calls.computeIfAbsent(operation, op -> new AtomicInteger()).incrementAndGet();

        RuntimeException failure = poll(failures, operation);
        if (failure != null) {
            throw failure;
        }
        Runnable hook = poll(hooks, operation);
        if (hook != null) {
            hook.run();
        }
    }

    private static <T> T poll(Map<Operation, Queue<T>> queues, Operation operation) {
        Queue<T> queue = queues.get(operation);
        return queue == null ? null : queue.poll();
    }
}
