package io.callregistry.dispatch;

import io.callregistry.Invocation;
import io.callregistry.registry.RegistryEntry;
import io.callregistry.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the target of a resolved entry.
 *
 * <p>The target's result is returned unchanged and its exception is rethrown
 * unchanged, {@link Error}s included. There is no retry, timeout or suppression; callers needing bounded
 * latency must wrap the dispatch call themselves. Interceptors and metrics only
 * observe the call.
 */
public final class Invoker {
    private static final Logger logger = Logger.getLogger(Invoker.class.getName());

    private final List<DispatchInterceptor> interceptors;
    private final MetricsExporter metrics;

    public Invoker() {
        this(List.of(), MetricsExporter.NOOP);
    }

    public Invoker(List<DispatchInterceptor> interceptors, MetricsExporter metrics) {
        this.interceptors = Collections.unmodifiableList(new ArrayList<>(interceptors));
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Calls {@code entry}'s target.
     *
     * @param entry      the resolved entry
     * @param invocation the call
     * @return whatever the target returned
     * @throws Exception whatever the target threw
     */
    public <R> R invoke(RegistryEntry<R> entry, Invocation invocation) throws Exception {
        runBeforeDispatch(entry, invocation);
        long start = System.nanoTime();
        Throwable failure = null;
        try {
            return entry.target().call(invocation);
        } catch (Exception | Error e) {
            failure = e;
            throw e;
        } finally {
            metrics.recordTargetDurationNanos(System.nanoTime() - start);
            if (failure == null) {
                metrics.incrementDispatchSuccess();
            } else {
                metrics.incrementDispatchFailure();
            }
            runAfterDispatch(entry, invocation, failure);
        }
    }

    private void runBeforeDispatch(RegistryEntry<?> entry, Invocation invocation) {
        for (DispatchInterceptor interceptor : interceptors) {
            try {
                interceptor.beforeDispatch(entry, invocation);
            } catch (RuntimeException ex) {
                logger.log(Level.WARNING, "Interceptor beforeDispatch failed", ex);
            }
        }
    }

    private void runAfterDispatch(RegistryEntry<?> entry, Invocation invocation, Throwable error) {
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            try {
                interceptors.get(i).afterDispatch(entry, invocation, error);
            } catch (RuntimeException ex) {
                logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
            }
        }
    }
}
