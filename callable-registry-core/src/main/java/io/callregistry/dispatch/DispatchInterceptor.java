package io.callregistry.dispatch;

import io.callregistry.Invocation;
import io.callregistry.registry.RegistryEntry;

/**
 * Cross-cutting hook for observing dispatch, e.g. tracing which entry was chosen.
 *
 * <p>Interceptors run around target invocation:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Target execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>Interceptors observe only. An exception thrown by either hook is logged and
 * discarded; it never changes the result or the failure seen by the caller.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CallableRegistry.<Double>builder()
 *     .interceptor(DispatchInterceptor.before((entry, inv) ->
 *         audit.log(entry.key(), entry.signature())))
 *     .interceptor(DispatchInterceptor.after((entry, inv, error) -> {
 *         if (error != null) alerts.notify(entry.key());
 *     }))
 *     .build();
 * }</pre>
 */
public interface DispatchInterceptor {

    /**
     * Called after resolution, before the selected target runs.
     *
     * @param entry      the selected entry
     * @param invocation the call about to be made
     */
    default void beforeDispatch(RegistryEntry<?> entry, Invocation invocation) {
    }

    /**
     * Called after the target returned or threw.
     *
     * @param entry      the selected entry
     * @param invocation the call that was made
     * @param error      null on success, whatever the target threw on failure
     */
    default void afterDispatch(RegistryEntry<?> entry, Invocation invocation, Throwable error) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static DispatchInterceptor before(BeforeHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void beforeDispatch(RegistryEntry<?> entry, Invocation invocation) {
                hook.accept(entry, invocation);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static DispatchInterceptor after(AfterHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void afterDispatch(RegistryEntry<?> entry, Invocation invocation, Throwable error) {
                hook.accept(entry, invocation, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(RegistryEntry<?> entry, Invocation invocation);
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(RegistryEntry<?> entry, Invocation invocation, Throwable error);
    }
}
