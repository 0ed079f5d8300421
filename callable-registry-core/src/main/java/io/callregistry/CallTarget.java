package io.callregistry;

/**
 * One concrete implementation of a dispatchable operation.
 *
 * <p>Targets are bound to a key and a {@link io.callregistry.signature.Signature}
 * at registration time and invoked with the arguments of the dispatch call
 * that selected them.
 *
 * <h2>Error Handling</h2>
 * <p>Whatever the target throws reaches the caller of
 * {@link CallableRegistry#dispatch(String, Object...)} unchanged: the registry
 * never wraps, retries or substitutes another target.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CallTarget<Double> areaOfCircle = inv -> {
 *   Circle c = inv.argument(0, Circle.class);
 *   return Math.PI * c.radius() * c.radius();
 * };
 * }</pre>
 *
 * @param <R> the result type
 * @see CallableRegistry
 */
@FunctionalInterface
public interface CallTarget<R> {

    /**
     * Executes this implementation.
     *
     * @param invocation the arguments and options of the current call
     * @return the result handed back to the dispatch caller
     * @throws Exception any failure; propagated to the caller as is
     */
    R call(Invocation invocation) throws Exception;
}
