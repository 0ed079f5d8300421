/**
 * Resolution and invocation.
 *
 * <p>{@link io.callregistry.dispatch.Resolver} picks the unique most specific entry,
 * {@link io.callregistry.dispatch.Invoker} runs it, and
 * {@link io.callregistry.dispatch.DispatchInterceptor}s observe the call.
 */
package io.callregistry.dispatch;
