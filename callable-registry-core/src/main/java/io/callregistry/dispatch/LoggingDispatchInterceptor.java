package io.callregistry.dispatch;

import io.callregistry.Invocation;
import io.callregistry.registry.RegistryEntry;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Traces every dispatch: which entry was chosen for which argument types, and
 * whether its target failed. Argument values are never logged.
 */
public final class LoggingDispatchInterceptor implements DispatchInterceptor {
    private static final Logger logger = Logger.getLogger(LoggingDispatchInterceptor.class.getName());

    private final Level level;

    public LoggingDispatchInterceptor() {
        this(Level.FINE);
    }

    public LoggingDispatchInterceptor(Level level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    @Override
    public void beforeDispatch(RegistryEntry<?> entry, Invocation invocation) {
        if (logger.isLoggable(level)) {
            logger.log(level, "Dispatching {0} to {1}", new Object[]{invocation.arguments(), entry});
        }
    }

    @Override
    public void afterDispatch(RegistryEntry<?> entry, Invocation invocation, Throwable error) {
        if (error != null && logger.isLoggable(level)) {
            logger.log(level, "Target {0} failed: {1}", new Object[]{entry, error});
        }
    }
}
