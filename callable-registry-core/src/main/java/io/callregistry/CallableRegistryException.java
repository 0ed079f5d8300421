package io.callregistry;

/**
 * Base type of every error raised by the registry itself.
 *
 * <p>Failures thrown by a {@link CallTarget} are never wrapped in this type;
 * they reach the caller unchanged.
 */
public class CallableRegistryException extends RuntimeException {

    public CallableRegistryException(String message) {
        super(message);
    }
}
