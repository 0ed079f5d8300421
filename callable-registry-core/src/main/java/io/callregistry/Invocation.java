package io.callregistry;

import io.callregistry.signature.Signature;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Call-time view handed to a {@link CallTarget}.
 *
 * <p>{@code options} holds the call-site options of
 * {@link CallableRegistry#dispatchWithOptions(String, Map, Object...)}. When the
 * registry binds metadata, the selected entry's registration metadata is merged
 * underneath, call-site options winning on conflicting names. Options with a
 * {@code null} value are dropped and read as absent.
 *
 * @param key       the dispatched operation
 * @param signature the signature of the selected entry
 * @param arguments the positional arguments
 * @param options   immutable options without null values, never null
 */
public record Invocation(OperationKey key, Signature signature, Arguments arguments,
                         Map<String, Object> options) {

    public Invocation {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(arguments, "arguments");
        options = Options.copyWithoutNulls(options);
    }

    public Object argument(int index) {
        return arguments.get(index);
    }

    public <T> T argument(int index, Class<T> type) {
        return arguments.get(index, type);
    }

    public Optional<Object> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    /**
     * Returns the option {@code name} cast to {@code type}, or {@code defaultValue} when absent.
     *
     * @throws ClassCastException if the option is present with an incompatible type
     */
    public <T> T option(String name, Class<T> type, T defaultValue) {
        Object value = options.get(name);
        return value == null ? defaultValue : type.cast(value);
    }
}
