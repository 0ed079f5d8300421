package io.callregistry;

import io.callregistry.signature.Signature;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything bound together by one registration call: key, signature, target,
 * override flag and metadata.
 *
 * <pre>{@code
 * registry.register(Registration.<String>builder("getword")
 *     .signature(Signature.of(String.class))
 *     .target(inv -> inv.argument(0, String.class).split(" ")[inv.option("index", Integer.class, 0)])
 *     .metadata("index", 1)
 *     .build());
 * }</pre>
 *
 * @param key       the operation
 * @param signature the argument constraints
 * @param target    the implementation
 * @param override  whether an identical earlier signature is replaced instead of rejected
 * @param metadata  immutable registration metadata, never null
 * @param <R>       the result type
 */
public record Registration<R>(OperationKey key, Signature signature, CallTarget<R> target,
                              boolean override, Map<String, Object> metadata) {

    public Registration {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(target, "target");
        metadata = Options.copyWithoutNulls(metadata);
    }

    public static <R> Builder<R> builder(String key) {
        return new Builder<>(StringOperationKey.of(key));
    }

    public static <R> Builder<R> builder(OperationKey key) {
        return new Builder<>(Objects.requireNonNull(key, "key"));
    }

    public static final class Builder<R> {
        private final OperationKey key;
        private Signature signature;
        private CallTarget<R> target;
        private boolean override;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(OperationKey key) {
            this.key = key;
        }

        public Builder<R> signature(Signature signature) {
            this.signature = signature;
            return this;
        }

        public Builder<R> target(CallTarget<R> target) {
            this.target = target;
            return this;
        }

        /**
         * Replaces an active registration with an identical signature instead of
         * failing with {@link DuplicateRegistrationException}.
         */
        public Builder<R> override(boolean override) {
            this.override = override;
            return this;
        }

        /**
         * Adds one metadata value; a {@code null} value removes {@code name} instead.
         */
        public Builder<R> metadata(String name, Object value) {
            Objects.requireNonNull(name, "name");
            if (value == null) {
                metadata.remove(name);
            } else {
                metadata.put(name, value);
            }
            return this;
        }

        public Builder<R> metadata(Map<String, ?> values) {
            values.forEach(this::metadata);
            return this;
        }

        public Registration<R> build() {
            return new Registration<>(key, signature, target, override, metadata);
        }
    }
}
