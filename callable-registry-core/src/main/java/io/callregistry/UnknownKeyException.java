package io.callregistry;

/**
 * Thrown when dispatch, lookup or introspection addresses a key that has
 * never had a registration.
 *
 * <p>A key whose entries were all unregistered is still known; lookups on it
 * return an empty list and dispatch fails with {@link NoMatchException}.
 */
public final class UnknownKeyException extends CallableRegistryException {

    private final String key;

    public UnknownKeyException(String key) {
        super("Unknown operation key: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
