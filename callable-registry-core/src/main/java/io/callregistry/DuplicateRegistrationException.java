package io.callregistry;

import io.callregistry.signature.Signature;

/**
 * Thrown when a signature is registered a second time under the same key
 * without requesting override.
 */
public final class DuplicateRegistrationException extends CallableRegistryException {

    private final String key;
    private final Signature signature;

    public DuplicateRegistrationException(String key, Signature signature) {
        super("Signature " + signature + " is already registered under '" + key
                + "'. HINT: register with override=true to replace it.");
        this.key = key;
        this.signature = signature;
    }

    public String key() {
        return key;
    }

    public Signature signature() {
        return signature;
    }
}
