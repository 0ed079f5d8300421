package io.callregistry;

import io.callregistry.signature.Signature;

import java.util.Map;

/**
 * Introspection view of one active registration. Sequence numbers are not exposed.
 *
 * @param signature the argument constraints
 * @param metadata  the registration metadata
 * @param override  whether the registration requested override
 */
public record RegistrationInfo(Signature signature, Map<String, Object> metadata, boolean override) {
}
