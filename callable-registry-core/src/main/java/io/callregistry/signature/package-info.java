/**
 * Argument constraints and signatures.
 *
 * <p>A {@link io.callregistry.signature.Signature} is an ordered list of
 * {@link io.callregistry.signature.Constraint}s, one per positional argument.
 * Constraints are a closed set of tagged variants evaluated by the
 * {@linkplain io.callregistry.match.SignatureMatcher matcher}.
 */
package io.callregistry.signature;
