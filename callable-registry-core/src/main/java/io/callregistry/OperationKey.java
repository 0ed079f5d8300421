package io.callregistry;

/**
 * Identifies one logical dispatchable operation.
 *
 * <p>Implementations can be enums for compile-time safety:
 * <pre>{@code
 * public enum Geometry implements OperationKey {
 *   AREA,
 *   PERIMETER
 *   // Enum.name() already satisfies the contract
 * }
 * }</pre>
 *
 * <p>Or use {@link StringOperationKey} for keys chosen at runtime:
 * <pre>{@code
 * OperationKey key = StringOperationKey.of("area");
 * }</pre>
 *
 * <p>Two keys with the same {@link #name()} address the same operation,
 * whatever their implementing class.
 */
public interface OperationKey {

    /**
     * Returns the name of this operation. Used as the registry key.
     *
     * @return the operation name, never null or empty
     */
    default String name() {
        return this.getClass().getName();
    }
}
