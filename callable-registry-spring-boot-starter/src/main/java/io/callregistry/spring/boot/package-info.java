/**
 * Spring Boot auto-configuration for the callable registry.
 *
 * <p>{@link io.callregistry.spring.boot.CallableRegistryAutoConfiguration} creates a
 * {@link io.callregistry.CallableRegistry} bean from {@code callable-registry.*}
 * application properties. Implementations are registered through
 * {@link io.callregistry.spring.boot.RegistrationCustomizer} beans.
 *
 * @see io.callregistry.spring.boot.CallableRegistryAutoConfiguration
 * @see io.callregistry.spring.boot.CallableRegistryProperties
 */
package io.callregistry.spring.boot;
