package io.callregistry.spring.boot;

import io.callregistry.CallableRegistry;

/**
 * Callback that registers implementations on the auto-configured {@link CallableRegistry}.
 *
 * <p>Every customizer bean is applied once, in {@link org.springframework.core.annotation.Order @Order}
 * sequence, before the registry bean is handed to other beans.
 *
 * <pre>{@code
 * @Bean
 * RegistrationCustomizer shapes() {
 *     return registry -> {
 *         registry.register("area", Signature.of(Circle.class), inv -> ...);
 *         registry.register("area", Signature.of(Shape.class), inv -> ...);
 *     };
 * }
 * }</pre>
 */
@FunctionalInterface
public interface RegistrationCustomizer {

    void customize(CallableRegistry<Object> registry);
}
