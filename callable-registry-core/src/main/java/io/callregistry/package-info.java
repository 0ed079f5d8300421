/**
 * Root API of callable-registry: several implementations bound to one operation
 * name, one of them chosen per call from the runtime types or values of the arguments.
 *
 * <h2>Core Design</h2>
 * <p>A caller registers {@link io.callregistry.CallTarget targets} under an
 * {@link io.callregistry.OperationKey operation key}, each with a
 * {@link io.callregistry.signature.Signature signature} of per-argument constraints.
 * A dispatch looks up the key's current snapshot in the
 * {@linkplain io.callregistry.registry.EntryRegistry entry registry}, lets the
 * {@linkplain io.callregistry.dispatch.Resolver resolver} pick the single most specific
 * applicable entry, and the {@linkplain io.callregistry.dispatch.Invoker invoker} runs it.
 *
 * <p>Specificity is compared position by position (exact type, then closest supertype,
 * then value predicate). Ties are configuration errors and raise
 * {@link io.callregistry.AmbiguousDispatchException}; there is no implicit
 * registration-order tie-break.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>callable-registry-core</b> - keys, signatures, matcher, resolver, registry (zero external deps)</li>
 *   <li><b>callable-registry-micrometer</b> - optional {@linkplain io.callregistry.micrometer Micrometer
 *       metrics bridge}</li>
 *   <li><b>callable-registry-spring-boot-starter</b> - Spring Boot
 *       {@linkplain io.callregistry.spring.boot auto-configuration}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * CallableRegistry<String> strings = CallableRegistry.<String>builder()
 *     .name("string")
 *     .bindMetadata(true)
 *     .build();
 *
 * strings.register("strip", Signature.of(String.class),
 *     inv -> inv.argument(0, String.class).strip());
 *
 * RegistrationHandle handle = strings.register(Registration.<String>builder("getword")
 *     .signature(Signature.of(String.class))
 *     .target(inv -> inv.argument(0, String.class).split(" ")[inv.option("index", Integer.class, 0)])
 *     .metadata("index", 1)
 *     .build());
 *
 * strings.dispatch("getword", "only way to be sure");   // "way"
 * handle.unregister();
 * }</pre>
 *
 * @see io.callregistry.CallableRegistry
 * @see io.callregistry.Registration
 * @see io.callregistry.signature.Signature
 */
package io.callregistry;
