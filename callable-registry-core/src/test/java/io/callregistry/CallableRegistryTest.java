package io.callregistry;

import io.callregistry.Shapes.Circle;
import io.callregistry.Shapes.Shape;
import io.callregistry.Shapes.Square;
import io.callregistry.dispatch.DispatchInterceptor;
import io.callregistry.registry.DefaultEntryRegistry;
import io.callregistry.registry.EntryRegistry;
import io.callregistry.registry.RegistrationHandle;
import io.callregistry.registry.RegistryEntry;
import io.callregistry.signature.Signature;
import io.callregistry.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallableRegistryTest {

    enum Geometry implements OperationKey {
        PERIMETER
    }

    private final CallableRegistry<Object> registry = CallableRegistry.builder().name("test").build();

    private CallableRegistry<Object> areaRegistry() {
        CallableRegistry<Object> shapes = CallableRegistry.builder().name("shapes").build();
        shapes.register("area", Signature.of(Circle.class),
                inv -> "area_circle:" + Math.PI * Math.pow(inv.argument(0, Circle.class).radius(), 2));
        shapes.register("area", Signature.of(Shape.class),
                inv -> "area_generic:" + inv.argument(0, Shape.class).boundingBoxArea());
        return shapes;
    }

    @Test
    void areaScenario() throws Exception {
        CallableRegistry<Object> shapes = areaRegistry();

        assertEquals("area_circle:" + Math.PI * 4, shapes.dispatch("area", new Circle(2)));
        assertEquals("area_generic:9.0", shapes.dispatch("area", new Square(3)));
        assertThrows(NoMatchException.class, () -> shapes.dispatch("area", 42));
    }

    @Test
    void singleApplicableRegistrationIsDispatched() throws Exception {
        registry.register("greet", Signature.of(String.class), inv -> "hello " + inv.argument(0));

        assertEquals("hello bob", registry.dispatch("greet", "bob"));
    }

    @Test
    void moreSpecificRegistrationAddedLaterIsSelected() throws Exception {
        registry.register("area", Signature.of(Shape.class), inv -> "generic");
        assertEquals("generic", registry.dispatch("area", new Circle(1)));

        registry.register("area", Signature.of(Circle.class), inv -> "circle");
        assertEquals("circle", registry.dispatch("area", new Circle(1)));
    }

    @Test
    void unknownKeyIsDistinctFromNoMatch() {
        assertThrows(UnknownKeyException.class, () -> registry.dispatch("nothing", 1));

        RegistrationHandle handle = registry.register("something", Signature.of(String.class), inv -> "s");
        handle.unregister();

        assertThrows(NoMatchException.class, () -> registry.dispatch("something", "x"));
    }

    @Test
    void duplicateRegistrationIsRejectedUnlessOverridden() throws Exception {
        registry.register("area", Signature.of(Circle.class), inv -> "first");

        assertThrows(DuplicateRegistrationException.class,
                () -> registry.register("area", Signature.of(Circle.class), inv -> "second"));
        assertEquals("first", registry.dispatch("area", new Circle(1)));

        registry.register("area", Signature.of(Circle.class), inv -> "second", true);
        assertEquals("second", registry.dispatch("area", new Circle(1)));
        assertEquals(1, registry.signatures("area").size());
    }

    @Test
    void tiedRegistrationsRaiseAmbiguity() {
        registry.register("label", Signature.of(Shapes.Named.class), inv -> "named");
        registry.register("label", Signature.of(Shape.class), inv -> "shape");

        AmbiguousDispatchException e = assertThrows(AmbiguousDispatchException.class,
                () -> registry.dispatch("label", new Square(1)));

        assertEquals(List.of(Signature.of(Shapes.Named.class), Signature.of(Shape.class)), e.tiedSignatures());
    }

    @Test
    void unregisterFallsThroughToNextMostSpecific() throws Exception {
        registry.register("area", Signature.of(Shape.class), inv -> "generic");
        RegistrationHandle circle = registry.register("area", Signature.of(Circle.class), inv -> "circle");

        assertTrue(registry.unregister(circle));
        assertEquals("generic", registry.dispatch("area", new Circle(1)));
        assertFalse(registry.unregister(circle));
    }

    @Test
    void unregisterOfLastMatchLeavesNoMatch() {
        RegistrationHandle only = registry.register("area", Signature.of(Circle.class), inv -> "circle");
        only.unregister();

        assertThrows(NoMatchException.class, () -> registry.dispatch("area", new Circle(1)));
    }

    @Test
    void targetExceptionsPassThroughUnwrapped() {
        IOException failure = new IOException("io");
        UncheckedIOException unchecked = new UncheckedIOException(failure);
        registry.register("checked", Signature.empty(), inv -> {
            throw failure;
        });
        registry.register("unchecked", Signature.empty(), inv -> {
            throw unchecked;
        });

        assertSame(failure, assertThrows(IOException.class, () -> registry.dispatch("checked")));
        assertSame(unchecked, assertThrows(UncheckedIOException.class, () -> registry.dispatch("unchecked")));
    }

    @Test
    void nullResultsAreReturned() throws Exception {
        registry.register("nothing", Signature.empty(), inv -> null);

        assertEquals(null, registry.dispatch("nothing"));
    }

    @Test
    void operationKeysAndStringsAddressTheSameOperation() throws Exception {
        registry.register(Geometry.PERIMETER, Signature.of(Square.class), inv -> "perimeter");

        assertEquals("perimeter", registry.dispatch("PERIMETER", new Square(1)));
        assertEquals("perimeter", registry.dispatch(Geometry.PERIMETER, new Square(1)));
        assertTrue(registry.contains(Geometry.PERIMETER));
        assertEquals(List.of(Signature.of(Square.class)), registry.signatures(Geometry.PERIMETER));
    }

    @Test
    void invocationCarriesKeyAndSignature() throws Exception {
        registry.register(Geometry.PERIMETER, Signature.of(Square.class),
                inv -> inv.key().name() + inv.signature());

        assertEquals("PERIMETER(Square)", registry.dispatch(Geometry.PERIMETER, new Square(1)));
    }

    @Test
    void signaturesListsRegistrationOrderAndFailsOnUnknownKey() {
        registry.register("area", Signature.of(Shape.class), inv -> "g");
        registry.register("area", Signature.of(Circle.class), inv -> "c");

        assertEquals(List.of(Signature.of(Shape.class), Signature.of(Circle.class)), registry.signatures("area"));
        assertThrows(UnknownKeyException.class, () -> registry.signatures("missing"));
    }

    @Test
    void describeExposesMetadata() {
        registry.register(Registration.builder("getword")
                .signature(Signature.of(String.class))
                .target(inv -> "w")
                .metadata("index", 1)
                .build());

        List<RegistrationInfo> infos = registry.describe("getword");

        assertEquals(1, infos.size());
        assertEquals(Map.of("index", 1), infos.get(0).metadata());
        assertFalse(infos.get(0).override());
    }

    @Test
    void callSiteOptionsReachTheTarget() throws Exception {
        registry.register("getword", Signature.of(String.class),
                inv -> inv.argument(0, String.class).split(" ")[inv.option("index", Integer.class, 0)]);

        assertEquals("only", registry.dispatch("getword", "only way to be sure"));
        assertEquals("way", registry.dispatchWithOptions("getword", Map.of("index", 1), "only way to be sure"));
    }

    @Test
    void nullValuedOptionsAreTreatedAsAbsent() throws Exception {
        registry.register("getword", Signature.of(String.class),
                inv -> inv.argument(0, String.class).split(" ")[inv.option("index", Integer.class, 0)]);
        Map<String, Object> options = new HashMap<>();
        options.put("index", null);

        assertEquals("only", registry.dispatchWithOptions("getword", options, "only way"));
    }

    @Test
    void nullValuedOptionsLeaveBoundMetadataVisible() throws Exception {
        CallableRegistry<String> bound = CallableRegistry.<String>builder().bindMetadata(true).build();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("index", 1);
        metadata.put("unused", null);
        bound.register(Registration.<String>builder("getword")
                .signature(Signature.of(String.class))
                .target(inv -> inv.argument(0, String.class).split(" ")[inv.option("index", Integer.class, 0)])
                .metadata(metadata)
                .build());
        Map<String, Object> options = new HashMap<>();
        options.put("index", null);

        assertEquals("way", bound.dispatchWithOptions("getword", options, "only way"));
        assertEquals(Map.of("index", 1), bound.describe("getword").get(0).metadata());
    }

    @Test
    void metadataIsBoundOnlyWhenRequested() throws Exception {
        CallableRegistry<String> bound = CallableRegistry.<String>builder().bindMetadata(true).build();
        CallableRegistry<String> unbound = CallableRegistry.<String>builder().build();
        for (CallableRegistry<String> r : List.of(bound, unbound)) {
            r.register(Registration.<String>builder("getword")
                    .signature(Signature.of(String.class))
                    .target(inv -> inv.argument(0, String.class).split(" ")[inv.option("index", Integer.class, 0)])
                    .metadata("index", 1)
                    .build());
        }

        assertEquals("way", bound.dispatch("getword", "only way to be sure"));
        assertEquals("only", unbound.dispatch("getword", "only way to be sure"));
        // call-site options win over bound metadata
        assertEquals("to", bound.dispatchWithOptions("getword", Map.of("index", 2), "only way to be sure"));
    }

    @Test
    void availableKeysAreSortedAndSkipEmptiedKeys() {
        registry.register("strip", Signature.of(String.class), inv -> "");
        registry.register("getword-1", Signature.of(String.class), inv -> "");
        RegistrationHandle gone = registry.register("getword-0", Signature.of(String.class), inv -> "");
        gone.unregister();

        assertEquals(List.of("getword-1", "strip"), registry.availableKeys());
        assertFalse(registry.contains("getword-0"));
        assertFalse(registry.contains("never"));
        assertTrue(registry.contains("strip"));
    }

    @Test
    void sizeCountsActiveRegistrations() {
        assertEquals(0, registry.size());

        registry.register("a", Signature.of(String.class), inv -> "");
        registry.register("a", Signature.of(Integer.class), inv -> "");
        RegistrationHandle b = registry.register("b", Signature.empty(), inv -> "");
        assertEquals(3, registry.size());

        b.unregister();
        assertEquals(2, registry.size());
    }

    @Test
    void resolveReturnsTheWinnerWithoutInvoking() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("area", Signature.of(Shape.class), inv -> calls.incrementAndGet());
        registry.register("area", Signature.of(Circle.class), inv -> calls.incrementAndGet());

        RegistryEntry<Object> winner = registry.resolve("area", new Circle(1));

        assertEquals(Signature.of(Circle.class), winner.signature());
        assertEquals(0, calls.get());
    }

    @Test
    void bindResolvesNowAndInvokesLater() throws Exception {
        registry.register("area", Signature.of(Shape.class), inv -> "generic");
        Callable<Object> call = registry.bind("area", new Circle(1));

        registry.register("area", Signature.of(Circle.class), inv -> "circle");

        assertEquals("generic", call.call());
        assertEquals("circle", registry.dispatch("area", new Circle(1)));
    }

    @Test
    void bindWithOptionsFixesOptionsOverMetadata() throws Exception {
        CallableRegistry<String> bound = CallableRegistry.<String>builder().bindMetadata(true).build();
        bound.register(Registration.<String>builder("getword")
                .signature(Signature.of(String.class))
                .target(inv -> inv.argument(0, String.class).split(" ")[inv.option("index", Integer.class, 0)])
                .metadata("index", 1)
                .build());

        Callable<String> metadataOnly = bound.bind("getword", "only way to be sure");
        Callable<String> overridden = bound.bindWithOptions("getword", Map.of("index", 3), "only way to be sure");

        assertEquals("way", metadataOnly.call());
        assertEquals("be", overridden.call());
    }

    @Test
    void removeClearsEveryRegistrationOfAKey() throws Exception {
        RecordingMetrics metrics = new RecordingMetrics();
        CallableRegistry<String> observed = CallableRegistry.<String>builder().metrics(metrics).build();
        RegistrationHandle generic = observed.register("area", Signature.of(Shape.class), inv -> "generic");
        observed.register("area", Signature.of(Circle.class), inv -> "circle");
        observed.register("strip", Signature.of(String.class), inv -> "");
        metrics.events.clear();

        assertEquals(2, observed.remove("area"));

        assertFalse(observed.contains("area"));
        assertEquals(List.of("strip"), observed.availableKeys());
        assertEquals(List.of(), observed.signatures("area"));
        assertFalse(generic.isActive());
        assertThrows(NoMatchException.class, () -> observed.dispatch("area", new Circle(1)));
        assertEquals(List.of("unregistered", "unregistered", "active:1"), metrics.events);

        observed.register("area", Signature.of(Circle.class), inv -> "circle again");
        assertEquals("circle again", observed.dispatch("area", new Circle(1)));
    }

    @Test
    void removeOfUnknownKeyFails() {
        assertThrows(UnknownKeyException.class, () -> registry.remove("missing"));
        assertThrows(UnknownKeyException.class, () -> registry.remove(Geometry.PERIMETER));
    }

    @Test
    void everyKeyedOperationAcceptsOperationKeys() throws Exception {
        registry.register(Registration.builder(Geometry.PERIMETER)
                .signature(Signature.of(Square.class))
                .target(inv -> "perimeter:" + inv.option("unit").orElse("m"))
                .metadata("unit", "cm")
                .build());

        assertEquals(1, registry.lookup(Geometry.PERIMETER).size());
        assertEquals(Map.of("unit", "cm"), registry.describe(Geometry.PERIMETER).get(0).metadata());
        assertEquals(Signature.of(Square.class), registry.resolve(Geometry.PERIMETER, new Square(1)).signature());
        assertEquals("perimeter:m", registry.bind(Geometry.PERIMETER, new Square(1)).call());
        assertEquals("perimeter:km",
                registry.bindWithOptions(Geometry.PERIMETER, Map.of("unit", "km"), new Square(1)).call());
        assertEquals(1, registry.remove(Geometry.PERIMETER));
    }

    @Test
    void customEntryRegistryIsUsed() throws Exception {
        CountingEntryRegistry entries = new CountingEntryRegistry();
        CallableRegistry<String> custom = CallableRegistry.<String>builder().entryRegistry(entries).build();
        RegistrationHandle handle = custom.register("greet", Signature.of(String.class), inv -> "hello");

        assertEquals("hello", custom.dispatch("greet", "bob"));
        assertSame(entries, handle.owner());
        assertTrue(entries.lookups.get() > 0);

        assertTrue(custom.unregister(handle));
        assertFalse(handle.isActive());
        assertThrows(NoMatchException.class, () -> custom.dispatch("greet", "bob"));
    }

    @Test
    void independentRegistriesDoNotShareState() {
        CallableRegistry<Object> other = CallableRegistry.builder().build();
        registry.register("area", Signature.of(Circle.class), inv -> "c");

        assertTrue(registry.contains("area"));
        assertFalse(other.contains("area"));
        assertThrows(IllegalArgumentException.class,
                () -> other.unregister(registry.register("x", Signature.empty(), inv -> "")));
    }

    @Test
    void interceptorsObserveTheChosenEntry() throws Exception {
        List<String> traced = new ArrayList<>();
        CallableRegistry<String> tracedRegistry = CallableRegistry.<String>builder()
                .interceptor(DispatchInterceptor.before((entry, inv) -> traced.add(entry.signature().toString())))
                .build();
        tracedRegistry.register("area", Signature.of(Shape.class), inv -> "generic");
        tracedRegistry.register("area", Signature.of(Circle.class), inv -> "circle");

        assertEquals("circle", tracedRegistry.dispatch("area", new Circle(1)));
        assertEquals(List.of("(Circle)"), traced);
    }

    @Test
    void metricsSeeEveryOutcome() throws Exception {
        RecordingMetrics metrics = new RecordingMetrics();
        CallableRegistry<String> observed = CallableRegistry.<String>builder().metrics(metrics).build();
        observed.register("label", Signature.of(Shapes.Named.class), inv -> "named");
        observed.register("label", Signature.of(Shape.class), inv -> "shape");
        observed.register("label", Signature.of(Square.class), inv -> "square");
        observed.register("label", Signature.of(Square.class), inv -> "square2", true);

        observed.dispatch("label", new Square(1));
        assertThrows(AmbiguousDispatchException.class, () -> observed.dispatch("label", new Circle(1)));
        assertThrows(NoMatchException.class, () -> observed.dispatch("label", "text"));
        assertThrows(UnknownKeyException.class, () -> observed.dispatch("missing"));

        assertEquals(List.of("registered", "active:1", "registered", "active:2", "registered", "active:3",
                "registered", "overridden", "active:3",
                "success", "ambiguous", "noMatch", "unknownKey"), metrics.events);
    }

    @Test
    void toStringNamesTheRegistry() {
        registry.register("b", Signature.empty(), inv -> "");
        registry.register("a", Signature.empty(), inv -> "");

        assertEquals("CallableRegistry(name=test, bindMetadata=false, keys=[a, b])", registry.toString());
    }

    @Test
    void builderValidatesName() {
        assertThrows(NullPointerException.class, () -> CallableRegistry.builder().name(null).build());
        assertThrows(IllegalArgumentException.class, () -> CallableRegistry.builder().name("").build());
    }

    private static final class RecordingMetrics implements MetricsExporter {
        final List<String> events = new ArrayList<>();

        @Override
        public void incrementDispatchSuccess() {
            events.add("success");
        }

        @Override
        public void incrementDispatchFailure() {
            events.add("failure");
        }

        @Override
        public void incrementNoMatch() {
            events.add("noMatch");
        }

        @Override
        public void incrementAmbiguous() {
            events.add("ambiguous");
        }

        @Override
        public void incrementUnknownKey() {
            events.add("unknownKey");
        }

        @Override
        public void incrementRegistered() {
            events.add("registered");
        }

        @Override
        public void incrementOverridden() {
            events.add("overridden");
        }

        @Override
        public void incrementUnregistered() {
            events.add("unregistered");
        }

        @Override
        public void recordActiveEntries(int activeEntries) {
            events.add("active:" + activeEntries);
        }
    }

    /**
     * Counts lookups and keeps entries in a {@link DefaultEntryRegistry}, issuing its own handles.
     */
    private static final class CountingEntryRegistry implements EntryRegistry<String> {
        private final DefaultEntryRegistry<String> delegate = new DefaultEntryRegistry<>();
        final AtomicInteger lookups = new AtomicInteger();

        @Override
        public RegistrationHandle register(Registration<String> registration) {
            RegistrationHandle handle = delegate.register(registration);
            return new RegistrationHandle(this, handle.entry(), handle.replacedPrevious());
        }

        @Override
        public boolean unregister(RegistrationHandle handle) {
            if (handle.owner() != this) {
                throw new IllegalArgumentException("foreign handle " + handle);
            }
            return delegate.unregister(new RegistrationHandle(delegate, handle.entry(), false));
        }

        @Override
        public int removeAll(String key) {
            return delegate.removeAll(key);
        }

        @Override
        public List<RegistryEntry<String>> lookup(String key) {
            lookups.incrementAndGet();
            return delegate.lookup(key);
        }

        @Override
        public Set<String> keys() {
            return delegate.keys();
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public boolean isActive(RegistryEntry<?> entry) {
            return delegate.isActive(entry);
        }
    }
}
