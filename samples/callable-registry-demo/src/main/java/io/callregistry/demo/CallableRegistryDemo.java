package io.callregistry.demo;

import io.callregistry.CallTarget;
import io.callregistry.CallableRegistry;
import io.callregistry.NoMatchException;
import io.callregistry.Registration;
import io.callregistry.dispatch.LoggingDispatchInterceptor;
import io.callregistry.signature.Signature;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Simple demo showing registration and dispatch without Spring.
 * <p>
 * Run with: mvn -pl samples/callable-registry-demo exec:java
 */
public final class CallableRegistryDemo {

    public static void main(String[] args) throws Exception {
        shapes();
        pipeline();
    }

    private static void shapes() throws Exception {
        // 1. One operation, two implementations
        CallableRegistry<Double> shapes = CallableRegistry.<Double>builder()
                .name("shapes")
                .interceptor(new LoggingDispatchInterceptor(Level.INFO))
                .build();
        shapes.register("area", Signature.of(Circle.class),
                inv -> Math.PI * Math.pow(inv.argument(0, Circle.class).radius(), 2));
        shapes.register("area", Signature.of(Shape.class),
                inv -> inv.argument(0, Shape.class).boundingBoxArea());

        // 2. The most specific implementation wins
        System.out.println("[Shapes] area(Circle r=2) = " + shapes.dispatch("area", new Circle(2)));
        System.out.println("[Shapes] area(Square 3)   = " + shapes.dispatch("area", new Square(3)));

        // 3. Nothing accepts an Integer
        try {
            shapes.dispatch("area", 42);
        } catch (NoMatchException e) {
            System.out.println("[Shapes] " + e.getMessage());
        }
        System.out.println("[Shapes] " + shapes);
    }

    private static void pipeline() throws Exception {
        // Registration metadata is handed to the implementation as invocation options
        CallableRegistry<String> strings = CallableRegistry.<String>builder()
                .name("string")
                .bindMetadata(true)
                .build();
        CallTarget<String> getWord = inv -> inv.argument(0, String.class).split(" ")[inv.option("index", Integer.class, 0)];

        strings.register("strip", Signature.of(String.class), inv -> inv.argument(0, String.class).strip());
        strings.register(Registration.<String>builder("getword-0")
                .signature(Signature.of(String.class)).target(getWord).metadata("index", 0).build());
        strings.register(Registration.<String>builder("getword-1")
                .signature(Signature.of(String.class)).target(getWord).metadata("index", 1).build());
        strings.register("upper", Signature.of(String.class), inv -> inv.argument(0, String.class).toUpperCase());

        List<String> lines = List.of(" nuke the site from orbit...", "only way to be sure ");
        List<String> steps = List.of("strip", "getword-1", "upper");

        List<String> output = new ArrayList<>();
        for (String line : lines) {
            for (String step : steps) {
                line = strings.dispatch(step, line);
            }
            output.add(line);
        }
        System.out.println("[Pipeline] available: " + strings.availableKeys());
        System.out.println("[Pipeline] output:    " + output);
    }

    static class Shape {
        double boundingBoxArea() {
            return 0.0;
        }
    }

    static final class Circle extends Shape {
        private final double radius;

        Circle(double radius) {
            this.radius = radius;
        }

        double radius() {
            return radius;
        }

        @Override
        double boundingBoxArea() {
            return 4 * radius * radius;
        }
    }

    static final class Square extends Shape {
        private final double side;

        Square(double side) {
            this.side = side;
        }

        @Override
        double boundingBoxArea() {
            return side * side;
        }
    }
}
