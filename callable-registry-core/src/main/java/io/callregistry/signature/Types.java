package io.callregistry.signature;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Runtime type helpers for constraint evaluation.
 */
public final class Types {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            void.class, Void.class);

    private Types() {
    }

    /**
     * Returns the wrapper class of a primitive type, or {@code type} itself.
     */
    public static Class<?> wrap(Class<?> type) {
        Class<?> wrapper = WRAPPERS.get(type);
        return wrapper != null ? wrapper : type;
    }

    /**
     * Number of inheritance edges (superclass or interface) on the shortest path
     * from {@code from} up to {@code to}.
     *
     * <p>Returns 0 when the types are equal and -1 when {@code to} is not a
     * supertype of {@code from}. Every non-interface type reaches {@code Object}
     * through its superclass chain; interfaces are treated as one edge below
     * {@code Object}.
     *
     * @param from the runtime type of an argument
     * @param to   the declared type
     * @return the distance, or -1 if unrelated
     */
    public static int distance(Class<?> from, Class<?> to) {
        if (from.equals(to)) {
            return 0;
        }
        if (!to.isAssignableFrom(from)) {
            return -1;
        }
        // Breadth-first over the supertype graph; the first hit is the shortest path.
        Deque<Class<?>> frontier = new ArrayDeque<>();
        Set<Class<?>> seen = new HashSet<>();
        frontier.add(from);
        seen.add(from);
        int depth = 0;
        while (!frontier.isEmpty()) {
            depth++;
            for (int n = frontier.size(); n > 0; n--) {
                Class<?> current = frontier.poll();
                for (Class<?> parent : parentsOf(current)) {
                    if (parent.equals(to)) {
                        return depth;
                    }
                    if (seen.add(parent)) {
                        frontier.add(parent);
                    }
                }
            }
        }
        return -1;
    }

    private static Set<Class<?>> parentsOf(Class<?> type) {
        Set<Class<?>> parents = new HashSet<>();
        Class<?> superclass = type.getSuperclass();
        if (superclass != null) {
            parents.add(superclass);
        } else if (type.isInterface()) {
            parents.add(Object.class);
        }
        for (Class<?> iface : type.getInterfaces()) {
            parents.add(iface);
        }
        return parents;
    }
}
