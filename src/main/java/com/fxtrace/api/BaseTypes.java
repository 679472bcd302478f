package com.fxtrace.api;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;

/**
 * Catalog of leaf value types that pass through argument lowering unchanged.
 *
 * Enum constants are accepted so that symbolic constants such as element types,
 * devices or layouts can be recorded as literals.
 */
public final class BaseTypes {
    private static final Set<Class<?>> TYPES = Set.of(
            String.class,
            Boolean.class,
            Character.class,
            Byte.class,
            Short.class,
            Integer.class,
            Long.class,
            Float.class,
            Double.class,
            BigInteger.class,
            BigDecimal.class);

    private BaseTypes() {
        // Utility class
    }

    public static Set<Class<?>> types() {
        return TYPES;
    }

    /** True if {@code value} is a non-null member of the base-type catalog. */
    public static boolean isBaseType(Object value) {
        if (value == null)
            return false;
        return TYPES.contains(value.getClass()) || value instanceof Enum<?> || value instanceof Class<?>;
    }
}
