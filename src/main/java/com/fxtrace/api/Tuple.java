package com.fxtrace.api;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable ordered sequence.
 *
 * This is the "tuple" kind of argument sequence. It is deliberately not a
 * {@link List} so that lowering can tell it apart from the "list" kind and
 * preserve whichever of the two the traced code used.
 */
public final class Tuple implements Iterable<Object> {
    private static final Tuple EMPTY = new Tuple(new Object[0]);

    private final Object[] elements;

    private Tuple(Object[] elements) {
        this.elements = elements;
    }

    public static Tuple of(Object... elements) {
        if (elements == null || elements.length == 0)
            return EMPTY;
        return new Tuple(elements.clone());
    }

    public static Tuple copyOf(Collection<?> elements) {
        if (elements.isEmpty())
            return EMPTY;
        return new Tuple(elements.toArray());
    }

    public static Tuple empty() {
        return EMPTY;
    }

    /** Returns a new tuple with {@code head} followed by the elements of {@code rest}. */
    public static Tuple prepend(Object head, Tuple rest) {
        Object[] out = new Object[rest.elements.length + 1];
        out[0] = head;
        System.arraycopy(rest.elements, 0, out, 1, rest.elements.length);
        return new Tuple(out);
    }

    public Object get(int index) {
        return elements[index];
    }

    public int size() {
        return elements.length;
    }

    public boolean isEmpty() {
        return elements.length == 0;
    }

    /** Read-only list view. */
    public List<Object> asList() {
        return Collections.unmodifiableList(Arrays.asList(elements));
    }

    @Override
    public Iterator<Object> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Tuple other))
            return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        if (elements.length == 1)
            return "(" + elements[0] + ",)";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(elements[i]);
        }
        return sb.append(')').toString();
    }
}
