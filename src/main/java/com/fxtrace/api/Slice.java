package com.fxtrace.api;

/**
 * A slice structure. Each component is itself an argument and may be
 * {@code null} when omitted, e.g. {@code x[1:]} is {@code Slice(1, null, null)}.
 */
public record Slice(Object start, Object stop, Object step) {

    public static Slice of(Object start, Object stop) {
        return new Slice(start, stop, null);
    }

    @Override
    public String toString() {
        return "slice(" + start + ", " + stop + ", " + step + ")";
    }
}
