package com.fxtrace.trace;

/**
 * Raised when traced code needs a concrete value from a symbolic one, e.g.
 * branching on a proxy or iterating it without a known length.
 *
 * A specialized tracer can avoid it by overriding
 * {@link TracerBase#toBool(Proxy)} or {@link TracerBase#iter(Proxy)}.
 */
public class TraceError extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public TraceError(String message) {
        super(message);
    }
}
