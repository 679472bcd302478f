package com.fxtrace.trace;

/**
 * Raised by argument lowering for values that cannot be stored in the IR: a
 * mapping with a non-string key, or a leaf that is neither a proxy, null nor a
 * member of the base-type catalog.
 */
public class UnsupportedArgumentException extends UnsupportedOperationException {
    private static final long serialVersionUID = 1L;

    public UnsupportedArgumentException(String message) {
        super(message);
    }
}
