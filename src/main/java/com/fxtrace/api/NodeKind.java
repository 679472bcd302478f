package com.fxtrace.api;

/**
 * The kind of instruction a recorded node represents.
 *
 * The IR spelling ({@link #opName()}) is the lower-case form used in dumps and
 * snapshots, e.g. {@code call_function}.
 */
public enum NodeKind {
    /** An input parameter of the traced function. */
    PLACEHOLDER("placeholder"),
    /** A call to a free function or operator symbol. */
    CALL_FUNCTION("call_function"),
    /** A call to a method on the first argument. */
    CALL_METHOD("call_method"),
    /** A read of an attribute path. */
    GET_ATTR("get_attr"),
    /** The value returned from the traced function. */
    OUTPUT("output");

    private final String opName;

    NodeKind(String opName) {
        this.opName = opName;
    }

    public String opName() {
        return opName;
    }

    public static NodeKind fromString(String text) {
        for (NodeKind k : NodeKind.values()) {
            if (k.opName.equalsIgnoreCase(text) || k.name().equalsIgnoreCase(text)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown NodeKind: " + text);
    }
}
