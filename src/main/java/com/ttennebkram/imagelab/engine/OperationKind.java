package com.ttennebkram.imagelab.engine;

import com.ttennebkram.imagelab.processing.WireNamed;

/**
 * Operations understood by {@link ImageEngine#execute}. Wire names match the request paths
 * clients already use.
 */
public enum OperationKind implements WireNamed {
    NOISE("add_noise"),
    FILTER("apply_filter"),
    EDGE("edge_detection"),
    HISTOGRAM("histogram"),
    ENHANCEMENT("enhancement"),
    FREQUENCY("frequency"),
    HYBRID("hybrid"),
    UNDO("undo"),
    RESET("reset");

    private final String wireName;

    OperationKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    /** Hybrid works on two uploaded images and never touches a session. */
    public boolean needsSession() {
        return this != HYBRID;
    }

    public static OperationKind fromWireName(String value) {
        return WireNamed.parse(OperationKind.class, value, "operation");
    }
}
