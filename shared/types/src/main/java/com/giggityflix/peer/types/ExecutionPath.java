package com.giggityflix.peer.types;

/**
 * The route a unit of work takes through the resource pool.
 */
public enum ExecutionPath {
    IO("io"),
    CPU("cpu"),
    INLINE("inline"),
    ASYNC("async");

    private final String label;

    ExecutionPath(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ExecutionPath fromLabel(String label) {
        for (ExecutionPath p : values()) {
            if (p.label.equalsIgnoreCase(label)) return p;
        }
        throw new IllegalArgumentException("Unknown ExecutionPath label: " + label);
    }
}
