package com.findinpath.hierarchy.exception;

/**
 * Signals that a structural operation on a nested set hierarchy failed.
 * The {@link Reason} tells the caller which kind of failure occurred.
 */
public class HierarchyException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        CYCLIC_MOVE,
        INVALID_OPERATION,
        INVARIANT_VIOLATION
    }

    private final Reason reason;

    public HierarchyException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
