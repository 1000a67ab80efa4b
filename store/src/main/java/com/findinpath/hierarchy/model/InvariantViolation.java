package com.findinpath.hierarchy.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Describes a single broken nested set invariant found while validating the nodes of a kind.
 */
public class InvariantViolation {

    public enum Type {
        /**
         * <code>left</code> is not strictly smaller than <code>right</code>.
         */
        INVALID_INTERVAL,
        /**
         * <code>(right - left - 1) / 2</code> differs from the amount of rows contained in the interval.
         */
        DESCENDANT_COUNT_MISMATCH,
        /**
         * The interval partially overlaps the interval of another node.
         */
        OVERLAPPING_INTERVALS,
        /**
         * <code>parent_id</code> does not point to the innermost containing interval.
         */
        PARENT_MISMATCH,
        DEPTH_MISMATCH,
        DUPLICATE_COORDINATE,
        /**
         * The coordinates of the kind are not the contiguous sequence <code>1..2n</code>.
         */
        COORDINATE_GAP,
        /**
         * The sibling ordering is not dense in left to right order.
         */
        ORDERING_MISMATCH
    }

    private final Type type;
    private final UUID nodeId;
    private final String message;

    public InvariantViolation(Type type, UUID nodeId, String message) {
        this.type = type;
        this.nodeId = nodeId;
        this.message = message;
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the offending node or <code>null</code> when the violation concerns the kind as a whole
     */
    public UUID getNodeId() {
        return nodeId;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvariantViolation that = (InvariantViolation) o;
        return type == that.type &&
                Objects.equals(nodeId, that.nodeId) &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, nodeId, message);
    }

    @Override
    public String toString() {
        return type + (nodeId == null ? "" : " [" + nodeId + "]") + ": " + message;
    }
}
