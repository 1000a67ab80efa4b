package com.findinpath.hierarchy.model;

import java.util.UUID;

/**
 * Posted on the event bus after a structural mutation of a kind has been committed.
 */
public class HierarchyChangedEvent {

    public enum Operation {
        INSERT,
        DELETE,
        MOVE,
        REBUILD
    }

    private final HierarchyKind kind;
    private final Operation operation;
    private final UUID nodeId;

    public HierarchyChangedEvent(HierarchyKind kind, Operation operation, UUID nodeId) {
        this.kind = kind;
        this.operation = operation;
        this.nodeId = nodeId;
    }

    public HierarchyKind getKind() {
        return kind;
    }

    public Operation getOperation() {
        return operation;
    }

    /**
     * @return the node subject of the operation, <code>null</code> for {@link Operation#REBUILD}
     */
    public UUID getNodeId() {
        return nodeId;
    }

    @Override
    public String toString() {
        return "HierarchyChangedEvent{" +
                "kind=" + kind +
                ", operation=" + operation +
                ", nodeId=" + nodeId +
                '}';
    }
}
