package com.findinpath.hierarchy.exception;

import com.findinpath.hierarchy.model.HierarchyKind;

import java.util.UUID;

public class NodeNotFoundException extends HierarchyException {

    private final HierarchyKind kind;
    private final UUID nodeId;

    public NodeNotFoundException(HierarchyKind kind, UUID nodeId) {
        super(Reason.NOT_FOUND, "The " + kind + " node " + nodeId + " does not exist");
        this.kind = kind;
        this.nodeId = nodeId;
    }

    public HierarchyKind getKind() {
        return kind;
    }

    public UUID getNodeId() {
        return nodeId;
    }
}
