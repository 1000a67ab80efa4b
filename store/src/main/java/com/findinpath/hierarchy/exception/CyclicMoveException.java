package com.findinpath.hierarchy.exception;

import java.util.UUID;

/**
 * Thrown when a node would be moved under itself or under one of its own descendants.
 */
public class CyclicMoveException extends HierarchyException {

    public CyclicMoveException(UUID nodeId, UUID newParentId) {
        super(Reason.CYCLIC_MOVE, "The node " + nodeId + " can not be moved under " + newParentId
                + " because the latter is the node itself or one of its descendants");
    }
}
