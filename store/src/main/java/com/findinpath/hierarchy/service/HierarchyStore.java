package com.findinpath.hierarchy.service;

import com.findinpath.hierarchy.NestedSetValidator;
import com.findinpath.hierarchy.TreeUtils;
import com.findinpath.hierarchy.Utils;
import com.findinpath.hierarchy.exception.CyclicMoveException;
import com.findinpath.hierarchy.exception.InvalidOperationException;
import com.findinpath.hierarchy.exception.InvariantViolationException;
import com.findinpath.hierarchy.exception.NodeNotFoundException;
import com.findinpath.hierarchy.jdbc.ConnectionProvider;
import com.findinpath.hierarchy.jdbc.NestedSetNodeRepository;
import com.findinpath.hierarchy.model.HierarchyChangedEvent;
import com.findinpath.hierarchy.model.HierarchyChangedEvent.Operation;
import com.findinpath.hierarchy.model.HierarchyKind;
import com.findinpath.hierarchy.model.InvariantViolation;
import com.findinpath.hierarchy.model.NestedSetNode;
import com.findinpath.hierarchy.model.NodeAttributes;
import com.findinpath.hierarchy.model.TreeNode;
import com.findinpath.hierarchy.model.TreeStatistics;
import com.google.common.eventbus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stores tree shaped entities of several {@link HierarchyKind kinds} by means of the nested set model.
 * <p>
 * Every structural mutation (insert, delete, move, rebuild) runs in its own transaction while holding the
 * structural lock of its kind, so that mutations of the same kind are serialized. Before committing,
 * the invariants of the kind are verified (unless disabled through {@link HierarchySettings}) and any failure
 * rolls the whole renumbering back. Once committed, a {@link HierarchyChangedEvent} is posted on the event bus.
 * <p>
 * Queries run in a read-only snapshot and never observe a renumbering in progress.
 * <p>
 * Database errors are rethrown as the original {@link SQLException}. Transient ones (serialization failure,
 * deadlock, lock timeout) can be retried by re-executing the whole operation since every operation recomputes
 * the coordinates from the current state.
 */
public class HierarchyStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(HierarchyStore.class);

    private static final int NEW_NODE_WIDTH = 2;

    private final ConnectionProvider connectionProvider;
    private final HierarchySettings settings;
    private final EventBus eventBus;
    private final Supplier<UUID> idGenerator;

    public HierarchyStore(ConnectionProvider connectionProvider,
                          HierarchySettings settings,
                          EventBus eventBus) {
        this(connectionProvider, settings, eventBus, UUID::randomUUID);
    }

    public HierarchyStore(ConnectionProvider connectionProvider,
                          HierarchySettings settings,
                          EventBus eventBus,
                          Supplier<UUID> idGenerator) {
        this.connectionProvider = connectionProvider;
        this.settings = settings;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
    }

    public NestedSetNode insertRootNode(HierarchyKind kind, NodeAttributes attributes) {
        return insertNode(kind, null, null, attributes);
    }

    public NestedSetNode insertNode(HierarchyKind kind, UUID parentId, NodeAttributes attributes) {
        return insertNode(kind, parentId, null, attributes);
    }

    /**
     * Creates a new node.
     *
     * @param kind       the kind of the node
     * @param parentId   the parent of the node or <code>null</code> for creating a root node
     * @param position   zero based position among the siblings of the new node or <code>null</code>
     *                   for appending it as the last sibling. Positions beyond the last sibling append the node.
     * @param attributes the entity specific values of the node
     * @return the persisted node with its final coordinates
     * @throws NodeNotFoundException        if the parent does not exist
     * @throws InvariantViolationException if the resulting nested set is not valid
     */
    public NestedSetNode insertNode(HierarchyKind kind, UUID parentId, Integer position, NodeAttributes attributes) {
        checkNotNull(attributes, "attributes");
        checkArgument(position == null || position >= 0, "The position must not be negative: %s", position);
        var nodeId = idGenerator.get();

        var insertedNode = inStructuralTransaction(kind, nestedSetNodeRepository -> {
            List<NestedSetNode> siblings;
            long appendPoint;
            int depth;
            if (parentId == null) {
                siblings = nestedSetNodeRepository.getRoots();
                appendPoint = nestedSetNodeRepository.getMaxRight() + 1;
                depth = 0;
            } else {
                var parentNode = requireNode(nestedSetNodeRepository, parentId);
                siblings = nestedSetNodeRepository.getChildren(parentId);
                appendPoint = parentNode.getRight();
                depth = parentNode.getDepth() + 1;
            }
            var insertionPoint = resolveInsertionPoint(siblings, position, appendPoint);

            nestedSetNodeRepository.makeSpace(insertionPoint, NEW_NODE_WIDTH);

            var now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            var nestedSetNode = new NestedSetNode(nodeId, parentId, attributes.getLabel(),
                    insertionPoint, insertionPoint + 1, depth,
                    position == null ? siblings.size() : Math.min(position, siblings.size()));
            nestedSetNode.setSlug(attributes.getSlug());
            nestedSetNode.setDescription(attributes.getDescription());
            nestedSetNode.setActive(attributes.isActive());
            nestedSetNode.setCreated(now);
            nestedSetNode.setUpdated(now);
            nestedSetNodeRepository.insertNode(nestedSetNode);
            nestedSetNodeRepository.resequenceChildren(parentId);

            return requireNode(nestedSetNodeRepository, nodeId);
        });

        LOGGER.info("Inserted the {} node {}", kind, insertedNode);
        eventBus.post(new HierarchyChangedEvent(kind, Operation.INSERT, nodeId));
        return insertedNode;
    }

    public int deleteNode(HierarchyKind kind, UUID nodeId) {
        return deleteNode(kind, nodeId, true);
    }

    /**
     * Deletes a node together with all its descendants and closes the gap left behind.
     *
     * @param cascade when <code>false</code> the deletion is rejected for nodes having children
     * @return the amount of deleted nodes
     * @throws NodeNotFoundException      if the node does not exist
     * @throws InvalidOperationException if the node has children and <code>cascade</code> is not set
     */
    public int deleteNode(HierarchyKind kind, UUID nodeId, boolean cascade) {
        var deletedNodes = inStructuralTransaction(kind, nestedSetNodeRepository -> {
            var nestedSetNode = requireNode(nestedSetNodeRepository, nodeId);
            if (!cascade && nestedSetNode.getRight() - nestedSetNode.getLeft() > 1) {
                throw new InvalidOperationException("The " + kind + " node " + nodeId
                        + " has children. Move them first or delete the node with cascading enabled");
            }
            var width = nestedSetNode.getRight() - nestedSetNode.getLeft() + 1;

            var deletedRows = nestedSetNodeRepository.deleteSubtree(nestedSetNode.getLeft(), nestedSetNode.getRight());
            nestedSetNodeRepository.closeGap(nestedSetNode.getRight(), width);
            nestedSetNodeRepository.resequenceChildren(nestedSetNode.getParentId());
            return deletedRows;
        });

        LOGGER.info("Deleted the {} node {} along with {} descendants", kind, nodeId, deletedNodes - 1);
        eventBus.post(new HierarchyChangedEvent(kind, Operation.DELETE, nodeId));
        return deletedNodes;
    }

    public NestedSetNode moveNode(HierarchyKind kind, UUID nodeId, UUID newParentId) {
        return moveNode(kind, nodeId, newParentId, null);
    }

    /**
     * Moves a node along with its subtree under a new parent.
     * <p>
     * The subtree gets detached into the negative coordinate range, the gap left behind gets closed,
     * a new gap gets opened at the destination and the subtree gets attached back into it with
     * its depths adjusted. All of this happens within one transaction.
     *
     * @param newParentId the new parent or <code>null</code> for turning the node into a root node
     * @param position    zero based position among the new siblings or <code>null</code> for appending
     * @return the moved node with its final coordinates
     * @throws NodeNotFoundException if the node or the new parent does not exist
     * @throws CyclicMoveException   if the new parent is the node itself or one of its descendants
     */
    public NestedSetNode moveNode(HierarchyKind kind, UUID nodeId, UUID newParentId, Integer position) {
        checkArgument(position == null || position >= 0, "The position must not be negative: %s", position);

        var movedNode = inStructuralTransaction(kind, nestedSetNodeRepository -> {
            var nestedSetNode = requireNode(nestedSetNodeRepository, nodeId);
            if (newParentId != null) {
                var newParentNode = requireNode(nestedSetNodeRepository, newParentId);
                if (newParentNode.getLeft() >= nestedSetNode.getLeft()
                        && newParentNode.getRight() <= nestedSetNode.getRight()) {
                    throw new CyclicMoveException(nodeId, newParentId);
                }
            }
            var width = nestedSetNode.getRight() - nestedSetNode.getLeft() + 1;

            var detachOffset = nestedSetNodeRepository.getMaxRight() + 1;
            nestedSetNodeRepository.detachSubtree(nestedSetNode.getLeft(), nestedSetNode.getRight(), detachOffset);
            nestedSetNodeRepository.closeGap(nestedSetNode.getRight(), width);

            // the coordinates of the new parent may have been shifted while closing the gap
            List<NestedSetNode> siblings;
            long appendPoint;
            int newDepth;
            if (newParentId == null) {
                siblings = nestedSetNodeRepository.getRoots();
                appendPoint = nestedSetNodeRepository.getMaxRight() + 1;
                newDepth = 0;
            } else {
                var newParentNode = requireNode(nestedSetNodeRepository, newParentId);
                siblings = nestedSetNodeRepository.getChildren(newParentId);
                appendPoint = newParentNode.getRight();
                newDepth = newParentNode.getDepth() + 1;
            }
            siblings = siblings.stream()
                    .filter(sibling -> !sibling.getId().equals(nodeId))
                    .collect(Collectors.toList());
            var insertionPoint = resolveInsertionPoint(siblings, position, appendPoint);

            nestedSetNodeRepository.makeSpace(insertionPoint, width);
            var detachedLeft = nestedSetNode.getLeft() - detachOffset;
            nestedSetNodeRepository.attachDetachedSubtree(insertionPoint - detachedLeft,
                    newDepth - nestedSetNode.getDepth());
            nestedSetNodeRepository.updateParent(nodeId, newParentId);

            nestedSetNodeRepository.resequenceChildren(nestedSetNode.getParentId());
            if (!Objects.equals(nestedSetNode.getParentId(), newParentId)) {
                nestedSetNodeRepository.resequenceChildren(newParentId);
            }
            return requireNode(nestedSetNodeRepository, nodeId);
        });

        LOGGER.info("Moved the {} node {}", kind, movedNode);
        eventBus.post(new HierarchyChangedEvent(kind, Operation.MOVE, nodeId));
        return movedNode;
    }

    /**
     * Recomputes the coordinates of all the nodes of the kind out of their <code>parent_id</code> references
     * while preserving the relative order of the siblings. Meant for repairing a corrupt nested set.
     *
     * @return the amount of nodes whose coordinates have been changed
     * @throws InvariantViolationException if some nodes can not be reached from a root node
     */
    public int rebuild(HierarchyKind kind) {
        var rebuiltNodes = inStructuralTransaction(kind, nestedSetNodeRepository -> {
            var nestedSetNodes = nestedSetNodeRepository.getNestedSetNodes();
            var currentNestedSetNodes = nestedSetNodes.stream()
                    .collect(Collectors.toMap(NestedSetNode::getId, Function.identity()));

            var changedNestedSetNodes = new ArrayList<NestedSetNode>();
            for (var renumberedNode : TreeUtils.renumber(kind, nestedSetNodes)) {
                var currentNode = currentNestedSetNodes.get(renumberedNode.getId());
                if (currentNode.getLeft() != renumberedNode.getLeft()
                        || currentNode.getRight() != renumberedNode.getRight()
                        || currentNode.getDepth() != renumberedNode.getDepth()
                        || currentNode.getOrdering() != renumberedNode.getOrdering()) {
                    changedNestedSetNodes.add(renumberedNode);
                }
            }
            nestedSetNodeRepository.updateAll(changedNestedSetNodes);
            return changedNestedSetNodes.size();
        });

        LOGGER.info("Rebuilt the {} nested set, {} nodes have been renumbered", kind, rebuiltNodes);
        eventBus.post(new HierarchyChangedEvent(kind, Operation.REBUILD, null));
        return rebuiltNodes;
    }

    /**
     * Verifies the invariants of the nested set of the kind.
     *
     * @return all the violations found, empty when the nested set is valid
     */
    public List<InvariantViolation> validate(HierarchyKind kind) {
        var violations = inReadSnapshot(kind,
                nestedSetNodeRepository -> NestedSetValidator.validate(nestedSetNodeRepository.getNestedSetNodes()));
        if (!violations.isEmpty()) {
            LOGGER.warn("The {} nested set has {} invariant violations", kind, violations.size());
        }
        return violations;
    }

    public Optional<NestedSetNode> getNestedSetNode(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository -> nestedSetNodeRepository.getNestedSetNode(nodeId));
    }

    public List<NestedSetNode> getNestedSetNodes(HierarchyKind kind) {
        return inReadSnapshot(kind, NestedSetNodeRepository::getNestedSetNodes);
    }

    /**
     * @return the direct children of the node ordered by their sibling position
     */
    public List<NestedSetNode> getChildren(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository -> {
            requireNode(nestedSetNodeRepository, nodeId);
            return nestedSetNodeRepository.getChildren(nodeId);
        });
    }

    /**
     * @return the descendants of the node in pre-order
     */
    public List<NestedSetNode> getDescendants(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository ->
                nestedSetNodeRepository.getDescendants(requireNode(nestedSetNodeRepository, nodeId)));
    }

    public List<NestedSetNode> getDescendants(HierarchyKind kind, UUID nodeId, long limit, long offset) {
        checkArgument(limit >= 0 && offset >= 0, "limit and offset must not be negative");
        return inReadSnapshot(kind, nestedSetNodeRepository ->
                nestedSetNodeRepository.getDescendants(requireNode(nestedSetNodeRepository, nodeId), limit, offset));
    }

    /**
     * @return the ancestors of the node starting from the root down to the parent
     */
    public List<NestedSetNode> getAncestors(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository ->
                nestedSetNodeRepository.getAncestors(requireNode(nestedSetNodeRepository, nodeId)));
    }

    public List<NestedSetNode> getSiblings(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository ->
                nestedSetNodeRepository.getSiblings(requireNode(nestedSetNodeRepository, nodeId)));
    }

    public List<NestedSetNode> getRoots(HierarchyKind kind) {
        return inReadSnapshot(kind, NestedSetNodeRepository::getRoots);
    }

    /**
     * @return the ancestors of the node followed by the node itself
     */
    public List<NestedSetNode> getPathToRoot(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository -> {
            var nestedSetNode = requireNode(nestedSetNodeRepository, nodeId);
            var path = new ArrayList<>(nestedSetNodeRepository.getAncestors(nestedSetNode));
            path.add(nestedSetNode);
            return path;
        });
    }

    /**
     * @return the node followed by its descendants in pre-order
     */
    public List<NestedSetNode> getSubtree(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository ->
                nestedSetNodeRepository.getSubtree(requireNode(nestedSetNodeRepository, nodeId)));
    }

    /**
     * @return <code>true</code> if both nodes exist and the second one lies within the subtree of the first one
     */
    public boolean isDescendant(HierarchyKind kind, UUID ancestorId, UUID descendantId) {
        return inReadSnapshot(kind, nestedSetNodeRepository -> nestedSetNodeRepository.isDescendant(ancestorId, descendantId));
    }

    public long countChildren(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository -> {
            requireNode(nestedSetNodeRepository, nodeId);
            return nestedSetNodeRepository.countChildren(nodeId);
        });
    }

    public long countDescendants(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository ->
                nestedSetNodeRepository.countDescendants(requireNode(nestedSetNodeRepository, nodeId)));
    }

    /**
     * @return the amount of nodes in the subtree of the node, the node included
     */
    public long getSubtreeSize(HierarchyKind kind, UUID nodeId) {
        return inReadSnapshot(kind, nestedSetNodeRepository ->
                requireNode(nestedSetNodeRepository, nodeId).getSubtreeSize());
    }

    /**
     * @return the maximum depth found among the nodes of the kind
     */
    public int getTreeHeight(HierarchyKind kind) {
        return inReadSnapshot(kind, NestedSetNodeRepository::getTreeHeight);
    }

    public long getLevelWidth(HierarchyKind kind, int depth) {
        checkArgument(depth >= 0, "The depth must not be negative: %s", depth);
        return inReadSnapshot(kind, nestedSetNodeRepository -> nestedSetNodeRepository.getLevelWidth(depth));
    }

    public TreeStatistics getStatistics(HierarchyKind kind) {
        return inReadSnapshot(kind, NestedSetNodeRepository::getStatistics);
    }

    /**
     * Builds the forest of trees of the kind out of a single scan of its table.
     *
     * @return the root trees ordered from left to right
     * @throws InvariantViolationException if the nested set of the kind is corrupt
     */
    public List<TreeNode> getTree(HierarchyKind kind) {
        LOGGER.info("Building the {} tree from the persistence", kind);

        var nestedSetNodes = getNestedSetNodes(kind);
        return TreeUtils.buildForest(nestedSetNodes)
                .orElseThrow(() -> {
                    LOGGER.error("The {} table content is corrupt", kind.getTableName());
                    return new InvariantViolationException(kind, NestedSetValidator.validate(nestedSetNodes));
                });
    }

    private static long resolveInsertionPoint(List<NestedSetNode> siblings, Integer position, long appendPoint) {
        if (position == null || position >= siblings.size()) {
            return appendPoint;
        }
        return siblings.get(position).getLeft();
    }

    private static NestedSetNode requireNode(NestedSetNodeRepository nestedSetNodeRepository, UUID nodeId) {
        checkNotNull(nodeId, "nodeId");
        return nestedSetNodeRepository.getNestedSetNode(nodeId)
                .orElseThrow(() -> new NodeNotFoundException(nestedSetNodeRepository.getKind(), nodeId));
    }

    private <T> T inStructuralTransaction(HierarchyKind kind, Function<NestedSetNodeRepository, T> mutation) {
        checkNotNull(kind, "kind");
        try (Connection connection = connectionProvider.getConnection()) {
            connection.setAutoCommit(false);
            Throwable failure = null;
            try {
                var nestedSetNodeRepository = new NestedSetNodeRepository(connection, kind);
                nestedSetNodeRepository.lockForStructuralChange(settings.getLockTimeout());

                var result = mutation.apply(nestedSetNodeRepository);

                if (settings.isVerifyAfterMutation()) {
                    var violations = NestedSetValidator.validate(nestedSetNodeRepository.getNestedSetNodes());
                    if (!violations.isEmpty()) {
                        LOGGER.error("The {} nested set would become corrupt, rolling back: {}", kind, violations);
                        throw new InvariantViolationException(kind, violations);
                    }
                }
                connection.commit();
                return result;
            } catch (Throwable t) {
                failure = t;
                rollback(connection, t);
                Utils.sneakyThrow(t);
                return null;
            } finally {
                restoreAutoCommit(connection, failure);
            }
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
            return null;
        }
    }

    private <T> T inReadSnapshot(HierarchyKind kind, Function<NestedSetNodeRepository, T> query) {
        checkNotNull(kind, "kind");
        try (Connection connection = connectionProvider.getConnection()) {
            connection.setReadOnly(true);
            connection.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
            connection.setAutoCommit(false);
            Throwable failure = null;
            try {
                var result = query.apply(new NestedSetNodeRepository(connection, kind));
                connection.commit();
                return result;
            } catch (Throwable t) {
                failure = t;
                rollback(connection, t);
                Utils.sneakyThrow(t);
                return null;
            } finally {
                restoreAutoCommit(connection, failure);
            }
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
            return null;
        }
    }

    private static void rollback(Connection connection, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Puts the connection back into auto-commit mode before it returns to the pool.
     * A failure of doing so never hides the failure of the operation itself.
     */
    private static void restoreAutoCommit(Connection connection, Throwable operationFailure) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            if (operationFailure == null) {
                Utils.sneakyThrow(e);
            } else {
                operationFailure.addSuppressed(e);
            }
        }
    }
}
