package com.findinpath.hierarchy;

import com.findinpath.hierarchy.exception.InvariantViolationException;
import com.findinpath.hierarchy.model.HierarchyKind;
import com.findinpath.hierarchy.model.InvariantViolation;
import com.findinpath.hierarchy.model.NestedSetNode;
import com.findinpath.hierarchy.model.TreeNode;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Stack;
import java.util.UUID;
import java.util.stream.Collectors;

public class TreeUtils {

    /**
     * Order in which the children of a node are laid out when the nested set gets rebuilt.
     */
    private static final Comparator<NestedSetNode> SIBLING_ORDER = Comparator.comparingInt(NestedSetNode::getOrdering)
            .thenComparingLong(NestedSetNode::getLeft)
            .thenComparing(NestedSetNode::getId);

    private TreeUtils() {
    }

    /**
     * Builds the forest of trees out of the nested set nodes of a kind.
     *
     * @param nestedSetNodes the nodes of a kind in any order
     * @return the root trees ordered from left to right or <code>Optional.empty()</code>
     * when the nested set is not valid
     */
    public static Optional<List<TreeNode>> buildForest(List<NestedSetNode> nestedSetNodes) {
        if (!NestedSetValidator.validate(nestedSetNodes).isEmpty()) return Optional.empty();

        var nestedSetNodeIterator = nestedSetNodes
                .stream()
                .sorted(NestedSetValidator.PREORDER)
                .iterator();
        List<TreeNode> roots = new ArrayList<>();
        Stack<TreeNode> stack = new Stack<>();
        while (nestedSetNodeIterator.hasNext()) {
            NestedSetNode nestedSetNode = nestedSetNodeIterator.next();

            // find the corresponding parent node
            while (!stack.isEmpty() && stack.peek().getNestedSetNode().getRight() < nestedSetNode.getRight()) {
                stack.pop();
            }
            if (stack.isEmpty()) {
                TreeNode root = new TreeNode(nestedSetNode);
                roots.add(root);
                stack.push(root);
            } else {
                stack.push(stack.peek().addChild(nestedSetNode));
            }
        }
        return Optional.of(roots);
    }

    /**
     * Flattens the trees in pre-order.
     */
    static List<NestedSetNode> getNestedSetNodes(List<TreeNode> roots) {
        Stack<TreeNode> stack = new Stack<>();
        List<NestedSetNode> result = new ArrayList<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }

        while (!stack.empty()) {
            var treeNode = stack.pop();
            result.add(treeNode.getNestedSetNode());

            var children = treeNode.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return result;
    }

    /**
     * Computes from scratch the <code>left</code>, <code>right</code>, <code>depth</code> and
     * <code>ordering</code> coordinates of the nodes of a kind out of their <code>parent_id</code>
     * references. Siblings keep their relative order.
     *
     * @param kind           the kind the nodes belong to
     * @param nestedSetNodes the nodes of the kind, left untouched
     * @return renumbered copies of the nodes in pre-order
     * @throws InvariantViolationException when not all the nodes can be reached from a root
     */
    public static List<NestedSetNode> renumber(HierarchyKind kind, Collection<NestedSetNode> nestedSetNodes) {
        ListMultimap<UUID, NestedSetNode> childrenByParentId = MultimapBuilder.hashKeys().arrayListValues().build();
        List<NestedSetNode> roots = new ArrayList<>();
        for (var nestedSetNode : nestedSetNodes) {
            if (nestedSetNode.isRoot()) {
                roots.add(nestedSetNode);
            } else {
                childrenByParentId.put(nestedSetNode.getParentId(), nestedSetNode);
            }
        }
        roots.sort(SIBLING_ORDER);

        List<NestedSetNode> result = new ArrayList<>(nestedSetNodes.size());
        long coordinate = 1;
        int rootOrdering = 0;
        for (var root : roots) {
            var renumberedRoot = renumberedCopy(root, coordinate++, 0, rootOrdering++);
            result.add(renumberedRoot);

            Stack<RenumberingFrame> stack = new Stack<>();
            stack.push(new RenumberingFrame(renumberedRoot, sortedChildren(childrenByParentId, root)));
            while (!stack.isEmpty()) {
                var frame = stack.peek();
                if (frame.children.hasNext()) {
                    var child = frame.children.next();
                    var renumberedChild = renumberedCopy(child, coordinate++,
                            frame.nestedSetNode.getDepth() + 1, frame.nextChildOrdering++);
                    result.add(renumberedChild);
                    stack.push(new RenumberingFrame(renumberedChild, sortedChildren(childrenByParentId, child)));
                } else {
                    frame.nestedSetNode.setRight(coordinate++);
                    stack.pop();
                }
            }
        }

        if (result.size() != nestedSetNodes.size()) {
            var reachedIds = result.stream()
                    .map(NestedSetNode::getId)
                    .collect(Collectors.toCollection(HashSet::new));
            var violations = nestedSetNodes.stream()
                    .filter(nestedSetNode -> !reachedIds.contains(nestedSetNode.getId()))
                    .sorted(NestedSetValidator.PREORDER)
                    .map(nestedSetNode -> new InvariantViolation(InvariantViolation.Type.PARENT_MISMATCH,
                            nestedSetNode.getId(),
                            "the node can not be reached from any root through its parent " + nestedSetNode.getParentId()))
                    .collect(Collectors.toList());
            throw new InvariantViolationException(kind, violations);
        }
        return result;
    }

    private static Iterator<NestedSetNode> sortedChildren(ListMultimap<UUID, NestedSetNode> childrenByParentId,
                                                          NestedSetNode parent) {
        return childrenByParentId.get(parent.getId())
                .stream()
                .sorted(SIBLING_ORDER)
                .iterator();
    }

    private static NestedSetNode renumberedCopy(NestedSetNode nestedSetNode, long left, int depth, int ordering) {
        var copy = new NestedSetNode(nestedSetNode);
        copy.setLeft(left);
        copy.setDepth(depth);
        copy.setOrdering(ordering);
        return copy;
    }

    private static class RenumberingFrame {
        private final NestedSetNode nestedSetNode;
        private final Iterator<NestedSetNode> children;
        private int nextChildOrdering;

        private RenumberingFrame(NestedSetNode nestedSetNode, Iterator<NestedSetNode> children) {
            this.nestedSetNode = nestedSetNode;
            this.children = children;
        }
    }
}
