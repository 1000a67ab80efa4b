package com.findinpath.hierarchy;

import com.findinpath.hierarchy.model.InvariantViolation;
import com.findinpath.hierarchy.model.NestedSetNode;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.findinpath.hierarchy.model.InvariantViolation.Type.COORDINATE_GAP;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.DEPTH_MISMATCH;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.DESCENDANT_COUNT_MISMATCH;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.DUPLICATE_COORDINATE;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.INVALID_INTERVAL;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.ORDERING_MISMATCH;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.OVERLAPPING_INTERVALS;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.PARENT_MISMATCH;

/**
 * Verifies the invariants of the nested set nodes belonging to a single kind.
 * <p>
 * All the checks are executed and every violation found is reported, which makes the
 * outcome usable for diagnostic and repair tooling. The checks are:
 * <ul>
 *     <li><code>left &lt; right</code> for every node</li>
 *     <li>coordinates are unique and form the contiguous sequence <code>1..2n</code></li>
 *     <li>intervals are either nested or disjoint and <code>parent_id</code> points to the innermost containing interval</li>
 *     <li><code>right = left + 2 * (contained rows) + 1</code></li>
 *     <li>roots have depth <code>0</code> and children are one level deeper than their parent</li>
 *     <li>the ordering of siblings is dense in left to right order</li>
 * </ul>
 * For the same input the same list of violations is returned.
 */
public class NestedSetValidator {

    static final Comparator<NestedSetNode> PREORDER = Comparator.comparingLong(NestedSetNode::getLeft)
            .thenComparing(NestedSetNode::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private NestedSetValidator() {
    }

    public static List<InvariantViolation> validate(Collection<NestedSetNode> nestedSetNodes) {
        if (nestedSetNodes == null || nestedSetNodes.isEmpty()) return List.of();

        var sortedNestedSetNodes = nestedSetNodes.stream()
                .sorted(PREORDER)
                .collect(Collectors.toList());
        var violations = new ArrayList<InvariantViolation>();

        verifyCoordinates(sortedNestedSetNodes, violations);
        verifyNesting(sortedNestedSetNodes, violations);
        verifyDescendantCounts(sortedNestedSetNodes, violations);
        verifyDepths(sortedNestedSetNodes, violations);
        verifyOrdering(sortedNestedSetNodes, violations);

        return violations;
    }

    private static void verifyCoordinates(List<NestedSetNode> sortedNestedSetNodes,
                                          List<InvariantViolation> violations) {
        ListMultimap<Long, UUID> coordinateOwners = MultimapBuilder.treeKeys().arrayListValues().build();
        for (var nestedSetNode : sortedNestedSetNodes) {
            if (nestedSetNode.getLeft() >= nestedSetNode.getRight()) {
                violations.add(new InvariantViolation(INVALID_INTERVAL, nestedSetNode.getId(),
                        "left " + nestedSetNode.getLeft() + " is not smaller than right " + nestedSetNode.getRight()));
            }
            coordinateOwners.put(nestedSetNode.getLeft(), nestedSetNode.getId());
            coordinateOwners.put(nestedSetNode.getRight(), nestedSetNode.getId());
        }

        long minimum = Long.MAX_VALUE;
        long maximum = Long.MIN_VALUE;
        for (var coordinate : coordinateOwners.keySet()) {
            minimum = Math.min(minimum, coordinate);
            maximum = Math.max(maximum, coordinate);
            var owners = coordinateOwners.get(coordinate);
            if (owners.size() > 1) {
                violations.add(new InvariantViolation(DUPLICATE_COORDINATE, owners.get(0),
                        "coordinate " + coordinate + " is used by " + owners));
            }
        }

        // the coordinates of n nodes must be exactly 1..2n
        long expectedMaximum = 2L * sortedNestedSetNodes.size();
        int distinctCoordinates = coordinateOwners.keySet().size();
        if (minimum != 1 || maximum != expectedMaximum || distinctCoordinates != expectedMaximum) {
            violations.add(new InvariantViolation(COORDINATE_GAP, null,
                    "expected the coordinates 1.." + expectedMaximum + " but found " + distinctCoordinates
                            + " distinct coordinates in the range " + minimum + ".." + maximum));
        }
    }

    private static void verifyNesting(List<NestedSetNode> sortedNestedSetNodes,
                                      List<InvariantViolation> violations) {
        Deque<NestedSetNode> openIntervals = new ArrayDeque<>();
        for (var nestedSetNode : sortedNestedSetNodes) {
            if (nestedSetNode.getLeft() >= nestedSetNode.getRight()) continue;

            while (!openIntervals.isEmpty() && openIntervals.peek().getRight() < nestedSetNode.getLeft()) {
                openIntervals.pop();
            }
            var container = openIntervals.peek();
            if (container != null && nestedSetNode.getRight() >= container.getRight()) {
                violations.add(new InvariantViolation(OVERLAPPING_INTERVALS, nestedSetNode.getId(),
                        "interval [" + nestedSetNode.getLeft() + ", " + nestedSetNode.getRight()
                                + "] partially overlaps the interval [" + container.getLeft() + ", "
                                + container.getRight() + "] of " + container.getId()));
                continue;
            }

            var expectedParentId = container == null ? null : container.getId();
            if (!Objects.equals(expectedParentId, nestedSetNode.getParentId())) {
                violations.add(new InvariantViolation(PARENT_MISMATCH, nestedSetNode.getId(),
                        "parent_id is " + nestedSetNode.getParentId()
                                + " but the innermost containing interval belongs to " + expectedParentId));
            }
            openIntervals.push(nestedSetNode);
        }
    }

    private static void verifyDescendantCounts(List<NestedSetNode> sortedNestedSetNodes,
                                               List<InvariantViolation> violations) {
        for (int i = 0; i < sortedNestedSetNodes.size(); i++) {
            var nestedSetNode = sortedNestedSetNodes.get(i);
            if (nestedSetNode.getLeft() >= nestedSetNode.getRight()) continue;

            long containedRows = 0;
            for (int j = i + 1; j < sortedNestedSetNodes.size()
                    && sortedNestedSetNodes.get(j).getLeft() < nestedSetNode.getRight(); j++) {
                if (nestedSetNode.contains(sortedNestedSetNodes.get(j))) {
                    containedRows++;
                }
            }
            long innerWidth = nestedSetNode.getRight() - nestedSetNode.getLeft() - 1;
            if (innerWidth % 2 != 0 || innerWidth / 2 != containedRows) {
                violations.add(new InvariantViolation(DESCENDANT_COUNT_MISMATCH, nestedSetNode.getId(),
                        "interval [" + nestedSetNode.getLeft() + ", " + nestedSetNode.getRight()
                                + "] does not match its " + containedRows + " contained rows"));
            }
        }
    }

    private static void verifyDepths(List<NestedSetNode> sortedNestedSetNodes,
                                     List<InvariantViolation> violations) {
        Map<UUID, NestedSetNode> id2NestedSetNodeMap = sortedNestedSetNodes.stream()
                .collect(Collectors.toMap(NestedSetNode::getId, Function.identity(), (first, second) -> first));

        for (var nestedSetNode : sortedNestedSetNodes) {
            int expectedDepth;
            if (nestedSetNode.isRoot()) {
                expectedDepth = 0;
            } else {
                var parent = id2NestedSetNodeMap.get(nestedSetNode.getParentId());
                // a missing parent is already reported as a parent mismatch
                if (parent == null) continue;
                expectedDepth = parent.getDepth() + 1;
            }
            if (nestedSetNode.getDepth() != expectedDepth) {
                violations.add(new InvariantViolation(DEPTH_MISMATCH, nestedSetNode.getId(),
                        "depth is " + nestedSetNode.getDepth() + " but should be " + expectedDepth));
            }
        }
    }

    private static void verifyOrdering(List<NestedSetNode> sortedNestedSetNodes,
                                       List<InvariantViolation> violations) {
        var siblingGroups = sortedNestedSetNodes.stream()
                .collect(Collectors.groupingBy(nestedSetNode -> Optional.ofNullable(nestedSetNode.getParentId()),
                        LinkedHashMap::new,
                        Collectors.toList()));

        for (var siblings : siblingGroups.values()) {
            for (int position = 0; position < siblings.size(); position++) {
                var sibling = siblings.get(position);
                if (sibling.getOrdering() != position) {
                    violations.add(new InvariantViolation(ORDERING_MISMATCH, sibling.getId(),
                            "ordering is " + sibling.getOrdering() + " but the node is at position "
                                    + position + " among its siblings"));
                }
            }
        }
    }
}
