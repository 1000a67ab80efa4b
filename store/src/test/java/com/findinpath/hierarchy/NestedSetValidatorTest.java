package com.findinpath.hierarchy;

import com.findinpath.hierarchy.model.InvariantViolation;
import com.findinpath.hierarchy.model.NestedSetNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.findinpath.hierarchy.model.InvariantViolation.Type.COORDINATE_GAP;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.DEPTH_MISMATCH;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.DESCENDANT_COUNT_MISMATCH;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.DUPLICATE_COORDINATE;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.INVALID_INTERVAL;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.ORDERING_MISMATCH;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.OVERLAPPING_INTERVALS;
import static com.findinpath.hierarchy.model.InvariantViolation.Type.PARENT_MISMATCH;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;

public class NestedSetValidatorTest {

    private static final UUID A = id("A");
    private static final UUID B = id("B");
    private static final UUID C = id("C");
    private static final UUID D = id("D");

    @Test
    public void emptyNestedSetIsValid() {
        assertThat(NestedSetValidator.validate(List.of()), empty());
        assertThat(NestedSetValidator.validate(null), empty());
    }

    /**
     * <pre>
     * |1| A |6|
     *     ├── |2| B |3|
     *     └── |4| C |5|
     * </pre>
     */
    @Test
    public void validTreeHasNoViolations() {
        var nestedSetNodes = List.of(
                new NestedSetNode(C, A, "C", 4, 5, 1, 1),
                new NestedSetNode(A, null, "A", 1, 6, 0, 0),
                new NestedSetNode(B, A, "B", 2, 3, 1, 0));

        assertThat(NestedSetValidator.validate(nestedSetNodes), empty());
    }

    @Test
    public void forestOfSeveralRootsIsValid() {
        var nestedSetNodes = List.of(
                new NestedSetNode(A, null, "A", 1, 2, 0, 0),
                new NestedSetNode(B, null, "B", 3, 6, 0, 1),
                new NestedSetNode(C, B, "C", 4, 5, 1, 0));

        assertThat(NestedSetValidator.validate(nestedSetNodes), empty());
    }

    @Test
    public void depthMismatchIsReported() {
        var nestedSetNodes = List.of(
                new NestedSetNode(A, null, "A", 1, 4, 0, 0),
                new NestedSetNode(B, A, "B", 2, 3, 2, 0));

        assertThat(NestedSetValidator.validate(nestedSetNodes),
                equalTo(List.of(new InvariantViolation(DEPTH_MISMATCH, B, "depth is 2 but should be 1"))));
    }

    @Test
    public void rootWithNonZeroDepthIsReported() {
        var nestedSetNodes = List.of(new NestedSetNode(A, null, "A", 1, 2, 1, 0));

        assertThat(types(NestedSetValidator.validate(nestedSetNodes)), equalTo(List.of(DEPTH_MISMATCH)));
    }

    @Test
    public void descendantCountMismatchIsReported() {
        // A claims room for three descendants but contains only two
        var nestedSetNodes = List.of(
                new NestedSetNode(A, null, "A", 1, 8, 0, 0),
                new NestedSetNode(B, A, "B", 2, 3, 1, 0),
                new NestedSetNode(C, A, "C", 4, 5, 1, 1));

        var violations = NestedSetValidator.validate(nestedSetNodes);

        assertThat(violations, hasItem(new InvariantViolation(DESCENDANT_COUNT_MISMATCH, A,
                "interval [1, 8] does not match its 2 contained rows")));
        assertThat(types(violations), hasItem(COORDINATE_GAP));
    }

    @Test
    public void overlappingIntervalsAreReported() {
        var nestedSetNodes = List.of(
                new NestedSetNode(A, null, "A", 1, 4, 0, 0),
                new NestedSetNode(B, null, "B", 3, 6, 0, 1));

        var violations = NestedSetValidator.validate(nestedSetNodes);

        assertThat(violations.stream()
                        .filter(violation -> violation.getType() == OVERLAPPING_INTERVALS)
                        .map(InvariantViolation::getNodeId)
                        .collect(Collectors.toList()),
                equalTo(List.of(B)));
    }

    @Test
    public void parentNotMatchingTheContainingIntervalIsReported() {
        var nestedSetNodes = List.of(
                new NestedSetNode(A, null, "A", 1, 4, 0, 0),
                new NestedSetNode(B, null, "B", 2, 3, 0, 1));

        var violations = NestedSetValidator.validate(nestedSetNodes);

        assertThat(violations, hasItem(new InvariantViolation(PARENT_MISMATCH, B,
                "parent_id is null but the innermost containing interval belongs to " + A)));
    }

    @Test
    public void missingParentIsReported() {
        var nestedSetNodes = List.of(new NestedSetNode(B, D, "B", 1, 2, 1, 0));

        assertThat(types(NestedSetValidator.validate(nestedSetNodes)), equalTo(List.of(PARENT_MISMATCH)));
    }

    @Test
    public void duplicateCoordinatesAreReported() {
        var nestedSetNodes = List.of(
                new NestedSetNode(A, null, "A", 1, 2, 0, 0),
                new NestedSetNode(B, null, "B", 2, 3, 0, 1));

        assertThat(types(NestedSetValidator.validate(nestedSetNodes)), hasItem(DUPLICATE_COORDINATE));
    }

    @Test
    public void invalidIntervalIsReported() {
        var nestedSetNodes = List.of(new NestedSetNode(A, null, "A", 2, 1, 0, 0));

        assertThat(NestedSetValidator.validate(nestedSetNodes),
                hasItem(new InvariantViolation(INVALID_INTERVAL, A, "left 2 is not smaller than right 1")));
    }

    @Test
    public void gapBetweenRootsIsReported() {
        var nestedSetNodes = List.of(
                new NestedSetNode(A, null, "A", 1, 2, 0, 0),
                new NestedSetNode(B, null, "B", 5, 6, 0, 1));

        assertThat(types(NestedSetValidator.validate(nestedSetNodes)), equalTo(List.of(COORDINATE_GAP)));
    }

    @Test
    public void sparseOrderingIsReported() {
        var nestedSetNodes = List.of(
                new NestedSetNode(A, null, "A", 1, 6, 0, 0),
                new NestedSetNode(B, A, "B", 2, 3, 1, 1),
                new NestedSetNode(C, A, "C", 4, 5, 1, 0));

        var violations = NestedSetValidator.validate(nestedSetNodes);

        assertThat(types(violations), equalTo(List.of(ORDERING_MISMATCH, ORDERING_MISMATCH)));
        assertThat(violations.get(0), equalTo(new InvariantViolation(ORDERING_MISMATCH, B,
                "ordering is 1 but the node is at position 0 among its siblings")));
    }

    @Test
    public void validationIsDeterministic() {
        var nestedSetNodes = List.of(
                new NestedSetNode(D, null, "D", 9, 9, 3, 4),
                new NestedSetNode(A, null, "A", 1, 8, 0, 0),
                new NestedSetNode(B, null, "B", 2, 3, 1, 0),
                new NestedSetNode(C, A, "C", 3, 10, 1, 1));

        var firstRun = NestedSetValidator.validate(nestedSetNodes);
        var secondRun = NestedSetValidator.validate(List.of(nestedSetNodes.get(3), nestedSetNodes.get(1),
                nestedSetNodes.get(0), nestedSetNodes.get(2)));

        assertThat(firstRun, not(empty()));
        assertThat(secondRun, equalTo(firstRun));
    }

    private static List<InvariantViolation.Type> types(List<InvariantViolation> violations) {
        return violations.stream()
                .map(InvariantViolation::getType)
                .collect(Collectors.toList());
    }

    private static UUID id(String label) {
        return UUID.nameUUIDFromBytes(label.getBytes(StandardCharsets.UTF_8));
    }
}
