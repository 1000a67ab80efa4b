package com.findinpath.hierarchy.exception;

import com.findinpath.hierarchy.model.HierarchyKind;
import com.findinpath.hierarchy.model.InvariantViolation;

import java.util.List;

/**
 * Thrown when the nested set of a kind does not satisfy its invariants after a computed mutation.
 * It points to a logic or concurrency bug and is never repaired silently.
 */
public class InvariantViolationException extends HierarchyException {

    private final HierarchyKind kind;
    private final List<InvariantViolation> violations;

    public InvariantViolationException(HierarchyKind kind, List<InvariantViolation> violations) {
        super(Reason.INVARIANT_VIOLATION, "The " + kind + " nested set is corrupt: " + violations);
        this.kind = kind;
        this.violations = List.copyOf(violations);
    }

    public HierarchyKind getKind() {
        return kind;
    }

    public List<InvariantViolation> getViolations() {
        return violations;
    }
}
