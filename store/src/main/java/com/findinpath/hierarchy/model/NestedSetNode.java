package com.findinpath.hierarchy.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Models a nested set node of a given {@link HierarchyKind}.
 * <p>
 * The <code>left</code>, <code>right</code>, <code>depth</code> and <code>ordering</code>
 * coordinates are owned by the hierarchy store. The remaining attributes travel with the row.
 *
 * @see <a href="https://en.wikipedia.org/wiki/Nested_set_model">Nested Set Model</a>
 */
public class NestedSetNode {
    private UUID id;
    private UUID parentId;

    private long left;
    private long right;
    private int depth;
    private int ordering;

    private String label;
    private String slug;
    private String description;
    private boolean active;
    private Instant created;
    private Instant updated;

    public NestedSetNode() {
    }

    public NestedSetNode(UUID id, UUID parentId, String label, long left, long right, int depth, int ordering) {
        this.id = id;
        this.parentId = parentId;
        this.label = label;
        this.left = left;
        this.right = right;
        this.depth = depth;
        this.ordering = ordering;
        this.active = true;
    }

    public NestedSetNode(NestedSetNode other) {
        this.id = other.id;
        this.parentId = other.parentId;
        this.left = other.left;
        this.right = other.right;
        this.depth = other.depth;
        this.ordering = other.ordering;
        this.label = other.label;
        this.slug = other.slug;
        this.description = other.description;
        this.active = other.active;
        this.created = other.created;
        this.updated = other.updated;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getParentId() {
        return parentId;
    }

    public void setParentId(UUID parentId) {
        this.parentId = parentId;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public long getLeft() {
        return left;
    }

    public void setLeft(long left) {
        this.left = left;
    }

    public long getRight() {
        return right;
    }

    public void setRight(long right) {
        this.right = right;
    }

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public int getOrdering() {
        return ordering;
    }

    public void setOrdering(int ordering) {
        this.ordering = ordering;
    }

    /**
     * @return the number of nodes contained in the subtree rooted at this node (this node included)
     */
    public long getSubtreeSize() {
        return (right - left + 1) / 2;
    }

    /**
     * @return <code>true</code> if the interval of this node strictly contains the interval of the other node
     */
    public boolean contains(NestedSetNode other) {
        return left < other.left && right > other.right;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreated() {
        return created;
    }

    public void setCreated(Instant created) {
        this.created = created;
    }

    public Instant getUpdated() {
        return updated;
    }

    public void setUpdated(Instant updated) {
        this.updated = updated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NestedSetNode that = (NestedSetNode) o;
        return left == that.left &&
                right == that.right &&
                depth == that.depth &&
                ordering == that.ordering &&
                active == that.active &&
                Objects.equals(id, that.id) &&
                Objects.equals(parentId, that.parentId) &&
                Objects.equals(label, that.label) &&
                Objects.equals(slug, that.slug) &&
                Objects.equals(description, that.description) &&
                Objects.equals(created, that.created) &&
                Objects.equals(updated, that.updated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parentId, left, right, depth, ordering, label, slug, description, active, created, updated);
    }

    @Override
    public String toString() {
        return "NestedSetNode{" +
                "id=" + id +
                ", parentId=" + parentId +
                ", label=" + label +
                ", left=" + left +
                ", right=" + right +
                ", depth=" + depth +
                ", ordering=" + ordering +
                ", active=" + active +
                '}';
    }
}
