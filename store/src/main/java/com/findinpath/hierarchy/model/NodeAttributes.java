package com.findinpath.hierarchy.model;

import java.util.Objects;

/**
 * Entity specific values supplied by the caller when creating a node.
 * They are persisted as they are, the hierarchy store does not interpret them.
 */
public class NodeAttributes {
    private final String label;
    private final String slug;
    private final String description;
    private final boolean active;

    public NodeAttributes(String label, String slug, String description, boolean active) {
        this.label = Objects.requireNonNull(label, "label");
        this.slug = slug;
        this.description = description;
        this.active = active;
    }

    public static NodeAttributes of(String label) {
        return new NodeAttributes(label, null, null, true);
    }

    public String getLabel() {
        return label;
    }

    public String getSlug() {
        return slug;
    }

    public String getDescription() {
        return description;
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public String toString() {
        return "NodeAttributes{" +
                "label=" + label +
                ", slug=" + slug +
                ", active=" + active +
                '}';
    }
}
