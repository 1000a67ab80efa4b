package com.findinpath.hierarchy.model;

/**
 * Logical entity types stored as nested sets. Each kind owns its own table and
 * therefore its own, independent, coordinate space.
 */
public enum HierarchyKind {
    TAXONOMY("taxonomies"),
    MENU("menus"),
    ORGANIZATION("organizations"),
    COMMENT("comments"),
    MEDIA("media");

    private final String tableName;

    HierarchyKind(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
