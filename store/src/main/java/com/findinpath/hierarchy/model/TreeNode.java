package com.findinpath.hierarchy.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Models a tree node that contains nested node set information.
 */
public class TreeNode {
    private NestedSetNode nestedSetNode;
    private List<TreeNode> children;

    public TreeNode(NestedSetNode nestedSetNode) {
        this.nestedSetNode = nestedSetNode;
    }

    public NestedSetNode getNestedSetNode() {
        return nestedSetNode;
    }

    public List<TreeNode> getChildren() {
        return children == null ? List.of() : Collections.unmodifiableList(children);
    }

    public TreeNode addChild(NestedSetNode nestedSetNode) {
        if (children == null) {
            children = new ArrayList<>();
        }
        TreeNode child = new TreeNode(nestedSetNode);
        children.add(child);
        return child;
    }

    public String toString() {
        StringBuilder buffer = new StringBuilder(50);
        print(buffer, "", "");
        return buffer.toString();
    }

    private void print(StringBuilder buffer, String prefix, String childrenPrefix) {
        buffer.append(prefix);
        buffer.append("|").append(nestedSetNode.getLeft()).append("| ")
                .append(nestedSetNode.getLabel())
                .append(" |").append(nestedSetNode.getRight()).append("|");
        buffer.append('\n');
        if (children != null && !children.isEmpty()) {
            var nodeLeftDigitsCount = Long.toString(nestedSetNode.getLeft()).length();
            var leftPad = " ".repeat(nodeLeftDigitsCount + 3);
            for (Iterator<TreeNode> it = children.iterator(); it.hasNext(); ) {
                TreeNode next = it.next();
                if (it.hasNext()) {
                    next.print(buffer,
                            childrenPrefix + leftPad + "├── ",
                            childrenPrefix + leftPad + "│   ");
                } else {
                    next.print(buffer,
                            childrenPrefix + leftPad + "└── ",
                            childrenPrefix + leftPad + "    ");
                }
            }
        }
    }
}
