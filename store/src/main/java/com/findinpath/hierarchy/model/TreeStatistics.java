package com.findinpath.hierarchy.model;

public class TreeStatistics {
    private final long totalNodes;
    private final int treeHeight;
    private final long rootNodes;
    private final long leafNodes;
    private final double averageDepth;
    private final long maxWidth;

    public TreeStatistics(long totalNodes, int treeHeight, long rootNodes, long leafNodes,
                          double averageDepth, long maxWidth) {
        this.totalNodes = totalNodes;
        this.treeHeight = treeHeight;
        this.rootNodes = rootNodes;
        this.leafNodes = leafNodes;
        this.averageDepth = averageDepth;
        this.maxWidth = maxWidth;
    }

    public long getTotalNodes() {
        return totalNodes;
    }

    public int getTreeHeight() {
        return treeHeight;
    }

    public long getRootNodes() {
        return rootNodes;
    }

    public long getLeafNodes() {
        return leafNodes;
    }

    public double getAverageDepth() {
        return averageDepth;
    }

    /**
     * @return the largest amount of nodes found on a single depth level
     */
    public long getMaxWidth() {
        return maxWidth;
    }

    @Override
    public String toString() {
        return "TreeStatistics{" +
                "totalNodes=" + totalNodes +
                ", treeHeight=" + treeHeight +
                ", rootNodes=" + rootNodes +
                ", leafNodes=" + leafNodes +
                ", averageDepth=" + averageDepth +
                ", maxWidth=" + maxWidth +
                '}';
    }
}
