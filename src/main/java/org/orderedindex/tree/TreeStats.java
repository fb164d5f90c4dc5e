package org.orderedindex.tree;

public record TreeStats(
        int height,
        int nodeCount,
        int leafCount,
        int entryCount
) {
}
