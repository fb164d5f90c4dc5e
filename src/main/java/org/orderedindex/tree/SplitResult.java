package org.orderedindex.tree;

import org.orderedindex.node.BTreeNode;

public record SplitResult<K, V>(
        K promotedKey,
        V promotedValue,
        BTreeNode<K, V> left,
        BTreeNode<K, V> right
) {
}
