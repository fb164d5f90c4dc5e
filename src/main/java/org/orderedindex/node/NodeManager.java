package org.orderedindex.node;

import org.orderedindex.IndexConfig;

import java.util.Comparator;

/**
 * Arena owning every node of one index. Nodes reference their children by the id handed out here.
 */
public interface NodeManager<K, V> {
    IndexConfig config();

    Comparator<? super K> comparator();

    BTreeNode<K, V> allocateNode();

    BTreeNode<K, V> allocateLeafNode();

    BTreeNode<K, V> readNode(long nodeId);

    int nodeCount();
}
