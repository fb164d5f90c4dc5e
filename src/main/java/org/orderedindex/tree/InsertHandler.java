package org.orderedindex.tree;

import org.orderedindex.node.BTreeNode;
import org.orderedindex.node.NodeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;

/**
 * Single pass top-down insertion. Every full node met on the way down is split before the descent
 * enters it, so the parent of a split always has room for the promoted median.
 */
public class InsertHandler<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(InsertHandler.class);

    private final NodeManager<K, V> nodeManager;
    private final Comparator<? super K> comparator;
    private final int degree;

    public InsertHandler(NodeManager<K, V> nodeManager) {
        this.nodeManager = nodeManager;
        this.comparator = nodeManager.comparator();
        this.degree = nodeManager.config().degree();
    }

    /**
     * Grows the tree by one level: the full root becomes the only child of a new root and is split.
     *
     * @return the new root
     */
    public BTreeNode<K, V> splitRoot(BTreeNode<K, V> root) {
        if (!root.isFull()) {
            throw new IllegalStateException("Root " + root.id() + " is not full, nothing to split");
        }
        BTreeNode<K, V> newRoot = nodeManager.allocateNode();
        newRoot.firstChild(root.id());
        splitChild(newRoot, 0);
        if (logger.isTraceEnabled()) {
            logger.trace("splitting root node; oldRoot={}, newRoot={}", root.id(), newRoot.id());
        }
        return newRoot;
    }

    public SplitResult<K, V> splitChild(BTreeNode<K, V> parent, int childIdx) {
        if (parent.isFull()) {
            throw new IllegalStateException("Parent " + parent.id() + " is full, cannot take the promoted key");
        }
        BTreeNode<K, V> child = nodeManager.readNode(parent.child(childIdx));
        if (!child.isFull()) {
            throw new IllegalStateException("Node " + child.id() + " is not full, nothing to split");
        }
        int mid = degree - 1;
        K promotedKey = child.key(mid);
        V promotedValue = child.value(mid);

        BTreeNode<K, V> right = child.isLeaf() ? nodeManager.allocateLeafNode() : nodeManager.allocateNode();
        right.copy(child, mid + 1, child.numKeys());
        child.remove(mid, child.numKeys());
        parent.addChild(childIdx, promotedKey, promotedValue, right.id());

        if (logger.isTraceEnabled()) {
            logger.trace("splitting node; node={}, sibling={}, parent={}, promotedKey={}",
                    child.id(), right.id(), parent.id(), promotedKey);
        }
        return new SplitResult<>(promotedKey, promotedValue, child, right);
    }

    /**
     * Inserts into the subtree of a node that is known not to be full.
     *
     * @return {@code true} when a new entry was added, {@code false} when an existing value was replaced
     */
    public boolean insertNonFull(BTreeNode<K, V> node, K key, V value) {
        int idx = node.searchKeyIdx(key);
        if (node.matches(idx, key)) {
            return overwrite(node, idx, value);
        }
        if (node.isLeaf()) {
            node.put(idx, key, value);
            return true;
        }
        BTreeNode<K, V> child = nodeManager.readNode(node.child(idx));
        if (child.isFull()) {
            SplitResult<K, V> splitResult = splitChild(node, idx);
            int cmp = comparator.compare(key, splitResult.promotedKey());
            if (cmp == 0) {
                // the key was the median of the child we just split
                return overwrite(node, idx, value);
            }
            child = cmp < 0 ? splitResult.left() : splitResult.right();
        }
        return insertNonFull(child, key, value);
    }

    private boolean overwrite(BTreeNode<K, V> node, int idx, V value) {
        if (logger.isTraceEnabled()) {
            logger.trace("overwriting existing key; node={}, key={}", node.id(), node.key(idx));
        }
        node.value(idx, value);
        return false;
    }
}
