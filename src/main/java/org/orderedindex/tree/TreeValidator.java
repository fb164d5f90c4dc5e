package org.orderedindex.tree;

import org.orderedindex.IndexConfig;
import org.orderedindex.node.BTreeNode;
import org.orderedindex.node.NodeManager;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;

/**
 * Walks a whole tree checking key order, fan-out bounds, separator bounds and leaf depth.
 * Meant for tests and debugging, it visits every node.
 */
public class TreeValidator<K, V> {
    private final NodeManager<K, V> nodeManager;
    private final Comparator<? super K> comparator;
    private final IndexConfig config;

    public TreeValidator(NodeManager<K, V> nodeManager) {
        this.nodeManager = nodeManager;
        this.comparator = nodeManager.comparator();
        this.config = nodeManager.config();
    }

    /**
     * @throws IllegalStateException describing the first broken rule
     */
    public TreeStats validate(BTreeNode<K, V> root) {
        Walk walk = new Walk();
        validateRecursive(root, null, null, 1, true, walk);
        return new TreeStats(walk.leafDepth, walk.visited.size(), walk.leafCount, walk.entryCount);
    }

    private void validateRecursive(BTreeNode<K, V> node, K lower, K upper, int depth, boolean isRoot, Walk walk) {
        if (!walk.visited.add(node.id())) {
            throw new IllegalStateException("Node " + node.id() + " is reachable more than once.");
        }
        int numKeys = node.numKeys();
        if (numKeys > config.maxKeys()) {
            throw new IllegalStateException("Node " + node.id() + " holds " + numKeys + " keys, max is " + config.maxKeys());
        }
        if (!isRoot && numKeys < config.minKeys()) {
            throw new IllegalStateException("Node " + node.id() + " holds " + numKeys + " keys, min is " + config.minKeys());
        }
        for (int i = 0; i < numKeys; i++) {
            K key = node.key(i);
            if (i > 0 && comparator.compare(node.key(i - 1), key) >= 0) {
                throw new IllegalStateException("Keys of node " + node.id() + " are not strictly ascending at index " + i);
            }
            if (lower != null && comparator.compare(key, lower) <= 0
                    || upper != null && comparator.compare(key, upper) >= 0) {
                throw new IllegalStateException("Key " + key + " of node " + node.id()
                        + " is outside of its parent bounds (" + lower + ", " + upper + ")");
            }
        }
        walk.entryCount += numKeys;

        if (node.isLeaf()) {
            walk.leafCount++;
            if (walk.leafDepth == -1) {
                walk.leafDepth = depth;
            } else if (walk.leafDepth != depth) {
                throw new IllegalStateException("Leaf " + node.id() + " is at depth " + depth
                        + " while other leaves are at depth " + walk.leafDepth);
            }
            return;
        }
        if (numKeys == 0) {
            throw new IllegalStateException("Internal node " + node.id() + " has no keys.");
        }
        for (int i = 0; i <= numKeys; i++) {
            BTreeNode<K, V> child = nodeManager.readNode(node.child(i));
            K childLower = i == 0 ? lower : node.key(i - 1);
            K childUpper = i == numKeys ? upper : node.key(i);
            validateRecursive(child, childLower, childUpper, depth + 1, false, walk);
        }
    }

    private static final class Walk {
        private final Set<Long> visited = new HashSet<>();
        private int leafDepth = -1;
        private int leafCount;
        private int entryCount;
    }
}
