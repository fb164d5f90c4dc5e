package org.orderedindex;

import org.orderedindex.node.BTreeNode;
import org.orderedindex.node.MapBasedNodeManager;
import org.orderedindex.node.NodeManager;
import org.orderedindex.tree.InsertHandler;
import org.orderedindex.tree.TreeStats;
import org.orderedindex.tree.TreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * In-memory B-Tree. Keys and values live in internal nodes as well as in leaves.
 * Not thread-safe, wrap it in {@link LockingOrderedIndex} for concurrent use.
 */
public class BTreeIndex<K, V> implements OrderedIndex<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(BTreeIndex.class);

    private final NodeManager<K, V> nodeManager;
    private final InsertHandler<K, V> insertHandler;
    private BTreeNode<K, V> root;
    private int height = 1;
    private int size = 0;

    public BTreeIndex(NodeManager<K, V> nodeManager) {
        this.nodeManager = Objects.requireNonNull(nodeManager, "nodeManager");
        this.insertHandler = new InsertHandler<>(nodeManager);
        this.root = nodeManager.allocateLeafNode(); // start with an empty node
        logger.debug("created index; degree={}, rootId={}", nodeManager.config().degree(), root.id());
    }

    public BTreeIndex(IndexConfig config, Comparator<? super K> comparator) {
        this(new MapBasedNodeManager<>(config, comparator));
    }

    public static <K extends Comparable<? super K>, V> BTreeIndex<K, V> withDegree(int degree) {
        return new BTreeIndex<>(IndexConfig.of(degree), Comparator.naturalOrder());
    }

    @Override
    public Optional<V> search(K key) {
        Objects.requireNonNull(key, "key");
        return recursiveSearch(key, root);
    }

    private Optional<V> recursiveSearch(K key, BTreeNode<K, V> node) {
        int idx = node.searchKeyIdx(key);
        if (node.matches(idx, key)) {
            return Optional.of(node.value(idx));
        }
        if (node.isLeaf()) {
            return Optional.empty();
        }
        return recursiveSearch(key, nodeManager.readNode(node.child(idx)));
    }

    @Override
    public void insert(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (root.isFull()) {
            root = insertHandler.splitRoot(root);
            height++;
            if (logger.isTraceEnabled()) {
                logger.trace("tree grew; height={}", height);
            }
        }
        if (insertHandler.insertNonFull(root, key, value)) {
            size++;
        }
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int degree() {
        return nodeManager.config().degree();
    }

    @Override
    public List<K> getAllKeysInOrder() {
        List<K> keys = new ArrayList<>(size);
        forEachInOrder((key, value) -> keys.add(key));
        return keys;
    }

    @Override
    public void forEachInOrder(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action");
        walkInOrder(root, action);
    }

    private void walkInOrder(BTreeNode<K, V> node, BiConsumer<? super K, ? super V> action) {
        for (int i = 0; i < node.numKeys(); i++) {
            if (!node.isLeaf()) {
                walkInOrder(nodeManager.readNode(node.child(i)), action);
            }
            action.accept(node.key(i), node.value(i));
        }
        if (!node.isLeaf()) {
            walkInOrder(nodeManager.readNode(node.child(node.numKeys())), action);
        }
    }

    BTreeNode<K, V> root() {
        return root;
    }

    /**
     * Checks every structural rule of the tree.
     *
     * @throws IllegalStateException when a rule is broken or the counters kept here disagree with the tree
     */
    public TreeStats validate() {
        TreeStats stats = new TreeValidator<>(nodeManager).validate(root);
        if (stats.height() != height) {
            throw new IllegalStateException("Tracked height " + height + " but leaves are at depth " + stats.height());
        }
        if (stats.entryCount() != size) {
            throw new IllegalStateException("Tracked size " + size + " but tree holds " + stats.entryCount() + " entries");
        }
        return stats;
    }

    public String printStructure() {
        StringBuilder sb = new StringBuilder();
        sb.append("B-Tree Structure:\n");
        printRecursive(root, sb, 0);
        sb.append("B-Tree Structure end.\n");
        return sb.toString();
    }

    private void printRecursive(BTreeNode<K, V> node, StringBuilder sb, int level) {
        String indent = "  ".repeat(level);
        sb.append(indent).append(node.isLeaf() ? "Leaf " : "Internal ").append(node.id()).append(": ");
        for (int i = 0; i < node.numKeys(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(node.key(i));
        }
        sb.append("\n");
        if (!node.isLeaf()) {
            for (int i = 0; i <= node.numKeys(); i++) {
                printRecursive(nodeManager.readNode(node.child(i)), sb, level + 1);
            }
        }
    }

    @Override
    public String toString() {
        return printStructure();
    }
}
