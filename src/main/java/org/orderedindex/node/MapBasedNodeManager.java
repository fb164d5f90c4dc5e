package org.orderedindex.node;

import org.orderedindex.IndexConfig;

import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public class MapBasedNodeManager<K, V> implements NodeManager<K, V> {
    private final AtomicLong nextId = new AtomicLong(0);
    private final ConcurrentMap<Long, BTreeNode<K, V>> nodes = new ConcurrentHashMap<>();
    private final IndexConfig config;
    private final Comparator<? super K> comparator;

    public MapBasedNodeManager(IndexConfig config, Comparator<? super K> comparator) {
        this.config = Objects.requireNonNull(config, "config");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    @Override
    public IndexConfig config() {
        return config;
    }

    @Override
    public Comparator<? super K> comparator() {
        return comparator;
    }

    @Override
    public BTreeNode<K, V> allocateNode() {
        return allocateNode(false);
    }

    @Override
    public BTreeNode<K, V> allocateLeafNode() {
        return allocateNode(true);
    }

    private BTreeNode<K, V> allocateNode(boolean leaf) {
        long id = nextId.getAndIncrement();
        BTreeNode<K, V> node = new DefaultBTreeNode<>(id, leaf, config.maxKeys(), comparator);
        nodes.put(id, node);
        return node;
    }

    @Override
    public BTreeNode<K, V> readNode(long nodeId) {
        BTreeNode<K, V> node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalStateException("Node with id " + nodeId + " is not allocated.");
        }
        return node;
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    public Set<Long> getAllAllocatedNodeIds() {
        return Set.copyOf(nodes.keySet());
    }
}
