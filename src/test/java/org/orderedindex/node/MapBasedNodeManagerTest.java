package org.orderedindex.node;

import org.junit.jupiter.api.Test;
import org.orderedindex.BTreeIndex;
import org.orderedindex.IndexConfig;

import java.util.Comparator;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MapBasedNodeManagerTest {

    @Test
    public void shouldAllocateNodesWithDistinctIds() {
        MapBasedNodeManager<Integer, String> nodeManager = new MapBasedNodeManager<>(IndexConfig.of(2), Comparator.naturalOrder());
        BTreeNode<Integer, String> leaf = nodeManager.allocateLeafNode();
        BTreeNode<Integer, String> internal = nodeManager.allocateNode();

        assertNotEquals(leaf.id(), internal.id());
        assertTrue(leaf.isLeaf());
        assertFalse(internal.isLeaf());
        assertEquals(2, nodeManager.nodeCount());
        assertEquals(Set.of(leaf.id(), internal.id()), nodeManager.getAllAllocatedNodeIds());
    }

    @Test
    public void shouldSizeNodesFromConfig() {
        MapBasedNodeManager<Integer, String> nodeManager = new MapBasedNodeManager<>(IndexConfig.of(2), Comparator.naturalOrder());
        BTreeNode<Integer, String> leaf = nodeManager.allocateLeafNode();
        for (int i = 0; i < 3; i++) {
            leaf.put(i, i, "v" + i);
        }
        assertTrue(leaf.isFull());
    }

    @Test
    public void shouldReadBackSameNode() {
        MapBasedNodeManager<Integer, String> nodeManager = new MapBasedNodeManager<>(IndexConfig.of(3), Comparator.naturalOrder());
        BTreeNode<Integer, String> leaf = nodeManager.allocateLeafNode();
        leaf.put(0, 7, "seven");
        assertSame(leaf, nodeManager.readNode(leaf.id()));
        assertEquals("seven", nodeManager.readNode(leaf.id()).value(0));
    }

    @Test
    public void shouldNotExposeArenaThroughAllocatedIds() {
        MapBasedNodeManager<Integer, String> nodeManager = new MapBasedNodeManager<>(IndexConfig.of(2), Comparator.naturalOrder());
        BTreeIndex<Integer, String> tree = new BTreeIndex<>(nodeManager);
        for (int i = 0; i < 10; i++) {
            tree.insert(i, "v" + i);
        }
        Set<Long> ids = nodeManager.getAllAllocatedNodeIds();
        int nodeCount = nodeManager.nodeCount();

        assertThrows(UnsupportedOperationException.class, ids::clear);
        assertThrows(UnsupportedOperationException.class, () -> ids.remove(ids.iterator().next()));
        assertEquals(nodeCount, nodeManager.nodeCount());
        for (int i = 0; i < 10; i++) {
            assertEquals(Optional.of("v" + i), tree.search(i));
        }
        tree.validate();
    }

    @Test
    public void shouldAllocateIncreasingIds() {
        MapBasedNodeManager<Integer, String> nodeManager = new MapBasedNodeManager<>(IndexConfig.of(2), Comparator.naturalOrder());
        long previous = nodeManager.allocateLeafNode().id();
        for (int i = 0; i < 20; i++) {
            BTreeNode<Integer, String> node = i % 2 == 0 ? nodeManager.allocateNode() : nodeManager.allocateLeafNode();
            assertTrue(node.id() > previous);
            assertSame(node, nodeManager.readNode(node.id()));
            previous = node.id();
        }
        assertEquals(21, nodeManager.nodeCount());
    }

    @Test
    public void shouldFailOnUnknownNode() {
        MapBasedNodeManager<Integer, String> nodeManager = new MapBasedNodeManager<>(IndexConfig.of(3), Comparator.naturalOrder());
        assertThrows(IllegalStateException.class, () -> nodeManager.readNode(42));
        assertThrows(IllegalStateException.class, () -> nodeManager.readNode(-1));
    }
}
