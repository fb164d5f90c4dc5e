package org.orderedindex.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.orderedindex.IndexConfig;
import org.orderedindex.node.BTreeNode;
import org.orderedindex.node.MapBasedNodeManager;

import java.util.Comparator;

import static org.junit.jupiter.api.Assertions.*;

public class TreeValidatorTest {
    private MapBasedNodeManager<Integer, String> nodeManager;
    private TreeValidator<Integer, String> validator;

    @BeforeEach
    void setUp() {
        nodeManager = new MapBasedNodeManager<>(IndexConfig.of(2), Comparator.naturalOrder());
        validator = new TreeValidator<>(nodeManager);
    }

    private BTreeNode<Integer, String> leaf(int... keys) {
        BTreeNode<Integer, String> leaf = nodeManager.allocateLeafNode();
        for (int i = 0; i < keys.length; i++) {
            leaf.put(i, keys[i], "v" + keys[i]);
        }
        return leaf;
    }

    private BTreeNode<Integer, String> internal(BTreeNode<Integer, String> first, Object... keyAndChild) {
        BTreeNode<Integer, String> node = nodeManager.allocateNode();
        node.firstChild(first.id());
        for (int i = 0; i < keyAndChild.length; i += 2) {
            Integer key = (Integer) keyAndChild[i];
            @SuppressWarnings("unchecked")
            BTreeNode<Integer, String> child = (BTreeNode<Integer, String>) keyAndChild[i + 1];
            node.addChild(i / 2, key, "v" + key, child.id());
        }
        return node;
    }

    @Test
    public void shouldAcceptEmptyRoot() {
        TreeStats stats = validator.validate(leaf());
        assertEquals(new TreeStats(1, 1, 1, 0), stats);
    }

    @Test
    public void shouldAcceptWellFormedTree() {
        BTreeNode<Integer, String> root = internal(leaf(1, 2), 5, leaf(6), 9, leaf(10, 11, 12));
        assertEquals(new TreeStats(2, 4, 3, 8), validator.validate(root));
    }

    @Test
    public void shouldDetectUnsortedKeys() {
        BTreeNode<Integer, String> root = leaf(3, 1);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate(root));
        assertTrue(e.getMessage().contains("ascending"));
    }

    @Test
    public void shouldDetectKeyOutsideParentBounds() {
        BTreeNode<Integer, String> root = internal(leaf(1, 7), 5, leaf(6));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate(root));
        assertTrue(e.getMessage().contains("bounds"));
    }

    @Test
    public void shouldDetectPromotedKeyLeftInChild() {
        BTreeNode<Integer, String> root = internal(leaf(1, 5), 5, leaf(6));
        assertThrows(IllegalStateException.class, () -> validator.validate(root));
    }

    @Test
    public void shouldDetectUnderfullNode() {
        BTreeNode<Integer, String> root = internal(leaf(), 5, leaf(6));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate(root));
        assertTrue(e.getMessage().contains("min"));
    }

    @Test
    public void shouldDetectLeavesAtDifferentDepth() {
        BTreeNode<Integer, String> deep = internal(leaf(1), 2, leaf(3));
        BTreeNode<Integer, String> root = internal(deep, 5, leaf(6));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate(root));
        assertTrue(e.getMessage().contains("depth"));
    }

    @Test
    public void shouldDetectNodeReachableTwice() {
        BTreeNode<Integer, String> root = nodeManager.allocateNode();
        root.firstChild(root.id());
        root.addChild(0, 5, "v5", leaf(6).id());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate(root));
        assertTrue(e.getMessage().contains("more than once"));
    }
}
