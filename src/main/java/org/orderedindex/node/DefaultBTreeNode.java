package org.orderedindex.node;

import java.util.Arrays;
import java.util.Comparator;

public class DefaultBTreeNode<K, V> implements BTreeNode<K, V> {
    private static final long NO_CHILD = -1;

    private final long id;
    private final boolean leaf;
    private final Comparator<? super K> comparator;
    private final Object[] keys;
    private final Object[] values;
    private final long[] children;

    private int numKeys = 0;

    public DefaultBTreeNode(long id, boolean leaf, int maxKeys, Comparator<? super K> comparator) {
        this.id = id;
        this.leaf = leaf;
        this.comparator = comparator;
        this.keys = new Object[maxKeys];
        this.values = new Object[maxKeys];
        // children should have +1 because the first key should have left children reference
        this.children = leaf ? new long[0] : new long[maxKeys + 1];
        Arrays.fill(this.children, NO_CHILD);
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public boolean isLeaf() {
        return leaf;
    }

    @Override
    public int numKeys() {
        return numKeys;
    }

    @Override
    public boolean isFull() {
        return numKeys == keys.length;
    }

    @Override
    @SuppressWarnings("unchecked")
    public K key(int idx) {
        checkIdx(idx);
        return (K) keys[idx];
    }

    @Override
    @SuppressWarnings("unchecked")
    public V value(int idx) {
        checkIdx(idx);
        return (V) values[idx];
    }

    @Override
    public void value(int idx, V value) {
        checkIdx(idx);
        values[idx] = value;
    }

    @Override
    public long child(int idx) {
        if (leaf) {
            throw new UnsupportedOperationException("Leaf nodes do not have children.");
        }
        if (idx < 0 || idx > numKeys) {
            throw new IndexOutOfBoundsException("Child index " + idx + " out of range for node " + id + " with " + numKeys + " keys");
        }
        return children[idx];
    }

    @Override
    public int searchKeyIdx(K key) {
        int idx = 0;
        while (idx < numKeys && compare(idx, key) < 0) {
            idx++;
        }
        return idx;
    }

    @Override
    public boolean matches(int idx, K key) {
        return idx < numKeys && compare(idx, key) == 0;
    }

    @Override
    public void put(int idx, K key, V value) {
        if (!leaf) {
            throw new UnsupportedOperationException("Internal nodes only receive keys together with a child, use addChild.");
        }
        ensureRoomAt(idx);
        System.arraycopy(keys, idx, keys, idx + 1, numKeys - idx);
        System.arraycopy(values, idx, values, idx + 1, numKeys - idx);
        keys[idx] = key;
        values[idx] = value;
        numKeys++;
    }

    @Override
    public void addChild(int idx, K key, V value, long rightChildId) {
        if (leaf) {
            throw new UnsupportedOperationException("Leaf nodes do not have children.");
        }
        ensureRoomAt(idx);
        System.arraycopy(keys, idx, keys, idx + 1, numKeys - idx);
        System.arraycopy(values, idx, values, idx + 1, numKeys - idx);
        System.arraycopy(children, idx + 1, children, idx + 2, numKeys - idx);
        keys[idx] = key;
        values[idx] = value;
        children[idx + 1] = rightChildId;
        numKeys++;
    }

    @Override
    public void firstChild(long childId) {
        if (leaf) {
            throw new UnsupportedOperationException("Leaf nodes do not have children.");
        }
        if (numKeys != 0 || children[0] != NO_CHILD) {
            throw new IllegalStateException("Node " + id + " already has content, cannot set its first child");
        }
        children[0] = childId;
    }

    @Override
    public void copy(BTreeNode<K, V> node, int startIdx, int endIdx) {
        if (node.isLeaf() != leaf) {
            throw new IllegalArgumentException("Cannot copy between leaf and internal nodes.");
        }
        if (numKeys != 0) {
            throw new IllegalStateException("Node " + id + " must be empty to receive copied entries");
        }
        int count = endIdx - startIdx;
        if (count > keys.length) {
            throw new IllegalArgumentException("Cannot copy " + count + " entries into node " + id + " of capacity " + keys.length);
        }
        for (int i = 0; i < count; i++) {
            keys[i] = node.key(startIdx + i);
            values[i] = node.value(startIdx + i);
        }
        if (!leaf) {
            for (int i = 0; i <= count; i++) {
                children[i] = node.child(startIdx + i);
            }
        }
        numKeys = count;
    }

    @Override
    public void remove(int startIdx, int endIdx) {
        if (startIdx < 0 || endIdx > numKeys || startIdx > endIdx) {
            throw new IndexOutOfBoundsException("Cannot remove [" + startIdx + ", " + endIdx + ") from node " + id + " with " + numKeys + " keys");
        }
        int removed = endIdx - startIdx;
        System.arraycopy(keys, endIdx, keys, startIdx, numKeys - endIdx);
        System.arraycopy(values, endIdx, values, startIdx, numKeys - endIdx);
        Arrays.fill(keys, numKeys - removed, numKeys, null);
        Arrays.fill(values, numKeys - removed, numKeys, null);
        if (!leaf) {
            // the child left of the first removed key stays, the ones right of removed keys go
            System.arraycopy(children, endIdx + 1, children, startIdx + 1, numKeys - endIdx);
            Arrays.fill(children, numKeys - removed + 1, numKeys + 1, NO_CHILD);
        }
        numKeys -= removed;
    }

    public long[] children() {
        return leaf ? new long[0] : Arrays.copyOf(children, numKeys + 1);
    }

    @SuppressWarnings("unchecked")
    private int compare(int idx, K key) {
        return comparator.compare((K) keys[idx], key);
    }

    private void checkIdx(int idx) {
        if (idx < 0 || idx >= numKeys) {
            throw new IndexOutOfBoundsException("Key index " + idx + " out of range for node " + id + " with " + numKeys + " keys");
        }
    }

    private void ensureRoomAt(int idx) {
        if (isFull()) {
            throw new IllegalStateException("Node " + id + " is full, it has to be split before insert");
        }
        if (idx < 0 || idx > numKeys) {
            throw new IndexOutOfBoundsException("Insert position " + idx + " out of range for node " + id + " with " + numKeys + " keys");
        }
    }

    @Override
    public String toString() {
        return "DefaultBTreeNode{" +
                "id=" + id +
                ", l=" + leaf +
                ", keys=" + Arrays.toString(Arrays.copyOf(keys, numKeys)) +
                ", children=" + Arrays.toString(children()) +
                '}';
    }
}
