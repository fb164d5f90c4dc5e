package org.orderedindex.node;

public interface BTreeNode<K, V> {
    long id();

    boolean isLeaf();

    int numKeys();

    boolean isFull();

    K key(int idx);

    V value(int idx);

    void value(int idx, V value);

    long child(int idx);

    /**
     * Position of the first key that is greater than or equal to {@code key},
     * {@link #numKeys()} when every stored key is smaller.
     */
    int searchKeyIdx(K key);

    boolean matches(int idx, K key);

    void put(int idx, K key, V value);

    void addChild(int idx, K key, V value, long rightChildId);

    void firstChild(long childId);

    void copy(BTreeNode<K, V> node, int startIdx, int endIdx);

    void remove(int startIdx, int endIdx);
}
