package org.orderedindex;

import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

public interface OrderedIndex<K, V> {

    Optional<V> search(K key);

    /**
     * Stores {@code value} under {@code key}. A key that is already present gets its value replaced.
     */
    void insert(K key, V value);

    int size();

    int height();

    int degree();

    List<K> getAllKeysInOrder();

    void forEachInOrder(BiConsumer<? super K, ? super V> action);
}
