package org.orderedindex;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;

/**
 * Guards an index with one read/write lock. Readers share the lock, an insert holds it exclusively
 * because a split in progress leaves keys temporarily under the wrong child.
 */
public class LockingOrderedIndex<K, V> implements OrderedIndex<K, V> {
    private final OrderedIndex<K, V> delegate;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public LockingOrderedIndex(OrderedIndex<K, V> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public Optional<V> search(K key) {
        lock.readLock().lock();
        try {
            return delegate.search(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void insert(K key, V value) {
        lock.writeLock().lock();
        try {
            delegate.insert(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return delegate.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int height() {
        lock.readLock().lock();
        try {
            return delegate.height();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int degree() {
        return delegate.degree();
    }

    @Override
    public List<K> getAllKeysInOrder() {
        lock.readLock().lock();
        try {
            return delegate.getAllKeysInOrder();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The action runs while the read lock is held, so it must not insert into this index.
     */
    @Override
    public void forEachInOrder(BiConsumer<? super K, ? super V> action) {
        lock.readLock().lock();
        try {
            delegate.forEachInOrder(action);
        } finally {
            lock.readLock().unlock();
        }
    }
}
