package org.orderedindex;

/**
 * Branching parameters of a B-Tree index.
 *
 * @param degree minimum branching factor {@code t}; a node carries at most {@code 2t-1} keys
 *               and an internal node at most {@code 2t} children
 */
public record IndexConfig(int degree) {
    public static final int MIN_DEGREE = 2;
    // 2 * degree has to fit into an int
    public static final int MAX_DEGREE = Integer.MAX_VALUE / 2;
    public static final int DEFAULT_DEGREE = 16;

    public IndexConfig {
        if (degree < MIN_DEGREE) {
            throw new ConfigurationException("Degree must be at least " + MIN_DEGREE + " but was " + degree);
        }
        if (degree > MAX_DEGREE) {
            throw new ConfigurationException("Degree must be at most " + MAX_DEGREE + " but was " + degree);
        }
    }

    public static IndexConfig of(int degree) {
        return new IndexConfig(degree);
    }

    public static IndexConfig defaults() {
        return new IndexConfig(DEFAULT_DEGREE);
    }

    public int maxKeys() {
        return 2 * degree - 1;
    }

    // root is exempt
    public int minKeys() {
        return degree - 1;
    }

    public int maxChildren() {
        return 2 * degree;
    }
}
