package com.entity.consolidation.merge;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Redirect forest over entity ids. An id with no parent is its own root.
 * Finds compress paths, so repeated lookups along a chain are constant time.
 */
class DisjointSet {
    private final Map<Long, Long> parent = new HashMap<>();

    /**
     * Root of the tree containing {@code id}.
     */
    long find(long id) {
        long root = id;
        Long next;
        while ((next = parent.get(root)) != null) {
            root = next;
        }
        List<Long> path = new ArrayList<>();
        long node = id;
        while (node != root) {
            path.add(node);
            node = parent.get(node);
        }
        for (Long n : path) {
            parent.put(n, root);
        }
        return root;
    }

    /**
     * Whether {@code id} already points somewhere else.
     */
    boolean isRedirected(long id) {
        return parent.containsKey(id);
    }

    /**
     * Attaches the root {@code child} below {@code root}.
     */
    void attach(long child, long root) {
        if (child == root) {
            throw new IllegalArgumentException("Cannot attach " + child + " to itself");
        }
        if (parent.containsKey(child)) {
            throw new IllegalStateException("Entity " + child + " is already redirected");
        }
        parent.put(child, root);
    }

    int size() {
        return parent.size();
    }
}
