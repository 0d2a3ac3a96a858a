package org.metapatch.render;

/**
 * Hands out increasing numeric ids for one pool. Seeded from the ids already present in the document, so new ids
 * never collide with existing ones.
 */
public final class IdAllocator {

    private final String pool;
    private int next;

    public IdAllocator(String pool, int first) {
        this.pool = pool;
        this.next = first;
    }

    public int next() {
        return next++;
    }

    public int peek() {
        return next;
    }

    /** Makes sure ids up to {@code id} are never handed out. */
    public void reserve(int id) {
        if (id >= next) next = id + 1;
    }

    public String pool() {
        return pool;
    }

    @Override
    public String toString() {
        return pool + "@" + next;
    }
}
