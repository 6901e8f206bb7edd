package io.fullerstack.stages.container;

/**
 * The family a backing container belongs to.
 *
 * <p>The kind decides how {@link ContainerAdapter#insert(java.util.Collection, Object)} behaves
 * and which container a mapped stage materializes into.
 */
public enum ContainerKind {

    /** Ordered, duplicates allowed; insertion appends. */
    SEQUENCE(false),

    /** Unordered, unique elements by {@code equals}/{@code hashCode}. */
    HASH_SET(true),

    /** Unique elements by {@code equals}/{@code hashCode}, iterated in first-insertion order. */
    LINKED_HASH_SET(true),

    /** Unique elements kept sorted by natural order or a comparator. */
    ORDERED_SET(true);

    private final boolean unique;

    ContainerKind(boolean unique) {
        this.unique = unique;
    }

    /**
     * @return true if inserting an element already present leaves the container unchanged
     */
    public boolean isUnique() {
        return unique;
    }
}
