package io.github.blockir.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for a piece of side-data (of type {@code T}) stored in an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity, and ordered by the order in which they were
 * {@link #create(Class, String) created}. That order is only stable within a single run.
 *
 * @param <T> The type of the value associated with the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final Class<T> type;
    private final String name;
    private final int id = NEXT_ID.getAndIncrement();

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext with the given name.
     * <p>
     * {@code type} only needs to be a superclass of the values that will be stored,
     * since class literals cannot name generic types. It is kept for debugging.
     *
     * @param type The most specific class of the ext's values that can be written down.
     * @param name The name of the ext.
     * @param <T>  The class type.
     * @param <R>  The value type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the class this ext was created with.
     *
     * @return The class.
     */
    public Class<T> getType() {
        return type;
    }

    /**
     * Get the name this ext was created with.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Look this ext up in a container.
     *
     * @param ec The container.
     * @return The value, if present.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
