package io.github.blockir.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A list view that reports every element entering or leaving it,
 * so that owners can keep back-references of their elements up to date.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    /**
     * Construct a tracked list viewing the given list. Elements already in
     * {@code viewed} are not reported.
     *
     * @param viewed The backing list.
     */
    protected TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    /**
     * Called before an element is put in the list.
     *
     * @param elt The element.
     */
    protected abstract void onAdded(E elt);

    /**
     * Called after an element is taken out of the list.
     *
     * @param elt The element.
     */
    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public boolean add(E e) {
        onAdded(e);
        return viewed.add(e);
    }

    @Override
    public void add(int index, E element) {
        if (index < 0 || index > viewed.size()) {
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + viewed.size());
        }
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E set(int index, E element) {
        E old = viewed.get(index);
        if (old == element) return old;
        onAdded(element);
        viewed.set(index, element);
        onRemoved(old);
        return old;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        List<E> removed = new ArrayList<>(viewed);
        viewed.clear();
        for (E e : removed) {
            onRemoved(e);
        }
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        if (index < 0 || index > viewed.size()) {
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + viewed.size());
        }
        // one at a time, so elements before a rejected one stay inserted and tracked
        int i = index;
        for (E e : new ArrayList<>(c)) {
            add(i++, e);
        }
        return i != index;
    }

    @NotNull
    @Override
    public ListIterator<E> listIterator(int index) {
        ListIterator<E> li = viewed.listIterator(index);
        return new ListIterator<E>() {
            E last;

            @Override
            public boolean hasNext() {
                return li.hasNext();
            }

            @Override
            public E next() {
                return last = li.next();
            }

            @Override
            public boolean hasPrevious() {
                return li.hasPrevious();
            }

            @Override
            public E previous() {
                return last = li.previous();
            }

            @Override
            public int nextIndex() {
                return li.nextIndex();
            }

            @Override
            public int previousIndex() {
                return li.previousIndex();
            }

            @Override
            public void remove() {
                li.remove();
                onRemoved(last);
                last = null;
            }

            @Override
            public void set(E e) {
                if (e == last) return;
                onAdded(e);
                li.set(e);
                onRemoved(last);
                last = e;
            }

            @Override
            public void add(E e) {
                onAdded(e);
                li.add(e);
                last = null;
            }
        };
    }
}
