package io.github.eutro.kcse.ir;

import java.util.*;

/**
 * A list view that is told about every element entering or leaving it.
 * <p>
 * {@link #onRemoved(Object)} is always called after the element is gone from the list,
 * so it may inspect the list to see whether another occurrence remains.
 *
 * @param <E> The element type.
 */
abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

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
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
        modCount++;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        modCount++;
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        List<E> removed = new ArrayList<>(viewed);
        viewed.clear();
        modCount++;
        for (E e : removed) {
            onRemoved(e);
        }
    }
}
