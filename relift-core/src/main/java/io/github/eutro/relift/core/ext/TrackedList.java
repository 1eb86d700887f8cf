package io.github.eutro.relift.core.ext;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A list view that is notified of every element entering or leaving it,
 * used to keep ownership exts in sync.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> backing;

    protected TrackedList(List<E> backing) {
        this.backing = backing;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return backing.get(index);
    }

    @Override
    public int size() {
        return backing.size();
    }

    @Override
    public E set(int index, E element) {
        onAdded(element);
        E old = backing.set(index, element);
        onRemoved(old);
        return old;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        backing.add(index, element);
        modCount++;
    }

    @Override
    public E remove(int index) {
        E old = backing.remove(index);
        onRemoved(old);
        modCount++;
        return old;
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        List<E> range = backing.subList(fromIndex, toIndex);
        for (E e : range) {
            onRemoved(e);
        }
        range.clear();
        modCount++;
    }
}
