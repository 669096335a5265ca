package com.aegis.governance.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Append-only log that keeps the most recent {@code capacity} elements. Once full, every append
 * evicts the oldest element. Thread-safe.
 *
 * @param <T> element type
 */
public final class BoundedLog<T> {

    /** Retention used when a component is not told otherwise. */
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<T> elements = new ArrayDeque<>();

    public BoundedLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void append(T element) {
        if (element == null) {
            throw new IllegalArgumentException("element must not be null");
        }
        if (elements.size() == capacity) {
            elements.removeFirst();
        }
        elements.addLast(element);
    }

    /**
     * Replaces the newest element matching {@code match} with {@code update} applied to it.
     *
     * @return the replacement, or empty if no retained element matches
     */
    public synchronized Optional<T> replaceLast(Predicate<? super T> match, UnaryOperator<T> update) {
        List<T> copy = new ArrayList<>(elements);
        ListIterator<T> it = copy.listIterator(copy.size());
        while (it.hasPrevious()) {
            T element = it.previous();
            if (match.test(element)) {
                T replacement = update.apply(element);
                it.set(replacement);
                elements.clear();
                elements.addAll(copy);
                return Optional.of(replacement);
            }
        }
        return Optional.empty();
    }

    /** Newest element matching {@code match}. */
    public synchronized Optional<T> findLast(Predicate<? super T> match) {
        Iterator<T> it = elements.descendingIterator();
        while (it.hasNext()) {
            T element = it.next();
            if (match.test(element)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    /** Retained elements, oldest first. */
    public synchronized List<T> snapshot() {
        return List.copyOf(elements);
    }

    public synchronized List<T> filter(Predicate<? super T> match) {
        return elements.stream().filter(match).toList();
    }

    public synchronized int size() {
        return elements.size();
    }

    public int capacity() {
        return capacity;
    }
}
