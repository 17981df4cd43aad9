package org.digraph.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Min-priority queue of {@link FrontierEntry} values for label-setting search.
 *
 * <p>Entries are never updated in place: a node may be queued several times and stale
 * entries are discarded by the caller when popped. Ties on distance are broken by a
 * monotonically increasing insertion sequence, which makes extraction order deterministic
 * for a deterministic insertion order.</p>
 *
 * <p>This class is NOT thread-safe.</p>
 *
 * @param <N> node type.
 */
public final class FrontierQueue<N> {
    private static final int DEFAULT_CAPACITY = 16;

    // Binary heap, 1-based indexing for simpler parent/child math
    private FrontierEntry<N>[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    private long nextSequence = 0L;

    // Diagnostics
    @Getter
    private int peakSize = 0;

    public FrontierQueue() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a queue with the given initial capacity; it grows on demand.
     *
     * @throws IllegalArgumentException if capacity is not positive.
     */
    @SuppressWarnings("unchecked")
    public FrontierQueue(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.heap = (FrontierEntry<N>[]) new FrontierEntry<?>[initialCapacity + 1];
    }

    /**
     * Queues {@code node} at {@code distance}, reached from {@code predecessor}.
     *
     * @return the queued entry, carrying its assigned sequence number.
     */
    public FrontierEntry<N> insert(double distance, N node, N predecessor) {
        FrontierEntry<N> entry = new FrontierEntry<>(distance, nextSequence++, node, predecessor);
        if (size >= heap.length - 1) {
            heap = Arrays.copyOf(heap, heap.length * 2);
        }
        size++;
        heap[size] = entry;
        swim(size);
        if (size > peakSize) {
            peakSize = size;
        }
        return entry;
    }

    /**
     * Removes and returns the entry with minimum distance (earliest inserted among equals).
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public FrontierEntry<N> extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        FrontierEntry<N> min = heap[1];
        heap[1] = heap[size];
        heap[size] = null;
        size--;
        if (size > 0) {
            sink(1);
        }
        return min;
    }

    /**
     * Returns the minimum entry without removing it.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public FrontierEntry<N> peek() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return heap[1];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Drops all entries. Sequence numbering continues, so ordering stays consistent across reuse.
     */
    public void clear() {
        Arrays.fill(heap, 1, size + 1, null);
        size = 0;
    }

    // --- Heap helpers ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        FrontierEntry<N> s = heap[i];
        heap[i] = heap[j];
        heap[j] = s;
    }
}
