package ch.so.arp.rag.engine.backend.memory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.IntPredicate;

/**
 * Exhaustive-search vector arena. Vectors are packed into one float array and
 * addressed by position. Removing a vector moves the last vector into the
 * freed slot, so positions are not stable across removals; callers that need
 * stable ids wrap this index in an {@link IdMapVectorIndex}.
 */
class FlatVectorIndex {

    private final int dimension;
    private final DistanceMetric metric;
    private float[] data;
    private int size;

    FlatVectorIndex(int dimension, DistanceMetric metric) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.metric = metric;
        this.data = new float[dimension * 16];
    }

    int dimension() {
        return dimension;
    }

    DistanceMetric metric() {
        return metric;
    }

    int size() {
        return size;
    }

    /**
     * Appends a vector.
     *
     * @return its position
     */
    int add(float[] vector) {
        checkDimension(vector);
        if ((size + 1) * dimension > data.length) {
            data = Arrays.copyOf(data, Math.max(data.length * 2, (size + 1) * dimension));
        }
        System.arraycopy(vector, 0, data, size * dimension, dimension);
        return size++;
    }

    float[] get(int position) {
        checkPosition(position);
        return Arrays.copyOfRange(data, position * dimension, (position + 1) * dimension);
    }

    /**
     * Removes the vector at {@code position}.
     *
     * @return the former position of the vector that now occupies
     *         {@code position}, or {@code -1} if no vector moved
     */
    int remove(int position) {
        checkPosition(position);
        int last = size - 1;
        size--;
        if (position == last) {
            return -1;
        }
        System.arraycopy(data, last * dimension, data, position * dimension, dimension);
        return last;
    }

    /**
     * Returns up to {@code k} positions, closest first. Positions rejected by
     * {@code accept} are not considered.
     */
    List<Hit> search(float[] query, int k, IntPredicate accept) {
        checkDimension(query);
        if (k <= 0 || size == 0) {
            return List.of();
        }
        Comparator<Hit> worstFirst = (left, right) -> {
            if (left.score() == right.score()) {
                return Integer.compare(right.position(), left.position());
            }
            return metric.closer(left.score(), right.score()) ? 1 : -1;
        };
        PriorityQueue<Hit> heap = new PriorityQueue<>(Math.min(k, size) + 1, worstFirst);
        for (int position = 0; position < size; position++) {
            if (!accept.test(position)) {
                continue;
            }
            Hit hit = new Hit(position, metric.score(data, position * dimension, query, dimension));
            if (heap.size() < k) {
                heap.add(hit);
            } else if (worstFirst.compare(hit, heap.peek()) > 0) {
                heap.poll();
                heap.add(hit);
            }
        }
        List<Hit> hits = new ArrayList<>(heap);
        hits.sort(worstFirst.reversed());
        return hits;
    }

    private void checkDimension(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException("Expected a vector with " + dimension + " dimensions but got "
                    + (vector == null ? "null" : vector.length));
        }
    }

    private void checkPosition(int position) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("position " + position + " outside [0, " + size + ")");
        }
    }

    record Hit(int position, float score) {
    }
}
