package ch.so.arp.rag.engine.backend.memory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongPredicate;

/**
 * Assigns caller-chosen numeric ids to the vectors of a
 * {@link FlatVectorIndex}. The flat index moves vectors around on removal; this
 * wrapper keeps the position table in sync so that the id of a surviving
 * vector never changes.
 */
class IdMapVectorIndex {

    private final FlatVectorIndex flat;
    private final Map<Long, Integer> positionsById = new HashMap<>();
    private long[] idsByPosition = new long[16];

    IdMapVectorIndex(int dimension, DistanceMetric metric) {
        this.flat = new FlatVectorIndex(dimension, metric);
    }

    int dimension() {
        return flat.dimension();
    }

    DistanceMetric metric() {
        return flat.metric();
    }

    int size() {
        return flat.size();
    }

    boolean contains(long id) {
        return positionsById.containsKey(id);
    }

    void addWithId(long id, float[] vector) {
        if (positionsById.containsKey(id)) {
            throw new IllegalArgumentException("id " + id + " is already present");
        }
        int position = flat.add(vector);
        if (position >= idsByPosition.length) {
            idsByPosition = Arrays.copyOf(idsByPosition, Math.max(idsByPosition.length * 2, position + 1));
        }
        idsByPosition[position] = id;
        positionsById.put(id, position);
    }

    float[] get(long id) {
        Integer position = positionsById.get(id);
        if (position == null) {
            throw new IllegalArgumentException("Unknown id " + id);
        }
        return flat.get(position);
    }

    /**
     * @return {@code true} if the id was present
     */
    boolean remove(long id) {
        Integer position = positionsById.remove(id);
        if (position == null) {
            return false;
        }
        int moved = flat.remove(position);
        if (moved >= 0) {
            long movedId = idsByPosition[moved];
            idsByPosition[position] = movedId;
            positionsById.put(movedId, position);
        }
        return true;
    }

    List<IdHit> search(float[] query, int k, LongPredicate accept) {
        List<FlatVectorIndex.Hit> hits = flat.search(query, k, position -> accept.test(idsByPosition[position]));
        List<IdHit> result = new ArrayList<>(hits.size());
        for (FlatVectorIndex.Hit hit : hits) {
            result.add(new IdHit(idsByPosition[hit.position()], hit.score()));
        }
        return result;
    }

    record IdHit(long id, float score) {
    }
}
