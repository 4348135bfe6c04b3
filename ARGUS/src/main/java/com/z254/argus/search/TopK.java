package com.z254.argus.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Bounded collector keeping the {@code k} smallest distances.
 */
final class TopK {

    private static final Comparator<Neighbor> NEAREST_FIRST = Comparator
            .comparingDouble(Neighbor::distance)
            .thenComparingInt(Neighbor::position);

    private final int k;
    private final PriorityQueue<Neighbor> heap;

    TopK(int k) {
        this.k = k;
        this.heap = new PriorityQueue<>(Math.max(1, k), NEAREST_FIRST.reversed());
    }

    void offer(int position, float distance) {
        if (k <= 0) {
            return;
        }
        if (heap.size() < k) {
            heap.add(new Neighbor(position, distance));
        } else {
            Neighbor worst = heap.peek();
            if (distance < worst.distance()
                    || (distance == worst.distance() && position < worst.position())) {
                heap.poll();
                heap.add(new Neighbor(position, distance));
            }
        }
    }

    List<Neighbor> toSortedList() {
        List<Neighbor> out = new ArrayList<>(heap);
        out.sort(NEAREST_FIRST);
        return Collections.unmodifiableList(out);
    }

    static Comparator<Neighbor> nearestFirst() {
        return NEAREST_FIRST;
    }
}
