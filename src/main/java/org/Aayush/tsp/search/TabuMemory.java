package org.Aayush.tsp.search;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.config.SolverConfigurationException;

import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Bounded FIFO of recently accepted keys with O(1) membership.
 *
 * <p>Keys are compared by {@code equals}. A key pushed twice occupies two slots and stays tabu until
 * both copies have been evicted. Not thread-safe; one instance belongs to one search.</p>
 *
 * @param <K> key type.
 */
public final class TabuMemory<K> {
    private final int capacity;
    private final ArrayDeque<K> order;
    private final Object2IntOpenHashMap<K> counts;

    /**
     * @param tenure number of most recent keys that remain tabu.
     * @throws SolverConfigurationException when {@code tenure <= 0}.
     */
    public TabuMemory(int tenure) {
        this.capacity = ParameterMap.requireAtLeast(TabuSearchConfig.TABU_TENURE, tenure, 1);
        this.order = new ArrayDeque<>(tenure);
        this.counts = new Object2IntOpenHashMap<>(tenure);
        this.counts.defaultReturnValue(0);
    }

    /**
     * Records {@code key}, evicting the oldest entry when full.
     *
     * @return evicted key, or null when nothing was evicted.
     */
    public K push(K key) {
        Objects.requireNonNull(key, "key");
        K evicted = null;
        if (order.size() == capacity) {
            evicted = order.pollFirst();
            int remaining = counts.getInt(evicted) - 1;
            if (remaining <= 0) {
                counts.removeInt(evicted);
            } else {
                counts.put(evicted, remaining);
            }
        }
        order.addLast(key);
        counts.addTo(key, 1);
        return evicted;
    }

    public boolean contains(K key) {
        return counts.getInt(key) > 0;
    }

    public int size() {
        return order.size();
    }
}
