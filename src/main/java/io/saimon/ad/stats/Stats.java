/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.stats;

import java.util.Map;
import java.util.TreeMap;

import io.saimon.ad.stats.suppliers.CounterSupplier;

public class Stats {
    private Map<String, EngineStat<?>> stats;

    /**
     * Constructor
     *
     * @param stats Map of the stats that are to be kept
     */
    public Stats(Map<String, EngineStat<?>> stats) {
        this.stats = stats;
    }

    /**
     * @return stats with one counter for every name in {@link StatNames}
     */
    public static Stats withCounters() {
        Map<String, EngineStat<?>> stats = new TreeMap<>();
        for (StatNames statName : StatNames.values()) {
            stats.put(statName.getName(), new EngineStat<>(new CounterSupplier()));
        }
        return new Stats(stats);
    }

    /**
     * Get the stats
     *
     * @return all of the stats
     */
    public Map<String, EngineStat<?>> getStats() {
        return stats;
    }

    /**
     * Get individual stat by stat name
     *
     * @param key Name of stat
     * @return EngineStat
     * @throws IllegalArgumentException thrown on illegal statName
     */
    public EngineStat<?> getStat(String key) throws IllegalArgumentException {
        if (!stats.keySet().contains(key)) {
            throw new IllegalArgumentException("Stat=\"" + key + "\" does not exist");
        }
        return stats.get(key);
    }

    public void increment(StatNames statName) {
        getStat(statName.getName()).increment();
    }

    public void add(StatNames statName, long delta) {
        getStat(statName.getName()).add(delta);
    }

    /**
     * @return current value of every stat, by name
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> values = new TreeMap<>();
        for (Map.Entry<String, EngineStat<?>> entry : stats.entrySet()) {
            values.put(entry.getKey(), entry.getValue().getValue());
        }
        return values;
    }
}
