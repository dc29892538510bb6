/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.stats;

import java.util.function.Supplier;

import io.saimon.ad.stats.suppliers.CounterSupplier;

/**
 * Class represents a stat the engine keeps track of
 */
public class EngineStat<T> {
    private Supplier<T> supplier;

    /**
     * Constructor
     *
     * @param supplier supplier that returns the stat's value
     */
    public EngineStat(Supplier<T> supplier) {
        this.supplier = supplier;
    }

    /**
     * Get the value of the statistic
     *
     * @return T value of the stat
     */
    public T getValue() {
        return supplier.get();
    }

    /**
     * Increments the supplier if it can be incremented
     */
    public void increment() {
        if (supplier instanceof CounterSupplier) {
            ((CounterSupplier) supplier).increment();
        }
    }

    /**
     * Adds to the supplier if it is a counter
     *
     * @param delta amount to add
     */
    public void add(long delta) {
        if (supplier instanceof CounterSupplier) {
            ((CounterSupplier) supplier).add(delta);
        }
    }
}
