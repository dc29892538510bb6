/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.feature;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Row-aligned features of a metric series. Row i belongs to point i of the series; column 0 is the raw value.
 *
 * Instances are immutable: the constructor and all accessors copy.
 */
public class FeatureMatrix {
    public static final int VALUE_COLUMN = 0;

    private final double[][] rows;
    private final List<String> columnNames;

    public FeatureMatrix(double[][] rows, List<String> columnNames) {
        Preconditions.checkArgument(columnNames != null && !columnNames.isEmpty(), "columns should be set");
        this.columnNames = ImmutableList.copyOf(columnNames);
        this.rows = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            Preconditions
                .checkArgument(
                    rows[i].length == this.columnNames.size(),
                    "row %s has %s columns, expected %s",
                    i,
                    rows[i].length,
                    this.columnNames.size()
                );
            this.rows[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
    }

    public int getRowCount() {
        return rows.length;
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public double get(int row, int column) {
        return rows[row][column];
    }

    public double[] getRow(int row) {
        return Arrays.copyOf(rows[row], rows[row].length);
    }

    public double[] getColumn(int column) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][column];
        }
        return values;
    }

    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FeatureMatrix that = (FeatureMatrix) o;
        return Arrays.deepEquals(rows, that.rows) && Objects.equals(columnNames, that.columnNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.deepHashCode(rows), columnNames);
    }
}
