package org.railyard.pipeline.api.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

/**
 * An immutable, column-oriented table of {@code double} values.
 * <p>
 * Columns keep their insertion order and always have the same number of rows.
 * Integral identifiers (object ids) are stored as doubles, which is exact up to 2^53.
 */
public final class Table {

    private final LinkedHashMap<String, double[]> columns;
    private final int numRows;

    private Table(LinkedHashMap<String, double[]> columns, int numRows) {
        this.columns = columns;
        this.numRows = numRows;
    }

    /**
     * Creates a table from the given columns. Arrays are copied.
     *
     * @param columns column name to values, in the desired column order
     * @return the table
     * @throws IllegalArgumentException if the columns differ in length
     */
    public static Table of(Map<String, double[]> columns) {
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>();
        int rows = -1;
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] values = Objects.requireNonNull(e.getValue(), "column " + e.getKey());
            if (rows >= 0 && values.length != rows) {
                throw new IllegalArgumentException(String.format(
                        "Column '%s' has %d rows, expected %d", e.getKey(), values.length, rows));
            }
            rows = values.length;
            copy.put(e.getKey(), values.clone());
        }
        return new Table(copy, Math.max(rows, 0));
    }

    /**
     * Creates a single-column table.
     */
    public static Table of(String column, double... values) {
        LinkedHashMap<String, double[]> map = new LinkedHashMap<>();
        map.put(column, values);
        return of(map);
    }

    /**
     * Creates a table with the given columns and no rows.
     */
    public static Table empty(Collection<String> columnNames) {
        LinkedHashMap<String, double[]> map = new LinkedHashMap<>();
        for (String name : columnNames) {
            map.put(name, new double[0]);
        }
        return new Table(map, 0);
    }

    public static Builder builder(String... columnNames) {
        return new Builder(Arrays.asList(columnNames));
    }

    public static Builder builder(Collection<String> columnNames) {
        return new Builder(columnNames);
    }

    public int numRows() {
        return numRows;
    }

    public int numColumns() {
        return columns.size();
    }

    public List<String> columnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Returns a copy of a column.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public double[] column(String name) {
        return columnRef(name).clone();
    }

    /**
     * Returns a single value.
     */
    public double get(String column, int row) {
        return columnRef(column)[row];
    }

    private double[] columnRef(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No column '" + name + "' in table with columns " + columns.keySet());
        }
        return values;
    }

    /**
     * Returns rows {@code [start, end)} as a new table.
     */
    public Table slice(int start, int end) {
        if (start < 0 || end > numRows || start > end) {
            throw new IndexOutOfBoundsException("Slice [" + start + ", " + end + ") outside table of " + numRows + " rows");
        }
        LinkedHashMap<String, double[]> sliced = new LinkedHashMap<>();
        columns.forEach((name, values) -> sliced.put(name, Arrays.copyOfRange(values, start, end)));
        return new Table(sliced, end - start);
    }

    /**
     * Concatenates tables row-wise. All tables must have identical column names in the same order.
     *
     * @throws IllegalArgumentException if the list is empty or the columns differ
     */
    public static Table concat(List<Table> tables) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("Cannot concatenate an empty list of tables");
        }
        List<String> names = tables.get(0).columnNames();
        int total = 0;
        for (Table t : tables) {
            if (!t.columnNames().equals(names)) {
                throw new IllegalArgumentException("Cannot concatenate tables with columns " + names + " and " + t.columnNames());
            }
            total += t.numRows;
        }
        LinkedHashMap<String, double[]> merged = new LinkedHashMap<>();
        for (String name : names) {
            double[] out = new double[total];
            int offset = 0;
            for (Table t : tables) {
                double[] part = t.columns.get(name);
                System.arraycopy(part, 0, out, offset, part.length);
                offset += part.length;
            }
            merged.put(name, out);
        }
        return new Table(merged, total);
    }

    /**
     * Renames columns. Names absent from {@code mapping} are kept.
     */
    public Table rename(Map<String, String> mapping) {
        LinkedHashMap<String, double[]> renamed = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            String target = mapping.getOrDefault(name, name);
            if (renamed.put(target, values) != null) {
                throw new IllegalArgumentException("Renaming produces duplicate column '" + target + "'");
            }
        });
        return new Table(renamed, numRows);
    }

    /**
     * Keeps only the given columns, in the given order.
     */
    public Table select(Collection<String> names) {
        LinkedHashMap<String, double[]> selected = new LinkedHashMap<>();
        for (String name : names) {
            selected.put(name, columnRef(name));
        }
        return new Table(selected, names.isEmpty() ? 0 : numRows);
    }

    /**
     * Returns a table with one column added or replaced.
     */
    public Table withColumn(String name, double[] values) {
        if (!columns.isEmpty() && values.length != numRows) {
            throw new IllegalArgumentException(String.format(
                    "Column '%s' has %d rows, table has %d", name, values.length, numRows));
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.put(name, values.clone());
        return new Table(copy, values.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table other)) {
            return false;
        }
        if (numRows != other.numRows || !columnNames().equals(other.columnNames())) {
            return false;
        }
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            if (!Arrays.equals(e.getValue(), other.columns.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = numRows;
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            h = 31 * h + e.getKey().hashCode();
            h = 31 * h + Arrays.hashCode(e.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        return "Table[rows=" + numRows + ", columns=" + columns.keySet() + "]";
    }

    /**
     * Row-wise builder backed by growable primitive lists.
     */
    public static final class Builder {

        private final LinkedHashMap<String, DoubleArrayList> columns = new LinkedHashMap<>();

        private Builder(Collection<String> columnNames) {
            for (String name : columnNames) {
                columns.put(name, new DoubleArrayList());
            }
        }

        /**
         * Appends one row; values follow the builder's column order.
         */
        public Builder addRow(double... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Row has " + values.length + " values, expected " + columns.size());
            }
            int i = 0;
            for (DoubleArrayList column : columns.values()) {
                column.add(values[i++]);
            }
            return this;
        }

        public Table build() {
            LinkedHashMap<String, double[]> built = new LinkedHashMap<>();
            int rows = 0;
            for (Map.Entry<String, DoubleArrayList> e : columns.entrySet()) {
                double[] values = e.getValue().toDoubleArray();
                rows = values.length;
                built.put(e.getKey(), values);
            }
            return new Table(built, rows);
        }
    }
}
