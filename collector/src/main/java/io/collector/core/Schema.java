package io.collector.core;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, duplicate-free list of output columns.
 */
public final class Schema implements Iterable<String> {
    private final List<String> columns;

    private Schema(List<String> columns) {
        this.columns = columns;
    }

    public static Schema of(String... columns) {
        return of(List.of(columns));
    }

    public static Schema of(List<String> columns) {
        if (columns.isEmpty()) throw new IllegalArgumentException("schema needs at least one column");
        Set<String> seen = new LinkedHashSet<>();
        for (String c : columns) {
            if (c == null || c.isBlank()) throw new IllegalArgumentException("blank column name in " + columns);
            if (!seen.add(c)) throw new IllegalArgumentException("duplicate column: " + c);
        }
        return new Schema(List.copyOf(columns));
    }

    public List<String> columns() { return columns; }
    public int size() { return columns.size(); }

    @Override
    public Iterator<String> iterator() { return columns.iterator(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema that)) return false;
        return columns.equals(that.columns);
    }

    @Override
    public int hashCode() { return columns.hashCode(); }

    @Override
    public String toString() { return "Schema" + columns; }
}
