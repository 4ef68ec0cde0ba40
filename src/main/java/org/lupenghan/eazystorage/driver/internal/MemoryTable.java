package org.lupenghan.eazystorage.driver.internal;

import lombok.Getter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内存中的一张表：列、主键、自增序列和按插入顺序保存的行
 */
class MemoryTable {
    @Getter
    private final String name;
    private final List<String> columns;
    private final Set<String> indexes = new LinkedHashSet<>();
    private final List<Map<String, Object>> rows = new ArrayList<>();
    private List<String> primary;
    private String autoIncrement;
    private long sequence;

    MemoryTable(String name, List<String> columns, List<String> indexes, List<String> primary, String autoIncrement) {
        this.name = name;
        this.columns = new ArrayList<>(columns);
        if (indexes != null) {
            this.indexes.addAll(indexes);
        }
        this.primary = primary == null ? List.of() : List.copyOf(primary);
        this.autoIncrement = autoIncrement;
    }

    List<Map<String, Object>> rows() {
        return rows;
    }

    void addColumn(String column) throws IOException {
        if (columns.contains(column)) {
            throw new IOException("Duplicate column " + column + " in table " + name);
        }
        columns.add(column);
        for (Map<String, Object> row : rows) {
            row.put(column, null);
        }
    }

    void alterColumn(String column, boolean autoIncrement) throws IOException {
        requireColumn(column);
        if (autoIncrement) {
            this.autoIncrement = column;
        } else if (column.equals(this.autoIncrement)) {
            this.autoIncrement = null;
        }
    }

    void dropColumn(String column) throws IOException {
        requireColumn(column);
        columns.remove(column);
        for (Map<String, Object> row : rows) {
            row.remove(column);
        }
        if (column.equals(autoIncrement)) {
            autoIncrement = null;
        }
    }

    void addIndex(String index, List<String> fields, boolean isPrimary) throws IOException {
        for (String field : fields) {
            requireColumn(field);
        }
        if (!indexes.add(index)) {
            throw new IOException("Duplicate index " + index + " in table " + name);
        }
        if (isPrimary) {
            primary = List.copyOf(fields);
        }
    }

    void dropIndex(String index, boolean isPrimary) throws IOException {
        if (!indexes.remove(index)) {
            throw new IOException("Index " + index + " does not exist in table " + name);
        }
        if (isPrimary) {
            primary = List.of();
        }
    }

    /**
     * @return 本行的自增值，没有自增列时返回 0
     */
    long insert(Map<String, Object> values) throws IOException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : columns) {
            row.put(column, null);
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            requireColumn(entry.getKey());
            row.put(entry.getKey(), entry.getValue());
        }

        long generated = 0;
        if (autoIncrement != null) {
            Object given = row.get(autoIncrement);
            if (given == null) {
                generated = ++sequence;
                row.put(autoIncrement, generated);
            } else {
                generated = ((Number) given).longValue();
                sequence = Math.max(sequence, generated);
            }
        }

        if (!primary.isEmpty()) {
            Map<String, Object> key = new LinkedHashMap<>();
            for (String column : primary) {
                key.put(column, row.get(column));
            }
            if (!find(key).isEmpty()) {
                throw new IOException("Duplicate entry " + key + " for primary key of " + name);
            }
        }

        rows.add(row);
        return generated;
    }

    int update(Map<String, Object> match, Map<String, Object> values) throws IOException {
        for (String column : values.keySet()) {
            requireColumn(column);
        }
        List<Map<String, Object>> found = find(match);
        for (Map<String, Object> row : found) {
            row.putAll(values);
        }
        return found.size();
    }

    int delete(Map<String, Object> match, boolean single) throws IOException {
        int removed = 0;
        Iterator<Map<String, Object>> iterator = rows.iterator();
        while (iterator.hasNext()) {
            if (matches(iterator.next(), match)) {
                iterator.remove();
                removed++;
                if (single) {
                    break;
                }
            }
        }
        return removed;
    }

    private List<Map<String, Object>> find(Map<String, Object> match) throws IOException {
        List<Map<String, Object>> found = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (matches(row, match)) {
                found.add(row);
            }
        }
        return found;
    }

    private boolean matches(Map<String, Object> row, Map<String, Object> match) throws IOException {
        for (Map.Entry<String, Object> entry : match.entrySet()) {
            requireColumn(entry.getKey());
            Object actual = row.get(entry.getKey());
            if (entry.getValue() == null ? actual != null : actual == null || !MemoryFilter.same(actual, entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private void requireColumn(String column) throws IOException {
        if (!columns.contains(column)) {
            throw new IOException("Unknown column " + column + " in table " + name);
        }
    }
}
