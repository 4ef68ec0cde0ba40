package org.lupenghan.eazystorage.record.models;

import lombok.Getter;
import org.lupenghan.eazystorage.table.models.Field;
import org.lupenghan.eazystorage.table.models.Index;
import org.lupenghan.eazystorage.table.models.Layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一行数据。分别保存已与数据库同步的值（committed）和尚未写入的修改（pending），
 * 更新时只需要发送 pending 中的列。
 */
public class Record {
    @Getter
    private final Layout layout;
    private final Map<String, Object> committed;
    private final Map<String, Object> pending = new LinkedHashMap<>();

    /**
     * @param layout 记录所属的表
     * @param initial 初始值，视为已同步
     */
    public Record(Layout layout, Map<String, Object> initial) {
        this.layout = layout;
        this.committed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : initial.entrySet()) {
            layout.getField(entry.getKey());
            committed.put(entry.getKey(), entry.getValue());
        }
    }

    public Record(Layout layout) {
        this(layout, Map.of());
    }

    public Object get(String field) {
        layout.getField(field);
        return pending.containsKey(field) ? pending.get(field) : committed.get(field);
    }

    public Record set(String field, Object value) {
        layout.getField(field);
        pending.put(field, value);
        return this;
    }

    /**
     * 完整数据：已同步的值叠加未写入的修改
     */
    public Map<String, Object> raw() {
        Map<String, Object> raw = new LinkedHashMap<>(committed);
        raw.putAll(pending);
        return Collections.unmodifiableMap(raw);
    }

    /**
     * 自上次 commit 以来被修改过的字段
     */
    public Map<String, Object> diff() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(pending));
    }

    public boolean isDirty() {
        return !pending.isEmpty();
    }

    /**
     * 数据写入成功后调用，记录与数据库保持一致
     */
    public void commit() {
        committed.putAll(pending);
        pending.clear();
    }

    /**
     * 主键字段及其已同步的值。主键值在写入前就被修改时，以数据库中的值定位记录。
     */
    public Map<String, Object> getPrimary() {
        Index primary = layout.getPrimaryKey();
        if (primary == null) {
            return Map.of();
        }
        Map<String, Object> key = new LinkedHashMap<>();
        for (Field field : primary.getFields()) {
            key.put(field.getName(), committed.containsKey(field.getName()) ? committed.get(field.getName()) : pending.get(field.getName()));
        }
        return Collections.unmodifiableMap(key);
    }

    @Override
    public String toString() {
        return "Record(" + layout.getTableName() + ", " + raw() + ")";
    }
}
