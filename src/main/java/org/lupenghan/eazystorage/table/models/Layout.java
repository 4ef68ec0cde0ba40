package org.lupenghan.eazystorage.table.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Getter;
import org.lupenghan.eazystorage.events.EventDispatcher;
import org.lupenghan.eazystorage.exceptions.NotFoundException;
import org.lupenghan.eazystorage.exceptions.SchemaInvariantException;
import org.lupenghan.eazystorage.query.models.TableReference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表结构定义类：一张表的字段与索引。
 * <p>
 * 字段的插入顺序就是列的顺序。只能通过 setField/unsetField/putIndex/unsetIndex 修改，
 * 主键唯一性在修改时检查，读取时不再检查。
 */
public class Layout {
    public static final String PRIMARY_KEY = "_primary";

    @Getter
    private String tableName;
    private Map<String, Field> fields;
    private Map<String, Index> indexes;
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<LayoutConvention> conventions;

    // 生命周期钩子不持久化，重新加载后按 conventions 重建
    private transient EventDispatcher events;

    public Layout(String tableName) {
        this.tableName = tableName;
        this.fields = new LinkedHashMap<>();
        this.indexes = new LinkedHashMap<>();
        this.conventions = new LinkedHashSet<>();
    }

    // Jackson
    private Layout() {
        this(null);
    }

    public Field getField(String name) {
        Field field = fields.get(name);
        if (field == null) {
            throw new NotFoundException("Field " + name + " not found in layout " + tableName);
        }
        return field;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public Field putField(String name, FieldType type, boolean nullable, boolean autoIncrement) {
        Field field = new Field(name, type, nullable, autoIncrement);
        setField(name, field);
        return field;
    }

    public Layout setField(String name, Field field) {
        fields.put(name, field.getName().equals(name) ? field : field.withName(name));
        return this;
    }

    public Layout unsetField(String name) {
        if (fields.remove(name) == null) {
            throw new NotFoundException("Field " + name + " not found in layout " + tableName);
        }
        return this;
    }

    public Collection<Field> getFields() {
        return Collections.unmodifiableCollection(fields.values());
    }

    public List<String> getFieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    public Collection<Index> getIndexes() {
        return Collections.unmodifiableCollection(indexes.values());
    }

    public Index getIndex(String name) {
        Index index = indexes.get(name);
        if (index == null) {
            throw new NotFoundException("Index " + name + " not found in layout " + tableName);
        }
        return index;
    }

    public boolean hasIndex(String name) {
        return indexes.containsKey(name);
    }

    public Layout putIndex(Index index) {
        if (index.isPrimary() && getPrimaryKey() != null) {
            throw new SchemaInvariantException("Layout " + tableName + " already has a primary key");
        }
        indexes.put(index.getName(), index);
        return this;
    }

    public Layout unsetIndex(String name) {
        if (indexes.remove(name) == null) {
            throw new NotFoundException("Index " + name + " not found in layout " + tableName);
        }
        return this;
    }

    /**
     * 返回主键索引，没有主键时返回 null
     */
    public Index getPrimaryKey() {
        for (Index index : indexes.values()) {
            if (index.isPrimary()) {
                return index;
            }
        }
        return null;
    }

    public Field getAutoIncrement() {
        for (Field field : fields.values()) {
            if (field.isAutoIncrement()) {
                return field;
            }
        }
        return null;
    }

    public TableReference getTableReference() {
        return new TableReference(tableName, getFieldNames());
    }

    public boolean hasConvention(LayoutConvention convention) {
        return conventions.contains(convention);
    }

    public Layout enableConvention(LayoutConvention convention) {
        if (conventions.add(convention) && events != null) {
            convention.hook(events);
        }
        return this;
    }

    public EventDispatcher events() {
        if (events == null) {
            events = new EventDispatcher();
            for (LayoutConvention convention : conventions) {
                convention.hook(events);
            }
        }
        return events;
    }

    /**
     * 复制字段、索引和约定。字段与索引本身不可变，可以共享。
     */
    public Layout copy() {
        Layout copy = new Layout(tableName);
        copy.fields.putAll(fields);
        copy.indexes.putAll(indexes);
        copy.conventions.addAll(conventions);
        return copy;
    }

    @Override
    public String toString() {
        return "Layout(" + tableName + ", fields=" + fields.keySet() + ", indexes=" + indexes.keySet() + ")";
    }
}
