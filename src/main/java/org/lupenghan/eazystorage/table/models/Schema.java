package org.lupenghan.eazystorage.table.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Getter;
import org.lupenghan.eazystorage.exceptions.NotFoundException;
import org.lupenghan.eazystorage.exceptions.SchemaInvariantException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 数据库结构快照：所有表的 Layout，以及快照已经包含的迁移标签。
 */
public class Schema {
    @Getter
    private String name;
    private Map<String, Layout> layouts;
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> tags;

    public Schema(String name) {
        this.name = name;
        this.layouts = new LinkedHashMap<>();
        this.tags = new LinkedHashSet<>();
    }

    // Jackson
    private Schema() {
        this(null);
    }

    public Layout getLayoutByName(String tableName) {
        Layout layout = layouts.get(tableName);
        if (layout == null) {
            throw new NotFoundException("Layout " + tableName + " not found in schema " + name);
        }
        return layout;
    }

    public boolean hasLayout(String tableName) {
        return layouts.containsKey(tableName);
    }

    public Schema putLayout(Layout layout) {
        if (layouts.containsKey(layout.getTableName())) {
            throw new SchemaInvariantException("Layout " + layout.getTableName() + " already exists in schema " + name);
        }
        layouts.put(layout.getTableName(), layout);
        return this;
    }

    public Layout removeLayout(String tableName) {
        Layout removed = layouts.remove(tableName);
        if (removed == null) {
            throw new NotFoundException("Layout " + tableName + " not found in schema " + name);
        }
        return removed;
    }

    public Collection<Layout> getLayouts() {
        return Collections.unmodifiableCollection(layouts.values());
    }

    public Set<String> getTags() {
        return tags;
    }
}
