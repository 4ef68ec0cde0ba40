package org.lupenghan.eazystorage.migration.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.exceptions.SchemaInvariantException;
import org.lupenghan.eazystorage.migration.interfaces.TableMigrationExecutor;
import org.lupenghan.eazystorage.table.models.Field;
import org.lupenghan.eazystorage.table.models.FieldType;
import org.lupenghan.eazystorage.table.models.ForeignKey;
import org.lupenghan.eazystorage.table.models.Index;
import org.lupenghan.eazystorage.table.models.Layout;
import org.lupenghan.eazystorage.table.models.LayoutConvention;

import java.util.ArrayList;
import java.util.List;

/**
 * 直接修改内存中 Layout 的迁移执行器。所有结构不变量都在这里检查。
 */
@Slf4j
public class TableMigrationExecutorImpl implements TableMigrationExecutor {
    public static final String DEFAULT_ID = "_id";

    private final Layout table;

    public TableMigrationExecutorImpl(Layout layout) {
        this.table = layout;
    }

    @Override
    public TableMigrationExecutorImpl increments(String name) {
        requireNoPrimaryKey();
        Field field = table.putField(name, FieldType.longInteger(true), false, true);
        table.putIndex(new Index(Layout.PRIMARY_KEY, List.of(field), true, true));
        return this;
    }

    @Override
    public TableMigrationExecutorImpl id() {
        return increments(DEFAULT_ID);
    }

    @Override
    public TableMigrationExecutorImpl integer(String name, boolean unsigned) {
        return integer(name, unsigned, true);
    }

    @Override
    public TableMigrationExecutorImpl integer(String name, boolean unsigned, boolean nullable) {
        table.putField(name, FieldType.integer(unsigned), nullable, false);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl longInteger(String name, boolean unsigned) {
        return longInteger(name, unsigned, true);
    }

    @Override
    public TableMigrationExecutorImpl longInteger(String name, boolean unsigned, boolean nullable) {
        table.putField(name, FieldType.longInteger(unsigned), nullable, false);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl floating(String name, boolean nullable) {
        table.putField(name, FieldType.dbl(), nullable, false);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl bool(String name, boolean nullable) {
        table.putField(name, FieldType.bool(), nullable, false);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl string(String name, int length) {
        return string(name, length, true);
    }

    @Override
    public TableMigrationExecutorImpl string(String name, int length, boolean nullable) {
        table.putField(name, FieldType.string(length), nullable, false);
        return this;
    }

    /**
     * 大文本字段。写入前请校验长度，过大的文本会拖垮服务器。
     */
    @Override
    public TableMigrationExecutorImpl text(String name) {
        return text(name, true);
    }

    @Override
    public TableMigrationExecutorImpl text(String name, boolean nullable) {
        table.putField(name, FieldType.text(), nullable, false);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl enumeration(String name, List<String> options) {
        return enumeration(name, options, true);
    }

    @Override
    public TableMigrationExecutorImpl enumeration(String name, List<String> options, boolean nullable) {
        table.putField(name, FieldType.enumeration(options), nullable, false);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl index(String name, List<String> fields) {
        table.putIndex(new Index(name, resolve(fields), false, false));
        return this;
    }

    @Override
    public TableMigrationExecutorImpl unique(String name, List<String> fields) {
        table.putIndex(new Index(name, resolve(fields), true, false));
        return this;
    }

    /**
     * 新字段名为 name 加上远端主键字段名，类型与远端主键相同。
     * 远端主键不可为空，但引用可以为空，这样关系可以是可选的。
     */
    @Override
    public TableMigrationExecutorImpl foreign(String name, TableMigrationExecutor remote) {
        Layout layout = remote.layout();
        Index primary = layout.getPrimaryKey();

        if (primary == null || primary.getFields().size() != 1) {
            throw new SchemaInvariantException(
                    "Foreign key " + name + " requires " + layout.getTableName() + " to have exactly one primary key field");
        }

        Field reference = primary.getFields().get(0);
        Field field = table.putField(name + reference.getName(), reference.getType(), true, false);

        table.putIndex(new ForeignKey(
                String.format("fk_%s_%s", table.getTableName(), name),
                field,
                layout.getTableName(),
                reference
        ));
        return this;
    }

    /**
     * 有些 DBMS 会忽略主键的名字，统一使用 Layout.PRIMARY_KEY
     */
    @Override
    public TableMigrationExecutorImpl primary(String field) {
        Field resolved = table.getField(field);
        requireNoPrimaryKey();
        table.putIndex(new Index(Layout.PRIMARY_KEY, List.of(resolved), true, true));
        return this;
    }

    @Override
    public TableMigrationExecutorImpl timestamps() {
        table.putField(LayoutConvention.CREATED, FieldType.integer(true), false, false);
        table.putField(LayoutConvention.UPDATED, FieldType.integer(true), true, false);
        table.enableConvention(LayoutConvention.TIMESTAMPS);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl softDelete() {
        table.putField(LayoutConvention.REMOVED, FieldType.integer(true), true, false);
        table.enableConvention(LayoutConvention.SOFT_DELETE);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl drop(String name) {
        for (Index index : table.getIndexes()) {
            if (index.references(name)) {
                log.warn("字段 {}.{} 仍被索引 {} 引用，删除后该索引将失效", table.getTableName(), name, index.getName());
            }
        }
        table.unsetField(name);
        return this;
    }

    @Override
    public TableMigrationExecutorImpl dropIndex(String name) {
        table.unsetIndex(name);
        return this;
    }

    @Override
    public Layout layout() {
        return table;
    }

    private void requireNoPrimaryKey() {
        if (table.getPrimaryKey() != null) {
            throw new SchemaInvariantException("Layout " + table.getTableName() + " already has a primary key");
        }
    }

    private List<Field> resolve(List<String> names) {
        List<Field> fields = new ArrayList<>();
        for (String name : names) {
            fields.add(table.getField(name));
        }
        return fields;
    }
}
