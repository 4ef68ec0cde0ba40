package org.lupenghan.eazystorage.migration.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.driver.interfaces.Driver;
import org.lupenghan.eazystorage.driver.interfaces.SchemaGrammar;
import org.lupenghan.eazystorage.migration.interfaces.TableMigrationExecutor;
import org.lupenghan.eazystorage.table.models.Field;
import org.lupenghan.eazystorage.table.models.Index;
import org.lupenghan.eazystorage.table.models.Layout;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 作用于真实数据库的表执行器。
 * <p>
 * 每个操作先在工作副本上执行（复用 TableMigrationExecutorImpl 的全部校验），
 * 再把前后结构的差异渲染成 DDL 写入数据库：先删索引、再删字段、然后加/改字段、最后加索引。
 */
@Slf4j
public class DriverTableMigrationExecutor implements TableMigrationExecutor {
    private final Driver driver;
    private final SchemaGrammar grammar;
    private final TableMigrationExecutorImpl working;

    public DriverTableMigrationExecutor(Driver driver, Layout working) {
        this.driver = driver;
        this.grammar = driver.getDefaultSchemaGrammar();
        this.working = new TableMigrationExecutorImpl(working);
    }

    private DriverTableMigrationExecutor emit(Consumer<TableMigrationExecutorImpl> operation) throws IOException {
        Layout before = working.layout().copy();
        operation.accept(working);
        Layout after = working.layout();

        Map<String, Index> oldIndexes = indexesOf(before);
        Map<String, Index> newIndexes = indexesOf(after);
        Map<String, Field> oldFields = fieldsOf(before);
        Map<String, Field> newFields = fieldsOf(after);

        List<String> statements = new ArrayList<>();
        for (Index index : oldIndexes.values()) {
            if (!index.equals(newIndexes.get(index.getName()))) {
                statements.add(grammar.dropIndex(after, index.getName()));
            }
        }
        for (String name : oldFields.keySet()) {
            if (!newFields.containsKey(name)) {
                statements.add(grammar.dropField(after, name));
            }
        }
        for (Field field : newFields.values()) {
            Field previous = oldFields.get(field.getName());
            if (previous == null) {
                statements.add(grammar.addField(after, field));
            } else if (!previous.equals(field)) {
                statements.add(grammar.alterField(after, field));
            }
        }
        for (Index index : newIndexes.values()) {
            if (!index.equals(oldIndexes.get(index.getName()))) {
                statements.add(grammar.addIndex(after, index));
            }
        }

        for (String statement : statements) {
            log.debug("执行 DDL: {}", statement);
            driver.write(statement);
        }
        return this;
    }

    private static Map<String, Index> indexesOf(Layout layout) {
        Map<String, Index> indexes = new LinkedHashMap<>();
        for (Index index : layout.getIndexes()) {
            indexes.put(index.getName(), index);
        }
        return indexes;
    }

    private static Map<String, Field> fieldsOf(Layout layout) {
        Map<String, Field> fields = new LinkedHashMap<>();
        for (Field field : layout.getFields()) {
            fields.put(field.getName(), field);
        }
        return fields;
    }

    @Override
    public DriverTableMigrationExecutor increments(String name) throws IOException {
        return emit(t -> t.increments(name));
    }

    @Override
    public DriverTableMigrationExecutor id() throws IOException {
        return emit(TableMigrationExecutorImpl::id);
    }

    @Override
    public DriverTableMigrationExecutor integer(String name, boolean unsigned) throws IOException {
        return emit(t -> t.integer(name, unsigned));
    }

    @Override
    public DriverTableMigrationExecutor integer(String name, boolean unsigned, boolean nullable) throws IOException {
        return emit(t -> t.integer(name, unsigned, nullable));
    }

    @Override
    public DriverTableMigrationExecutor longInteger(String name, boolean unsigned) throws IOException {
        return emit(t -> t.longInteger(name, unsigned));
    }

    @Override
    public DriverTableMigrationExecutor longInteger(String name, boolean unsigned, boolean nullable) throws IOException {
        return emit(t -> t.longInteger(name, unsigned, nullable));
    }

    @Override
    public DriverTableMigrationExecutor floating(String name, boolean nullable) throws IOException {
        return emit(t -> t.floating(name, nullable));
    }

    @Override
    public DriverTableMigrationExecutor bool(String name, boolean nullable) throws IOException {
        return emit(t -> t.bool(name, nullable));
    }

    @Override
    public DriverTableMigrationExecutor string(String name, int length) throws IOException {
        return emit(t -> t.string(name, length));
    }

    @Override
    public DriverTableMigrationExecutor string(String name, int length, boolean nullable) throws IOException {
        return emit(t -> t.string(name, length, nullable));
    }

    @Override
    public DriverTableMigrationExecutor text(String name) throws IOException {
        return emit(t -> t.text(name));
    }

    @Override
    public DriverTableMigrationExecutor text(String name, boolean nullable) throws IOException {
        return emit(t -> t.text(name, nullable));
    }

    @Override
    public DriverTableMigrationExecutor enumeration(String name, List<String> options) throws IOException {
        return emit(t -> t.enumeration(name, options));
    }

    @Override
    public DriverTableMigrationExecutor enumeration(String name, List<String> options, boolean nullable) throws IOException {
        return emit(t -> t.enumeration(name, options, nullable));
    }

    @Override
    public DriverTableMigrationExecutor index(String name, List<String> fields) throws IOException {
        return emit(t -> t.index(name, fields));
    }

    @Override
    public DriverTableMigrationExecutor unique(String name, List<String> fields) throws IOException {
        return emit(t -> t.unique(name, fields));
    }

    @Override
    public DriverTableMigrationExecutor foreign(String name, TableMigrationExecutor remote) throws IOException {
        return emit(t -> t.foreign(name, remote));
    }

    @Override
    public DriverTableMigrationExecutor primary(String field) throws IOException {
        return emit(t -> t.primary(field));
    }

    @Override
    public DriverTableMigrationExecutor timestamps() throws IOException {
        return emit(TableMigrationExecutorImpl::timestamps);
    }

    @Override
    public DriverTableMigrationExecutor softDelete() throws IOException {
        return emit(TableMigrationExecutorImpl::softDelete);
    }

    @Override
    public DriverTableMigrationExecutor drop(String name) throws IOException {
        return emit(t -> t.drop(name));
    }

    @Override
    public DriverTableMigrationExecutor dropIndex(String name) throws IOException {
        return emit(t -> t.dropIndex(name));
    }

    @Override
    public Layout layout() {
        return working.layout();
    }
}
