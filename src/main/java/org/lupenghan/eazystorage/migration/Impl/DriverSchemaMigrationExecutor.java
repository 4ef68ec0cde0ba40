package org.lupenghan.eazystorage.migration.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.driver.interfaces.Driver;
import org.lupenghan.eazystorage.driver.interfaces.QueryResult;
import org.lupenghan.eazystorage.exceptions.SchemaInvariantException;
import org.lupenghan.eazystorage.migration.interfaces.MigrationTags;
import org.lupenghan.eazystorage.migration.interfaces.SchemaMigrationExecutor;
import org.lupenghan.eazystorage.migration.interfaces.TableDefinition;
import org.lupenghan.eazystorage.table.models.Layout;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * 作用于真实数据库的迁移执行器。
 * <p>
 * 结构快照在数据库之后才被迁移，所以这里维护本次迁移中创建或修改过的表的工作副本，
 * 同一次迁移里后面的操作（例如外键）可以看到前面的结果。
 */
@Slf4j
public class DriverSchemaMigrationExecutor implements SchemaMigrationExecutor {
    private final Driver driver;
    private final Schema schema;
    private final Map<String, Layout> working = new HashMap<>();
    private TagManager tags;

    public DriverSchemaMigrationExecutor(Driver driver, Schema schema) {
        this.driver = driver;
        this.schema = schema;
    }

    /**
     * 新表先完整定义，再以一条 CREATE 语句写入
     */
    @Override
    public DriverTableMigrationExecutor add(String table, TableDefinition definition) throws IOException {
        if (working.containsKey(table)) {
            throw new SchemaInvariantException("Table " + table + " was already created by this migration");
        }
        TableMigrationExecutorImpl draft = new TableMigrationExecutorImpl(new Layout(table));
        definition.define(draft);

        String statement = driver.getDefaultSchemaGrammar().createTable(draft.layout());
        log.debug("执行 DDL: {}", statement);
        driver.write(statement);

        working.put(table, draft.layout());
        return new DriverTableMigrationExecutor(driver, draft.layout());
    }

    @Override
    public DriverTableMigrationExecutor table(String table) {
        Layout layout = working.get(table);
        if (layout == null) {
            layout = schema.getLayoutByName(table).copy();
            working.put(table, layout);
        }
        return new DriverTableMigrationExecutor(driver, layout);
    }

    @Override
    public void drop(String table) throws IOException {
        String statement = driver.getDefaultSchemaGrammar().dropTable(table);
        log.debug("执行 DDL: {}", statement);
        driver.write(statement);
        working.remove(table);
    }

    @Override
    public boolean has(String table) throws IOException {
        QueryResult result = driver.read(driver.getDefaultSchemaGrammar().hasTable(schema.getName(), table));
        Map<String, Object> row = result.fetch();
        if (row == null || row.isEmpty()) {
            return false;
        }
        Iterator<Object> values = row.values().iterator();
        Object count = values.next();
        return count instanceof Number && ((Number) count).longValue() > 0;
    }

    @Override
    public MigrationTags tags() throws IOException {
        if (!driver.supportsTags()) {
            return null;
        }
        if (tags == null) {
            tags = new TagManager(driver, schema);
        }
        return tags;
    }
}
