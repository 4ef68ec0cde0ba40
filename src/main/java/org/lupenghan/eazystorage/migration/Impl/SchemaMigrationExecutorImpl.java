package org.lupenghan.eazystorage.migration.Impl;

import org.lupenghan.eazystorage.exceptions.SchemaInvariantException;
import org.lupenghan.eazystorage.migration.interfaces.MigrationTags;
import org.lupenghan.eazystorage.migration.interfaces.SchemaMigrationExecutor;
import org.lupenghan.eazystorage.migration.interfaces.TableDefinition;
import org.lupenghan.eazystorage.table.models.Layout;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;

/**
 * 作用于内存结构快照的迁移执行器
 */
public class SchemaMigrationExecutorImpl implements SchemaMigrationExecutor {
    private final Schema schema;

    public SchemaMigrationExecutorImpl(Schema schema) {
        this.schema = schema;
    }

    @Override
    public TableMigrationExecutorImpl add(String table, TableDefinition definition) throws IOException {
        if (schema.hasLayout(table)) {
            throw new SchemaInvariantException("Layout " + table + " already exists in schema " + schema.getName());
        }
        TableMigrationExecutorImpl executor = new TableMigrationExecutorImpl(new Layout(table));
        definition.define(executor);
        schema.putLayout(executor.layout());
        return executor;
    }

    @Override
    public TableMigrationExecutorImpl table(String table) {
        return new TableMigrationExecutorImpl(schema.getLayoutByName(table));
    }

    @Override
    public void drop(String table) {
        schema.removeLayout(table);
    }

    @Override
    public boolean has(String table) {
        return schema.hasLayout(table);
    }

    @Override
    public MigrationTags tags() {
        return new SchemaTags(schema);
    }
}
