package org.lupenghan.eazystorage.migration.interfaces;

import java.io.IOException;

/**
 * 创建新表时定义它的字段和索引
 */
@FunctionalInterface
public interface TableDefinition {

    void define(TableMigrationExecutor table) throws IOException;
}
