package org.lupenghan.eazystorage.migration.interfaces;

import java.io.IOException;

/**
 * 迁移在整个库上可以执行的操作
 */
public interface SchemaMigrationExecutor {

    /**
     * 创建一张新表并返回它的执行器
     */
    TableMigrationExecutor add(String table, TableDefinition definition) throws IOException;

    /**
     * 创建一张空表，之后通过返回的执行器继续定义
     */
    default TableMigrationExecutor add(String table) throws IOException {
        return add(table, t -> {
        });
    }

    /**
     * 返回已有表的执行器
     */
    TableMigrationExecutor table(String table) throws IOException;

    void drop(String table) throws IOException;

    boolean has(String table) throws IOException;

    /**
     * 这个执行器使用的标签管理器；不支持标签时返回 null
     */
    MigrationTags tags() throws IOException;
}
