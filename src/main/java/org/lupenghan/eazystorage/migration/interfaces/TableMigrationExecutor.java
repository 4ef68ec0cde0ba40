package org.lupenghan.eazystorage.migration.interfaces;

import org.lupenghan.eazystorage.table.models.Layout;

import java.io.IOException;
import java.util.List;

/**
 * 作用于一张表的迁移 DSL。操作对表结构的影响是幂等的，但整条链不是事务性的：
 * 某一步校验失败会中断后续调用，之前的步骤不会回滚。
 */
public interface TableMigrationExecutor {

    /**
     * 添加无符号自增字段并立即设为主键
     */
    TableMigrationExecutor increments(String name) throws IOException;

    /**
     * 等同于 increments("_id")
     */
    TableMigrationExecutor id() throws IOException;

    TableMigrationExecutor integer(String name, boolean unsigned) throws IOException;

    TableMigrationExecutor integer(String name, boolean unsigned, boolean nullable) throws IOException;

    TableMigrationExecutor longInteger(String name, boolean unsigned) throws IOException;

    TableMigrationExecutor longInteger(String name, boolean unsigned, boolean nullable) throws IOException;

    TableMigrationExecutor floating(String name, boolean nullable) throws IOException;

    TableMigrationExecutor bool(String name, boolean nullable) throws IOException;

    TableMigrationExecutor string(String name, int length) throws IOException;

    TableMigrationExecutor string(String name, int length, boolean nullable) throws IOException;

    TableMigrationExecutor text(String name) throws IOException;

    TableMigrationExecutor text(String name, boolean nullable) throws IOException;

    /**
     * 枚举字段，选项中不能包含逗号
     */
    TableMigrationExecutor enumeration(String name, List<String> options) throws IOException;

    TableMigrationExecutor enumeration(String name, List<String> options, boolean nullable) throws IOException;

    TableMigrationExecutor index(String name, List<String> fields) throws IOException;

    TableMigrationExecutor unique(String name, List<String> fields) throws IOException;

    /**
     * 添加引用远端表主键的外键。远端表必须恰好有一个主键字段。
     */
    TableMigrationExecutor foreign(String name, TableMigrationExecutor remote) throws IOException;

    TableMigrationExecutor primary(String field) throws IOException;

    TableMigrationExecutor timestamps() throws IOException;

    TableMigrationExecutor softDelete() throws IOException;

    TableMigrationExecutor drop(String name) throws IOException;

    TableMigrationExecutor dropIndex(String name) throws IOException;

    Layout layout();
}
