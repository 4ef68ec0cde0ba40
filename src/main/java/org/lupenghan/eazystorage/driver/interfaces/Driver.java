package org.lupenghan.eazystorage.driver.interfaces;

import org.lupenghan.eazystorage.migration.Impl.DriverSchemaMigrationExecutor;
import org.lupenghan.eazystorage.migration.interfaces.SchemaMigrationExecutor;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;

/**
 * 驱动：执行已经渲染好的方言语句。核心层从不直接处理通信协议。
 */
public interface Driver {

    void connect() throws IOException;

    /**
     * 执行写语句，返回受影响的行数
     */
    int write(String statement) throws IOException;

    QueryResult read(String statement) throws IOException;

    /**
     * 上一次插入生成的自增值
     */
    long lastInsertId() throws IOException;

    QueryGrammar getDefaultQueryGrammar();

    RecordGrammar getDefaultRecordGrammar();

    SchemaGrammar getDefaultSchemaGrammar();

    /**
     * 不支持标签的驱动返回 false，此时迁移账本不可用
     */
    default boolean supportsTags() {
        return true;
    }

    default SchemaMigrationExecutor getMigrationExecutor(Schema schema) {
        return new DriverSchemaMigrationExecutor(this, schema);
    }
}
