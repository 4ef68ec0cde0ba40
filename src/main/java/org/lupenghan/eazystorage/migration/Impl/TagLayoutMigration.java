package org.lupenghan.eazystorage.migration.Impl;

import org.lupenghan.eazystorage.migration.interfaces.Migration;
import org.lupenghan.eazystorage.migration.interfaces.SchemaMigrationExecutor;

import java.io.IOException;

/**
 * 创建标签表。表已存在时什么也不做，所以可以在每次启动时执行。
 */
public class TagLayoutMigration implements Migration {
    public static final String TABLE = "_tags";
    public static final String FIELD = "tag";
    public static final int LENGTH = 255;

    @Override
    public String identifier() {
        return "eazystorage_tags";
    }

    @Override
    public void up(SchemaMigrationExecutor schema) throws IOException {
        if (!schema.has(TABLE)) {
            schema.add(TABLE, table -> table.string(FIELD, LENGTH, false));
        }
    }

    @Override
    public void down(SchemaMigrationExecutor schema) throws IOException {
        if (schema.has(TABLE)) {
            schema.drop(TABLE);
        }
    }
}
