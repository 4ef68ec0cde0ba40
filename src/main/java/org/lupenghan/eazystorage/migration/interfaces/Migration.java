package org.lupenghan.eazystorage.migration.interfaces;

import java.io.IOException;

/**
 * 一次迁移。up/down 会先后作用于数据库和内存中的结构快照，两边必须得到相同的结构。
 */
public interface Migration {

    /**
     * 稳定且唯一的标识，用来在账本中记录迁移是否已经执行
     */
    String identifier();

    void up(SchemaMigrationExecutor schema) throws IOException;

    void down(SchemaMigrationExecutor schema) throws IOException;
}
