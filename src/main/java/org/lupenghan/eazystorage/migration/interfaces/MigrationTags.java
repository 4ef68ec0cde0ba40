package org.lupenghan.eazystorage.migration.interfaces;

import java.io.IOException;
import java.util.Set;

/**
 * 标签：记录数据库（或快照）状态的标记，例如 migration:create_users
 */
public interface MigrationTags {
    String MIGRATION_PREFIX = "migration:";

    void tag(String tag) throws IOException;

    void untag(String tag) throws IOException;

    Set<String> listTags() throws IOException;

    static String of(Migration migration) {
        return MIGRATION_PREFIX + migration.identifier();
    }
}
