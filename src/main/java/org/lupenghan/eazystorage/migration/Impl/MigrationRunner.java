package org.lupenghan.eazystorage.migration.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.connection.Connection;
import org.lupenghan.eazystorage.migration.interfaces.Migration;
import org.lupenghan.eazystorage.migration.interfaces.MigrationTags;
import org.lupenghan.eazystorage.table.interfaces.SchemaSnapshotManager;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 按清单执行迁移。清单的顺序就是执行顺序，回滚时倒序。
 * <p>
 * 执行前先把结构快照快进到数据库账本记录的状态，然后只执行账本中没有的迁移。
 * 迁移之间没有事务边界：某个迁移失败时异常直接抛出，已执行的迁移不会回滚。
 */
@Slf4j
public class MigrationRunner {
    private final Connection connection;
    private final SchemaSnapshotManager snapshots;

    public MigrationRunner(Connection connection, SchemaSnapshotManager snapshots) {
        this.connection = connection;
        this.snapshots = snapshots;
    }

    public List<String> migrate(List<Migration> manifest) throws IOException {
        Schema schema = snapshots.exists() ? snapshots.load() : new Schema(connection.getSchema().getName());
        connection.setSchema(schema);

        fastForward(manifest, schema);

        List<String> applied = new ArrayList<>();
        for (Migration migration : manifest) {
            if (connection.contains(migration)) {
                log.info("跳过迁移 {}：已执行", migration.identifier());
                continue;
            }
            log.info("执行迁移 {}", migration.identifier());
            connection.apply(migration);
            applied.add(migration.identifier());
        }

        snapshots.save(schema);
        return applied;
    }

    /**
     * 回滚最近执行的 steps 个迁移
     */
    public List<String> rollback(List<Migration> manifest, int steps) throws IOException {
        Schema schema = snapshots.exists() ? snapshots.load() : new Schema(connection.getSchema().getName());
        connection.setSchema(schema);

        fastForward(manifest, schema);

        List<String> rolledBack = new ArrayList<>();
        for (int i = manifest.size() - 1; i >= 0 && rolledBack.size() < steps; i--) {
            Migration migration = manifest.get(i);
            if (!connection.contains(migration)) {
                continue;
            }
            log.info("回滚迁移 {}", migration.identifier());
            connection.rollback(migration);
            rolledBack.add(migration.identifier());
        }

        snapshots.save(schema);
        return rolledBack;
    }

    private void fastForward(List<Migration> manifest, Schema schema) throws IOException {
        SchemaMigrationExecutorImpl state = new SchemaMigrationExecutorImpl(schema);
        MigrationTags reflected = state.tags();

        for (Migration migration : manifest) {
            String tag = MigrationTags.of(migration);
            if (connection.contains(migration) && !reflected.listTags().contains(tag)) {
                log.info("快照快进：重放迁移 {}", migration.identifier());
                migration.up(state);
                reflected.tag(tag);
            }
        }
    }
}
