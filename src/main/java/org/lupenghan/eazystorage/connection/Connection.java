package org.lupenghan.eazystorage.connection;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.driver.interfaces.Driver;
import org.lupenghan.eazystorage.driver.interfaces.QueryResult;
import org.lupenghan.eazystorage.events.QueryBeforeCreateEvent;
import org.lupenghan.eazystorage.events.RecordBeforeDeleteEvent;
import org.lupenghan.eazystorage.events.RecordBeforeInsertEvent;
import org.lupenghan.eazystorage.events.RecordBeforeUpdateEvent;
import org.lupenghan.eazystorage.migration.Impl.SchemaMigrationExecutorImpl;
import org.lupenghan.eazystorage.migration.interfaces.Migration;
import org.lupenghan.eazystorage.migration.interfaces.MigrationTags;
import org.lupenghan.eazystorage.migration.interfaces.SchemaMigrationExecutor;
import org.lupenghan.eazystorage.query.models.Query;
import org.lupenghan.eazystorage.query.models.QuerySource;
import org.lupenghan.eazystorage.query.models.TableReference;
import org.lupenghan.eazystorage.record.models.Record;
import org.lupenghan.eazystorage.table.models.Field;
import org.lupenghan.eazystorage.table.models.Layout;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * 一个数据库连接：驱动加上该数据库的结构快照。
 * <p>
 * 迁移先作用于数据库，再作用于快照，每一步成功后立即记录标签。
 * 中途失败时不做补偿，异常直接抛给调用方，之前已经记录的标签保留。
 */
@Slf4j
public class Connection {
    private Schema schema;
    private final Driver driver;

    public Connection(Schema schema, Driver driver) {
        this.schema = schema;
        this.driver = driver;
    }

    public Schema getSchema() {
        return schema;
    }

    public void setSchema(Schema schema) {
        this.schema = schema;
    }

    public Driver getDriver() {
        return driver;
    }

    private List<SchemaMigrationExecutor> migrators() {
        return List.of(driver.getMigrationExecutor(schema), new SchemaMigrationExecutorImpl(schema));
    }

    /**
     * 数据库的迁移账本中是否已有该迁移。驱动不支持标签时总是返回 false。
     */
    public boolean contains(Migration migration) throws IOException {
        MigrationTags tags = driver.getMigrationExecutor(schema).tags();
        if (tags == null) {
            return false;
        }
        return tags.listTags().contains(MigrationTags.of(migration));
    }

    public void apply(Migration migration) throws IOException {
        String tag = MigrationTags.of(migration);
        for (SchemaMigrationExecutor migrator : migrators()) {
            migration.up(migrator);
            MigrationTags tags = migrator.tags();
            if (tags != null) {
                tags.tag(tag);
            }
        }
        log.info("迁移 {} 已应用", migration.identifier());
    }

    public void rollback(Migration migration) throws IOException {
        String tag = MigrationTags.of(migration);
        for (SchemaMigrationExecutor migrator : migrators()) {
            migration.down(migrator);
            MigrationTags tags = migrator.tags();
            if (tags != null) {
                tags.untag(tag);
            }
        }
        log.info("迁移 {} 已回滚", migration.identifier());
    }

    /**
     * 执行查询。来源是快照中的表时，先在查询副本上触发该表的查询钩子。
     */
    public QueryResult query(Query query) throws IOException {
        Query prepared = query;
        Layout layout = layoutOf(query.getFrom().input());
        if (layout != null) {
            prepared = query.copy();
            layout.events().dispatch(new QueryBeforeCreateEvent(this, layout, prepared));
        }
        String statement = driver.getDefaultQueryGrammar().query(prepared);
        log.debug("执行查询: {}", statement);
        return driver.read(statement);
    }

    public boolean insert(Layout layout, Record record) throws IOException {
        RecordBeforeInsertEvent event = layout.events().dispatch(new RecordBeforeInsertEvent(this, layout, record));
        if (event.isPrevented()) {
            return false;
        }

        String statement = driver.getDefaultRecordGrammar().insertRecord(layout, record);
        log.debug("执行插入: {}", statement);
        driver.write(statement);

        Field autoIncrement = layout.getAutoIncrement();
        if (autoIncrement != null && record.get(autoIncrement.getName()) == null) {
            record.set(autoIncrement.getName(), driver.lastInsertId());
        }
        record.commit();
        return true;
    }

    /**
     * 只写入 record.diff() 中的字段。没有修改时不触发钩子，也不访问数据库。
     */
    public boolean update(Layout layout, Record record) throws IOException {
        if (!record.isDirty()) {
            return false;
        }
        RecordBeforeUpdateEvent event = layout.events().dispatch(new RecordBeforeUpdateEvent(this, layout, record));
        if (event.isPrevented()) {
            return false;
        }

        String statement = driver.getDefaultRecordGrammar().updateRecord(layout, record);
        log.debug("执行更新: {}", statement);
        driver.write(statement);
        record.commit();
        return true;
    }

    public boolean delete(Layout layout, Record record) throws IOException {
        RecordBeforeDeleteEvent event = layout.events().dispatch(new RecordBeforeDeleteEvent(this, layout, record));
        if (event.isPrevented()) {
            return false;
        }

        String statement = driver.getDefaultRecordGrammar().deleteRecord(layout, record);
        log.debug("执行删除: {}", statement);
        return driver.write(statement) > 0;
    }

    public boolean has(String table) throws IOException {
        QueryResult result = driver.read(driver.getDefaultSchemaGrammar().hasTable(schema.getName(), table));
        Map<String, Object> row = result.fetch();
        if (row == null || row.isEmpty()) {
            return false;
        }
        Object count = row.values().iterator().next();
        return count instanceof Number && ((Number) count).longValue() > 0;
    }

    private Layout layoutOf(QuerySource source) {
        if (source.isQuery() || !(source.getTable() instanceof TableReference)) {
            return null;
        }
        String table = ((TableReference) source.getTable()).getTableName();
        return schema.hasLayout(table) ? schema.getLayoutByName(table) : null;
    }
}
