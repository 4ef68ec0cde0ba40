package org.lupenghan.eazystorage.migration.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.driver.interfaces.Driver;
import org.lupenghan.eazystorage.driver.interfaces.QueryResult;
import org.lupenghan.eazystorage.migration.interfaces.MigrationTags;
import org.lupenghan.eazystorage.query.models.Query;
import org.lupenghan.eazystorage.record.models.Record;
import org.lupenghan.eazystorage.table.models.Layout;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 迁移账本：把标签保存在数据库的 _tags 表中。
 * <p>
 * 构造时先确保标签表同时存在于数据库和结构快照中。标签表没有唯一约束，
 * 同一个标签如果被写入两次，需要删除两次才能完全移除。
 */
@Slf4j
public class TagManager implements MigrationTags {
    private final Driver driver;
    private final Schema schema;

    public TagManager(Driver driver, Schema schema) throws IOException {
        this.driver = driver;
        this.schema = schema;

        TagLayoutMigration bootstrap = new TagLayoutMigration();
        bootstrap.up(new DriverSchemaMigrationExecutor(driver, schema));
        bootstrap.up(new SchemaMigrationExecutorImpl(schema));
        log.debug("标签表 {} 已就绪", TagLayoutMigration.TABLE);
    }

    private Layout layout() {
        return schema.getLayoutByName(TagLayoutMigration.TABLE);
    }

    @Override
    public void tag(String tag) throws IOException {
        Record record = new Record(layout(), Map.of(TagLayoutMigration.FIELD, tag));
        driver.write(driver.getDefaultRecordGrammar().insertRecord(layout(), record));
        log.info("添加标签 {}", tag);
    }

    @Override
    public void untag(String tag) throws IOException {
        Record record = new Record(layout(), Map.of(TagLayoutMigration.FIELD, tag));
        driver.write(driver.getDefaultRecordGrammar().deleteRecord(layout(), record));
        log.info("移除标签 {}", tag);
    }

    @Override
    public Set<String> listTags() throws IOException {
        Query query = new Query(layout().getTableReference());
        QueryResult result = driver.read(driver.getDefaultQueryGrammar().query(query));

        Set<String> tags = new LinkedHashSet<>();
        Map<String, Object> row;
        while ((row = result.fetch()) != null) {
            tags.add(String.valueOf(row.get(TagLayoutMigration.FIELD)));
        }
        return tags;
    }
}
