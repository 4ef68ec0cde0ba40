package org.lupenghan.eazystorage.migration.Impl;

import org.lupenghan.eazystorage.migration.interfaces.MigrationTags;
import org.lupenghan.eazystorage.table.models.Schema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 保存在结构快照里的标签，表示快照已经包含了哪些迁移
 */
public class SchemaTags implements MigrationTags {
    private final Schema schema;

    public SchemaTags(Schema schema) {
        this.schema = schema;
    }

    @Override
    public void tag(String tag) {
        schema.getTags().add(tag);
    }

    @Override
    public void untag(String tag) {
        schema.getTags().remove(tag);
    }

    @Override
    public Set<String> listTags() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(schema.getTags()));
    }
}
