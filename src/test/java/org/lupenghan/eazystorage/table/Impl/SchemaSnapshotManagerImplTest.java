package org.lupenghan.eazystorage.table.Impl;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lupenghan.eazystorage.events.QueryBeforeCreateEvent;
import org.lupenghan.eazystorage.events.RecordBeforeInsertEvent;
import org.lupenghan.eazystorage.migration.Impl.SchemaMigrationExecutorImpl;
import org.lupenghan.eazystorage.table.models.DataType;
import org.lupenghan.eazystorage.table.models.ForeignKey;
import org.lupenghan.eazystorage.table.models.Index;
import org.lupenghan.eazystorage.table.models.Layout;
import org.lupenghan.eazystorage.table.models.LayoutConvention;
import org.lupenghan.eazystorage.table.models.Schema;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SchemaSnapshotManagerImplTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private SchemaSnapshotManagerImpl snapshots;

    @Before
    public void setUp() {
        snapshots = new SchemaSnapshotManagerImpl(folder.getRoot().toPath().resolve("state/schema.json"));
    }

    @Test
    public void testSaveAndLoad() throws Exception {
        assertFalse(snapshots.exists());

        Schema schema = new Schema("app");
        SchemaMigrationExecutorImpl executor = new SchemaMigrationExecutorImpl(schema);
        executor.add("users", t -> t.id()
                .string("email", 255, false)
                .enumeration("status", List.of("active", "banned"))
                .unique("email_unique", List.of("email"))
                .timestamps());
        executor.add("posts", t -> t.id()
                .text("body")
                .foreign("author", executor.table("users"))
                .softDelete());
        schema.getTags().add("migration:create_users");

        snapshots.save(schema);
        assertTrue(snapshots.exists());

        Schema loaded = snapshots.load();
        assertEquals("app", loaded.getName());
        assertEquals(List.of("migration:create_users"), List.copyOf(loaded.getTags()));

        Layout users = loaded.getLayoutByName("users");
        assertEquals(schema.getLayoutByName("users").getFieldNames(), users.getFieldNames());
        assertEquals(List.of("active", "banned"), users.getField("status").getType().getOptions());
        assertEquals(DataType.LONG, users.getField("_id").getType().getDataType());
        assertTrue(users.getField("_id").isAutoIncrement());
        assertTrue(users.getIndex("email_unique").isUnique());
        assertEquals(users.getField("_id"), users.getPrimaryKey().getFields().get(0));

        Index foreign = loaded.getLayoutByName("posts").getIndex("fk_posts_author");
        assertTrue(foreign instanceof ForeignKey);
        assertEquals("users", ((ForeignKey) foreign).getReferencedTable());

        // 钩子按约定重建
        assertTrue(users.hasConvention(LayoutConvention.TIMESTAMPS));
        assertEquals(1, users.events().count(RecordBeforeInsertEvent.class));
        assertEquals(1, loaded.getLayoutByName("posts").events().count(QueryBeforeCreateEvent.class));
    }
}
