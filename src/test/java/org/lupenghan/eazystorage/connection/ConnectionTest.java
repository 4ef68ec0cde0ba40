package org.lupenghan.eazystorage.connection;

import org.junit.Before;
import org.junit.Test;
import org.lupenghan.eazystorage.driver.internal.InMemoryDriver;
import org.lupenghan.eazystorage.exceptions.NotFoundException;
import org.lupenghan.eazystorage.migration.Impl.TagLayoutMigration;
import org.lupenghan.eazystorage.migration.interfaces.Migration;
import org.lupenghan.eazystorage.migration.interfaces.SchemaMigrationExecutor;
import org.lupenghan.eazystorage.query.models.Query;
import org.lupenghan.eazystorage.query.models.RestrictionGroup;
import org.lupenghan.eazystorage.record.models.Record;
import org.lupenghan.eazystorage.table.models.Layout;
import org.lupenghan.eazystorage.table.models.LayoutConvention;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ConnectionTest {
    private InMemoryDriver driver;
    private Connection connection;

    static class CreateUsers implements Migration {
        @Override
        public String identifier() {
            return "create_users";
        }

        @Override
        public void up(SchemaMigrationExecutor schema) throws IOException {
            schema.add("users", t -> t.id().string("name", 255).timestamps().softDelete());
        }

        @Override
        public void down(SchemaMigrationExecutor schema) throws IOException {
            schema.drop("users");
        }
    }

    static class AddAge implements Migration {
        @Override
        public String identifier() {
            return "add_age";
        }

        @Override
        public void up(SchemaMigrationExecutor schema) throws IOException {
            schema.table("users").integer("age", true);
        }

        @Override
        public void down(SchemaMigrationExecutor schema) throws IOException {
            schema.table("users").drop("age");
        }
    }

    @Before
    public void setUp() throws IOException {
        driver = new InMemoryDriver(Settings.builder().driver(InMemoryDriver.SCHEME).schema("app").build());
        driver.connect();
        connection = new Connection(new Schema("app"), driver);
    }

    @Test
    public void testApplyAndRollback() throws IOException {
        Migration migration = new CreateUsers();
        assertFalse(connection.contains(migration));

        connection.apply(migration);
        assertTrue(connection.contains(migration));
        assertTrue(driver.hasTable("users"));
        assertTrue(connection.has("users"));
        assertTrue(connection.getSchema().hasLayout("users"));
        assertTrue(connection.getSchema().getTags().contains("migration:create_users"));
        // 账本表同时出现在数据库和快照中
        assertTrue(driver.hasTable(TagLayoutMigration.TABLE));
        assertTrue(connection.getSchema().hasLayout(TagLayoutMigration.TABLE));

        connection.rollback(migration);
        assertFalse(connection.contains(migration));
        assertFalse(driver.hasTable("users"));
        assertFalse(connection.getSchema().hasLayout("users"));
        assertFalse(connection.getSchema().getTags().contains("migration:create_users"));
    }

    @Test
    public void testAlterTable() throws IOException {
        connection.apply(new CreateUsers());
        int before = driver.getStatements().size();
        connection.apply(new AddAge());

        boolean added = false;
        for (String statement : driver.getStatements().subList(before, driver.getStatements().size())) {
            added |= statement.contains("\"op\":\"addField\"") && statement.contains("\"name\":\"age\"");
        }
        assertTrue(added);
        assertTrue(connection.getSchema().getLayoutByName("users").hasField("age"));

        connection.rollback(new AddAge());
        assertFalse(connection.getSchema().getLayoutByName("users").hasField("age"));
    }

    @Test
    public void testInsertRunsHooks() throws IOException {
        connection.apply(new CreateUsers());
        Layout users = connection.getSchema().getLayoutByName("users");

        Record record = new Record(users);
        record.set("name", "bob");
        assertTrue(connection.insert(users, record));

        assertEquals(1L, record.get("_id"));
        assertNotNull(record.get(LayoutConvention.CREATED));
        assertFalse(record.isDirty());
    }

    @Test
    public void testUpdateOnlyWhenDirty() throws IOException {
        connection.apply(new CreateUsers());
        Layout users = connection.getSchema().getLayoutByName("users");
        Record record = new Record(users, Map.of("name", "bob"));
        connection.insert(users, record);

        int before = driver.getStatements().size();
        assertFalse(connection.update(users, record));
        assertEquals(before, driver.getStatements().size());

        record.set("name", "alice");
        assertTrue(connection.update(users, record));
        assertNotNull(record.get(LayoutConvention.UPDATED));

        List<Map<String, Object>> rows = connection.query(new Query(users.getTableReference())).fetchAll();
        assertEquals("alice", rows.get(0).get("name"));
    }

    @Test
    public void testSoftDelete() throws IOException {
        connection.apply(new CreateUsers());
        Layout users = connection.getSchema().getLayoutByName("users");
        Record record = new Record(users, Map.of("name", "bob"));
        connection.insert(users, record);

        assertFalse(connection.delete(users, record));
        assertNotNull(record.get(LayoutConvention.REMOVED));

        Query query = new Query(users.getTableReference());
        assertTrue(connection.query(query).fetchAll().isEmpty());
        // 调用方的查询不受钩子影响
        assertTrue(query.restrictions().isEmpty());

        // 记录仍在数据库中
        String raw = driver.getDefaultQueryGrammar().query(new Query(users.getTableReference()));
        assertEquals(1, driver.read(raw).fetchAll().size());
    }

    @Test
    public void testSoftDeleteWithOrRestrictions() throws IOException {
        connection.apply(new CreateUsers());
        Layout users = connection.getSchema().getLayoutByName("users");
        Record bob = new Record(users, Map.of("name", "bob"));
        connection.insert(users, bob);
        connection.insert(users, new Record(users, Map.of("name", "alice")));
        connection.delete(users, bob);

        Query query = new Query(users.getTableReference());
        query.restrictions().setType(RestrictionGroup.Type.OR);
        query.restrictions().where("name", "bob").where("name", "alice");

        // 软删除过滤与 OR 条件取交集，而不是并入 OR
        List<Map<String, Object>> rows = connection.query(query).fetchAll();
        assertEquals(1, rows.size());
        assertEquals("alice", rows.get(0).get("name"));
        assertEquals(RestrictionGroup.Type.OR, query.restrictions().getType());
        assertEquals(2, query.restrictions().restrictions().size());
    }

    @Test
    public void testHardDelete() throws IOException {
        connection.apply(new Migration() {
            @Override
            public String identifier() {
                return "create_logs";
            }

            @Override
            public void up(SchemaMigrationExecutor schema) throws IOException {
                schema.add("logs", t -> t.id().text("message"));
            }

            @Override
            public void down(SchemaMigrationExecutor schema) throws IOException {
                schema.drop("logs");
            }
        });
        Layout logs = connection.getSchema().getLayoutByName("logs");
        Record record = new Record(logs, Map.of("message", "hello"));
        connection.insert(logs, record);

        assertTrue(connection.delete(logs, record));
        assertTrue(connection.query(new Query(logs.getTableReference())).fetchAll().isEmpty());
    }

    @Test
    public void testDriverWithoutTags() throws IOException {
        InMemoryDriver untagged = new InMemoryDriver(Settings.builder().driver(InMemoryDriver.SCHEME).schema("app").build(), false);
        untagged.connect();
        Connection plain = new Connection(new Schema("app"), untagged);

        Migration migration = new CreateUsers();
        plain.apply(migration);

        assertFalse(plain.contains(migration));
        assertTrue(untagged.hasTable("users"));
        assertFalse(untagged.hasTable(TagLayoutMigration.TABLE));
        // 快照仍然记录标签
        assertTrue(plain.getSchema().getTags().contains("migration:create_users"));
    }

    @Test
    public void testFailedMigrationIsNotCompensated() throws IOException {
        Migration broken = new Migration() {
            @Override
            public String identifier() {
                return "broken";
            }

            @Override
            public void up(SchemaMigrationExecutor schema) throws IOException {
                schema.add("posts", t -> t.id());
                schema.table("missing").integer("count", true);
            }

            @Override
            public void down(SchemaMigrationExecutor schema) throws IOException {
                schema.drop("posts");
            }
        };

        try {
            connection.apply(broken);
            fail("迁移应失败");
        } catch (NotFoundException e) {
            assertFalse(connection.contains(broken));
            assertTrue(driver.hasTable("posts"));
            assertFalse(connection.getSchema().hasLayout("posts"));
        }
    }
}
