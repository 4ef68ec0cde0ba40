package org.lupenghan.eazystorage.migration.Impl;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lupenghan.eazystorage.connection.Connection;
import org.lupenghan.eazystorage.connection.Settings;
import org.lupenghan.eazystorage.driver.internal.InMemoryDriver;
import org.lupenghan.eazystorage.migration.interfaces.Migration;
import org.lupenghan.eazystorage.migration.interfaces.SchemaMigrationExecutor;
import org.lupenghan.eazystorage.table.Impl.SchemaSnapshotManagerImpl;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MigrationRunnerTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private InMemoryDriver driver;
    private Path file;
    private SchemaSnapshotManagerImpl snapshots;
    private List<Migration> manifest;

    static class CreateUsers implements Migration {
        @Override
        public String identifier() {
            return "create_users";
        }

        @Override
        public void up(SchemaMigrationExecutor schema) throws IOException {
            schema.add("users", t -> t.id().string("name", 255));
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
        file = folder.getRoot().toPath().resolve("schema.json");
        snapshots = new SchemaSnapshotManagerImpl(file);
        manifest = List.of(new CreateUsers(), new AddAge());
    }

    private MigrationRunner runner() {
        return new MigrationRunner(new Connection(new Schema("app"), driver), snapshots);
    }

    @Test
    public void testMigrateOnce() throws IOException {
        assertEquals(List.of("create_users", "add_age"), runner().migrate(manifest));
        assertTrue(snapshots.exists());
        assertTrue(snapshots.load().getLayoutByName("users").hasField("age"));

        // 再次执行没有待执行的迁移
        assertTrue(runner().migrate(manifest).isEmpty());
    }

    @Test
    public void testFastForwardRebuildsLostSnapshot() throws IOException {
        runner().migrate(manifest);
        Files.delete(file);

        assertTrue(runner().migrate(manifest).isEmpty());

        Schema rebuilt = snapshots.load();
        assertTrue(rebuilt.getLayoutByName("users").hasField("age"));
        assertTrue(rebuilt.getTags().contains("migration:add_age"));
    }

    @Test
    public void testIncrementalManifest() throws IOException {
        assertEquals(List.of("create_users"), runner().migrate(List.of(new CreateUsers())));
        assertEquals(List.of("add_age"), runner().migrate(manifest));
    }

    @Test
    public void testRollback() throws IOException {
        runner().migrate(manifest);

        assertEquals(List.of("add_age"), runner().rollback(manifest, 1));
        assertFalse(snapshots.load().getLayoutByName("users").hasField("age"));

        assertEquals(List.of("create_users"), runner().rollback(manifest, 5));
        assertFalse(snapshots.load().hasLayout("users"));
        assertFalse(driver.hasTable("users"));
    }
}
