package org.lupenghan.eazystorage.connection;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lupenghan.eazystorage.driver.internal.InMemoryDriver;
import org.lupenghan.eazystorage.exceptions.NotFoundException;
import org.lupenghan.eazystorage.table.Impl.SchemaSnapshotManagerImpl;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ConnectionManagerTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ConnectionManager manager;

    @Before
    public void setUp() {
        manager = new ConnectionManager(new SchemaSnapshotManagerImpl(folder.getRoot().toPath().resolve("schema.json")));
        manager.register(InMemoryDriver.SCHEME, InMemoryDriver::new);
        manager.define("main", "memory://localhost/app?prefix=main_");
    }

    @Test
    public void testGetIsCached() throws IOException {
        Connection connection = manager.get("main");
        assertSame(connection, manager.get("main"));
        assertNotSame(connection, manager.make("main"));

        assertEquals("app", connection.getSchema().getName());
        assertTrue(connection.getDriver() instanceof InMemoryDriver);
        assertEquals("main_", ((InMemoryDriver) connection.getDriver()).getSettings().getPrefix());
    }

    @Test
    public void testLoadsSnapshot() throws IOException {
        Schema schema = new Schema("saved");
        manager.getSnapshots().save(schema);
        assertEquals("saved", manager.make("main").getSchema().getName());
    }

    @Test(expected = NotFoundException.class)
    public void testUndefinedConnection() throws IOException {
        manager.get("replica");
    }

    @Test(expected = NotFoundException.class)
    public void testUnknownDriver() throws IOException {
        manager.define("other", "postgres://localhost/app");
        manager.make("other");
    }
}
