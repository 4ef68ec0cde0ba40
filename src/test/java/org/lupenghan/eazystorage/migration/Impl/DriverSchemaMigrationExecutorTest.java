package org.lupenghan.eazystorage.migration.Impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Test;
import org.lupenghan.eazystorage.connection.Settings;
import org.lupenghan.eazystorage.driver.internal.InMemoryDriver;
import org.lupenghan.eazystorage.exceptions.SchemaInvariantException;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DriverSchemaMigrationExecutorTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryDriver driver;
    private DriverSchemaMigrationExecutor executor;

    @Before
    public void setUp() throws IOException {
        driver = new InMemoryDriver(Settings.builder().driver(InMemoryDriver.SCHEME).schema("app").build());
        driver.connect();
        executor = new DriverSchemaMigrationExecutor(driver, new Schema("app"));
    }

    private List<String> operationsSince(int from) throws IOException {
        List<String> ops = new ArrayList<>();
        for (String statement : driver.getStatements().subList(from, driver.getStatements().size())) {
            JsonNode node = mapper.readTree(statement);
            ops.add(node.get("op").asText());
        }
        return ops;
    }

    @Test
    public void testCreateIsSingleStatement() throws IOException {
        executor.add("users", t -> t.id().string("email", 255).unique("email_unique", List.of("email")));
        assertEquals(List.of("create"), operationsSince(0));
        assertTrue(executor.has("users"));
        assertFalse(executor.has("posts"));
    }

    @Test
    public void testLaterOperationsSeeEarlierTables() throws IOException {
        executor.add("users", t -> t.id());
        int before = driver.getStatements().size();
        executor.add("posts", t -> t.id().foreign("author", executor.table("users")));

        assertEquals(List.of("create"), operationsSince(before));
    }

    @Test
    public void testDropIndexBeforeField() throws IOException {
        executor.add("users", t -> t.id().string("email", 255).unique("email_unique", List.of("email")));
        int before = driver.getStatements().size();

        executor.table("users").dropIndex("email_unique").drop("email");
        assertEquals(List.of("dropIndex", "dropField"), operationsSince(before));
    }

    @Test
    public void testAddFieldThenIndex() throws IOException {
        executor.add("users", t -> t.id());
        int before = driver.getStatements().size();

        executor.table("users").string("email", 255).unique("email_unique", List.of("email"));
        assertEquals(List.of("addField", "addIndex"), operationsSince(before));
    }

    @Test(expected = SchemaInvariantException.class)
    public void testAddTwice() throws IOException {
        executor.add("users", t -> t.id());
        executor.add("users", t -> t.id());
    }

    @Test
    public void testDrop() throws IOException {
        executor.add("users", t -> t.id());
        executor.drop("users");
        assertFalse(driver.hasTable("users"));
    }
}
