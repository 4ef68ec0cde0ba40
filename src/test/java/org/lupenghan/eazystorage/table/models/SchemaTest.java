package org.lupenghan.eazystorage.table.models;

import org.junit.Test;
import org.lupenghan.eazystorage.exceptions.NotFoundException;
import org.lupenghan.eazystorage.exceptions.SchemaInvariantException;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SchemaTest {

    @Test(expected = SchemaInvariantException.class)
    public void testDuplicateLayout() {
        Schema schema = new Schema("app");
        schema.putLayout(new Layout("users"));
        schema.putLayout(new Layout("users"));
    }

    @Test
    public void testRemoveLayout() {
        Schema schema = new Schema("app");
        schema.putLayout(new Layout("users"));
        assertTrue(schema.hasLayout("users"));
        schema.removeLayout("users");
        assertFalse(schema.hasLayout("users"));
    }

    @Test(expected = NotFoundException.class)
    public void testMissingLayout() {
        new Schema("app").getLayoutByName("users");
    }
}
