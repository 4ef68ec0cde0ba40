package org.lupenghan.eazystorage.record.models;

import org.junit.Before;
import org.junit.Test;
import org.lupenghan.eazystorage.exceptions.NotFoundException;
import org.lupenghan.eazystorage.table.models.FieldType;
import org.lupenghan.eazystorage.table.models.Index;
import org.lupenghan.eazystorage.table.models.Layout;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RecordTest {
    private Layout layout;

    @Before
    public void setUp() {
        layout = new Layout("users");
        layout.putField("_id", FieldType.longInteger(true), false, true);
        layout.putField("name", FieldType.string(255), true, false);
        layout.putField("age", FieldType.integer(true), true, false);
        layout.putIndex(new Index(Layout.PRIMARY_KEY, List.of(layout.getField("_id")), true, true));
    }

    @Test
    public void testDiffAndCommit() {
        Record record = new Record(layout, Map.of("_id", 1L, "name", "bob"));
        assertFalse(record.isDirty());

        record.set("name", "alice");
        assertEquals(Map.of("name", "alice"), record.diff());
        assertEquals("alice", record.raw().get("name"));
        assertEquals(1L, record.raw().get("_id"));

        record.commit();
        assertTrue(record.diff().isEmpty());
        assertEquals("alice", record.get("name"));
    }

    @Test
    public void testPrimaryUsesCommittedValue() {
        Record record = new Record(layout, Map.of("_id", 1L));
        record.set("_id", 2L);
        assertEquals(Map.of("_id", 1L), record.getPrimary());

        record.commit();
        assertEquals(Map.of("_id", 2L), record.getPrimary());
    }

    @Test(expected = NotFoundException.class)
    public void testSetUnknownField() {
        new Record(layout).set("email", "a@b.c");
    }

    @Test(expected = NotFoundException.class)
    public void testUnknownInitialField() {
        new Record(layout, Map.of("email", "a@b.c"));
    }
}
