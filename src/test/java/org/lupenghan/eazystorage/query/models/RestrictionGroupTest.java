package org.lupenghan.eazystorage.query.models;

import org.junit.Before;
import org.junit.Test;
import org.lupenghan.eazystorage.exceptions.NotFoundException;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class RestrictionGroupTest {
    private TableReference users;
    private RestrictionGroup group;

    @Before
    public void setUp() {
        users = new TableReference("users", List.of("_id", "name", "age"));
        group = new RestrictionGroup(users);
    }

    @Test
    public void testSameConnectiveAppendsDirectly() {
        Restriction a = new Restriction(users.getOutput("age"), ">", 18);
        Restriction b = new Restriction(users.getOutput("name"), "LIKE", "a%");
        group.and(a, b);

        assertEquals(2, group.restrictions().size());
        assertSame(a, group.restrictions().get(0));
    }

    @Test
    public void testOtherConnectiveNests() {
        group.where("age", ">", 18);
        group.or(new Restriction(users.getOutput("name"), "=", "bob"),
                new Restriction(users.getOutput("name"), "=", "alice"));

        assertEquals(2, group.restrictions().size());
        RestrictionGroup nested = (RestrictionGroup) group.restrictions().get(1);
        assertEquals(RestrictionGroup.Type.OR, nested.getType());
        assertEquals(2, nested.restrictions().size());
    }

    @Test
    public void testWhereDefaultsToEquals() {
        group.where("name", "bob");
        assertEquals("=", ((Restriction) group.restrictions().get(0)).getOperator());
    }

    @Test(expected = NotFoundException.class)
    public void testWhereUnknownField() {
        group.where("email", "=", "a@b.c");
    }

    @Test
    public void testCopyIsDeep() {
        group.where("age", ">", 18);
        group.group(RestrictionGroup.Type.OR).where("name", "=", "bob");

        RestrictionGroup copy = group.copy();
        ((Restriction) copy.restrictions().get(0)).negate();
        ((RestrictionGroup) copy.restrictions().get(1)).where("name", "=", "alice");

        assertEquals(">", ((Restriction) group.restrictions().get(0)).getOperator());
        assertEquals(1, ((RestrictionGroup) group.restrictions().get(1)).restrictions().size());
        assertTrue(copy.restrictions().get(1) instanceof RestrictionGroup);
    }

    @Test
    public void testConjunctiveWrapsOrGroup() {
        group.setType(RestrictionGroup.Type.OR);
        Restriction bob = new Restriction(users.getOutput("name"), "=", "bob");
        Restriction alice = new Restriction(users.getOutput("name"), "=", "alice");
        group.push(bob).push(alice);

        group.conjunctive().where("age", "IS", null);

        assertEquals(RestrictionGroup.Type.AND, group.getType());
        assertEquals(2, group.restrictions().size());
        RestrictionGroup nested = (RestrictionGroup) group.restrictions().get(0);
        assertEquals(RestrictionGroup.Type.OR, nested.getType());
        assertSame(bob, nested.restrictions().get(0));
        assertSame(alice, nested.restrictions().get(1));
    }

    @Test
    public void testConjunctiveKeepsAndGroup() {
        group.where("age", ">", 18);
        assertSame(group, group.conjunctive());
        assertEquals(1, group.restrictions().size());
        assertTrue(group.restrictions().get(0) instanceof Restriction);
    }
}
