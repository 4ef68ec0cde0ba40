package org.lupenghan.eazystorage.query.models;

import org.junit.Before;
import org.junit.Test;
import org.lupenghan.eazystorage.exceptions.NotFoundException;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class QueryTest {
    private TableReference users;
    private TableReference posts;
    private Query query;

    @Before
    public void setUp() {
        users = new TableReference("users", List.of("_id", "name", "age"));
        posts = new TableReference("posts", List.of("_id", "user_id", "title"));
        query = new Query(users);
    }

    @Test
    public void testSourceIsAliased() {
        assertTrue(query.getTable().getAlias().startsWith("t_"));
        assertFalse(query.getFrom().input().isQuery());

        // 每次都生成新的别名
        Query other = new Query(users);
        assertFalse(query.getTable().getAlias().equals(other.getTable().getAlias()));
    }

    @Test
    public void testWhereResolvesAgainstAlias() {
        query.where("age", ">", 18);
        Restriction restriction = (Restriction) query.restrictions().restrictions().get(0);
        assertEquals(query.getTable().getAlias(), restriction.getTarget().asField().getTable().getAlias());
        assertEquals("Table(users) {1}", query.toString());
    }

    @Test
    public void testRange() {
        assertNull(query.getOffset());
        assertNull(query.getLimit());
        query.range(10, 5);
        assertEquals(Integer.valueOf(10), query.getOffset());
        assertEquals(Integer.valueOf(5), query.getLimit());
        // 传入 null 清除分页
        query.range(null, null);
        assertNull(query.getOffset());
        assertNull(query.getLimit());
    }

    @Test
    public void testSelectWithAlias() {
        query.select("name", "n");
        assertEquals("name", query.getOutput("n").getInput().getName());
        assertFalse(query.getOutput("n").isAggregate());
    }

    @Test(expected = NotFoundException.class)
    public void testSelectUnknownField() {
        query.select("email");
    }

    @Test(expected = NotFoundException.class)
    public void testSelectFieldOutsideQuery() {
        query.selectField(posts.getOutput("title"), null);
    }

    @Test
    public void testWithoutSelectKeepsRestrictions() {
        query.select("name");
        query.order("age", OrderBy.Direction.DESC);
        query.where("age", ">", 18);

        Query count = query.withoutSelect();
        assertTrue(count.getOutputs().isEmpty());
        assertTrue(count.getOrder().isEmpty());
        assertEquals(1, count.restrictions().restrictions().size());

        assertEquals(1, query.getOutputs().size());
        assertEquals(1, query.getOrder().size());
    }

    @Test
    public void testCopyIsIndependent() {
        query.where("age", ">", 18);
        Query copy = query.copy();
        copy.where("name", "bob");

        assertEquals(1, query.restrictions().restrictions().size());
        assertEquals(2, copy.restrictions().restrictions().size());
        assertEquals(query.getTable().getAlias(), copy.getTable().getAlias());
    }

    @Test
    public void testJoinConfigurator() {
        Join join = query.joinTable(posts, (j, q) -> j.on("user_id", "=", q.getTable().getOutput("_id")));

        assertEquals(1, query.getJoined().size());
        assertEquals(JoinType.INNER, join.getType());
        assertEquals(1, join.getRestrictions().restrictions().size());

        // 连接后的字段可以输出
        query.selectField(join.getOutput("title"), "title");
        assertEquals("title", query.getOutput("title").getName());
    }

    @Test
    public void testAggregateAlias() {
        FieldIdentifier id = query.getTable().getOutput("_id");
        Aggregate count = new Aggregate(id, AggregateFunction.COUNT);
        assertEquals("count_" + query.getTable().getAlias() + "__id", count.getAlias());

        query.aggregate(count);
        assertTrue(query.getOutput(count.getAlias()).isAggregate());

        query.aggregate(query.getTable().getOutput("age"), AggregateFunction.MAX, "oldest");
        assertEquals(AggregateFunction.MAX, query.getOutput("oldest").getAggregate());
    }

    @Test(expected = NotFoundException.class)
    public void testGroupByOutsideQuery() {
        query.groupBy(List.of(posts.getOutput("user_id")));
    }

    @Test
    public void testSubQuerySource() {
        query.select("name");
        Query outer = new Query(query);

        assertTrue(outer.getFrom().input().isQuery());
        assertTrue(outer.getTable().hasOutput("name"));
        assertFalse(outer.getTable().hasOutput("age"));
        assertEquals(String.format("Query(%s) {0}", outer.getTable().getAlias()), outer.toString());
    }
}
