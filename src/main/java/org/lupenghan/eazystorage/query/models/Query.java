package org.lupenghan.eazystorage.query.models;

import org.lupenghan.eazystorage.exceptions.NotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * 查询：来源、连接、条件树、输出、分组、排序和分页。驱动的 grammar 负责把它转换成
 * 具体方言的语句。
 * <p>
 * 输出、排序和分组引用的字段必须属于来源或某个连接，否则抛出 NotFoundException。
 */
public class Query {

    private final Alias from;
    private final List<Join> joins;
    private final RestrictionGroup where;
    private final List<SelectExpression> select;
    private List<FieldIdentifier> groupBy;
    private final List<OrderBy> order;

    private Integer offset;
    private Integer limit;

    public Query(TableIdentifier table) {
        this(QuerySource.of(table));
    }

    public Query(Query subquery) {
        this(QuerySource.of(subquery));
    }

    public Query(QuerySource source) {
        this.from = new Alias(source, source.withAlias());
        this.joins = new ArrayList<>();
        this.where = new RestrictionGroup(from.output());
        this.select = new ArrayList<>();
        this.groupBy = new ArrayList<>();
        this.order = new ArrayList<>();
    }

    private Query(Query other, boolean keepOutputs) {
        this.from = other.from;
        this.joins = new ArrayList<>();
        for (Join join : other.joins) {
            this.joins.add(join.copy());
        }
        this.where = other.where.copy();
        this.select = keepOutputs ? new ArrayList<>(other.select) : new ArrayList<>();
        this.groupBy = new ArrayList<>(other.groupBy);
        this.order = keepOutputs ? new ArrayList<>(other.order) : new ArrayList<>();
        this.offset = other.offset;
        this.limit = other.limit;
    }

    public Join joinTable(TableIdentifier table) {
        return joinTable(table, JoinType.INNER, null);
    }

    public Join joinTable(TableIdentifier table, BiConsumer<Join, Query> configurator) {
        return joinTable(table, JoinType.INNER, configurator);
    }

    /**
     * 连接一张表。configurator 会在返回之前同步调用一次，参数是新的连接和当前查询，
     * 方便调用方写出跨表的 ON 条件。
     */
    public Join joinTable(TableIdentifier table, JoinType type, BiConsumer<Join, Query> configurator) {
        Join join = new Join(type, new Alias(QuerySource.of(table), table.withAlias()));
        joins.add(join);

        if (configurator != null) {
            configurator.accept(join, this);
        }
        return join;
    }

    public List<Join> getJoined() {
        return Collections.unmodifiableList(joins);
    }

    public RestrictionGroup restrictions() {
        return where;
    }

    public Query where(String field, Object value) {
        where.where(field, value);
        return this;
    }

    public Query where(String field, String operator, Object value) {
        where.where(field, operator, value);
        return this;
    }

    public Query where(RestrictionTarget target, String operator, Object value) {
        where.where(target, operator, value);
        return this;
    }

    /**
     * 追加排序，后加入的排序从属于之前的排序
     */
    public Query putOrder(OrderBy orderBy) {
        requireResolvable(orderBy.getField());
        order.add(orderBy);
        return this;
    }

    public Query order(String field, OrderBy.Direction direction) {
        return putOrder(new OrderBy(from.output().getOutput(field), direction));
    }

    /**
     * 设置跳过的记录数和返回的最大记录数，null 表示不限制
     */
    public Query range(Integer skip, Integer count) {
        this.offset = skip;
        this.limit = count;
        return this;
    }

    public Integer getOffset() {
        return offset;
    }

    public Integer getLimit() {
        return limit;
    }

    public Query groupBy(List<FieldIdentifier> columns) {
        for (FieldIdentifier column : columns) {
            requireResolvable(column);
        }
        this.groupBy = new ArrayList<>(columns);
        return this;
    }

    public List<FieldIdentifier> getGroupBy() {
        return Collections.unmodifiableList(groupBy);
    }

    public List<SelectExpression> selectAll() {
        return selectAll(from.output());
    }

    public List<SelectExpression> selectAll(TableIdentifier table) {
        List<SelectExpression> added = new ArrayList<>();
        for (FieldIdentifier output : table.getOutputs()) {
            requireResolvable(output);
            added.add(new SelectExpression(output));
        }
        select.addAll(added);
        return added;
    }

    public SelectExpression select(String name) {
        return select(name, null);
    }

    public SelectExpression select(String name, String alias) {
        FieldIdentifier field = from.output().getOutput(name);
        SelectExpression expression = new SelectExpression(field, alias);
        select.add(expression);
        return expression;
    }

    public SelectExpression selectField(FieldIdentifier field) {
        return selectField(field, null);
    }

    public SelectExpression selectField(FieldIdentifier field, String alias) {
        requireResolvable(field);
        SelectExpression expression = new SelectExpression(field, alias);
        select.add(expression);
        return expression;
    }

    /**
     * 以显式别名追加一个聚合输出，不会自动生成别名
     */
    public Query aggregate(FieldIdentifier field, AggregateFunction fn, String alias) {
        requireResolvable(field);
        select.add(new SelectExpression(field, alias, fn));
        return this;
    }

    public Query aggregate(Aggregate aggregate) {
        if (!(aggregate.getInput() instanceof FieldIdentifier)) {
            throw new IllegalArgumentException("Aggregate input must be a field: " + aggregate.getAlias());
        }
        return aggregate((FieldIdentifier) aggregate.getInput(), aggregate.getOperation(), aggregate.getAlias());
    }

    /**
     * 复制一个不输出任何字段的查询，用于 count 之类的元数据查询。
     * 排序通常依赖输出，所以也一起清除；条件、连接和分组保留。
     */
    public Query withoutSelect() {
        return new Query(this, false);
    }

    public Query copy() {
        return new Query(this, true);
    }

    public SelectExpression getOutput(String name) {
        for (SelectExpression expression : select) {
            if (expression.getName().equals(name)) {
                return expression;
            }
        }
        throw new NotFoundException("Output " + name + " is not selected by " + this);
    }

    public List<SelectExpression> getOutputs() {
        return Collections.unmodifiableList(select);
    }

    public List<OrderBy> getOrder() {
        return Collections.unmodifiableList(order);
    }

    public Alias getFrom() {
        return from;
    }

    /**
     * 查询实际读取的表（来源的输出命名空间）
     */
    public TableIdentifier getTable() {
        return from.output();
    }

    private void requireResolvable(FieldIdentifier field) {
        if (from.output().getOutputs().contains(field)) {
            return;
        }
        for (Join join : joins) {
            if (join.output().getOutputs().contains(field)) {
                return;
            }
        }
        throw new NotFoundException("Field " + field + " is not part of the source or joins of " + this);
    }

    @Override
    public String toString() {
        if (from.input().isQuery()) {
            return String.format("Query(%s) {%d}", String.join(".", from.output().raw()), where.restrictions().size());
        }
        return String.format("Table(%s) {%d}", String.join(".", from.input().getTable().raw()), where.restrictions().size());
    }
}
