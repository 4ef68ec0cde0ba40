package org.lupenghan.eazystorage.query.models;

import lombok.Getter;

/**
 * SELECT 列表中的一项：字段、可选别名和可选聚合函数
 */
@Getter
public class SelectExpression implements OutputObject {
    private final FieldIdentifier input;
    private final String alias;
    private final AggregateFunction aggregate;

    public SelectExpression(FieldIdentifier input) {
        this(input, null, null);
    }

    public SelectExpression(FieldIdentifier input, String alias) {
        this(input, alias, null);
    }

    public SelectExpression(FieldIdentifier input, String alias, AggregateFunction aggregate) {
        this.input = input;
        this.alias = alias;
        this.aggregate = aggregate;
    }

    @Override
    public TableIdentifier getTable() {
        return input.getTable();
    }

    /**
     * 输出名：有别名用别名，否则用字段名
     */
    @Override
    public String getName() {
        return alias != null ? alias : input.getName();
    }

    public boolean isAggregate() {
        return aggregate != null;
    }
}
