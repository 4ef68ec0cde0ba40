package org.lupenghan.eazystorage.query.models;

/**
 * 聚合输出，例如 {@code COUNT(t_1._id) AS count_t_1__id}。
 * <p>
 * 别名由操作、表别名和字段别名拼出，同一个查询内稳定且不易冲突。
 */
public class Aggregate implements OutputObject {
    private OutputObject input;
    private AggregateFunction operation;
    private String alias;

    public Aggregate(OutputObject input, AggregateFunction operation) {
        this.alias = String.format("%s_%s_%s", operation.getCode(), input.getTable().getAlias(), input.getAlias());
        this.input = input;
        this.operation = operation;
    }

    public OutputObject getInput() {
        return input;
    }

    public AggregateFunction getOperation() {
        return operation;
    }

    // 聚合是匿名的
    @Override
    public TableIdentifier getTable() {
        return null;
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    public Aggregate setInput(OutputObject input) {
        this.input = input;
        return this;
    }

    public Aggregate setOperation(AggregateFunction operation) {
        this.operation = operation;
        return this;
    }

    public Aggregate setAlias(String alias) {
        this.alias = alias;
        return this;
    }
}
