package org.lupenghan.eazystorage.query.models;

/**
 * 输入（表或子查询）与它在查询中的输出命名空间
 */
public class Alias {
    private final QuerySource input;
    private final TableIdentifier output;

    public Alias(QuerySource input, TableIdentifier output) {
        this.input = input;
        this.output = output;
    }

    public QuerySource input() {
        return input;
    }

    public TableIdentifier output() {
        return output;
    }
}
