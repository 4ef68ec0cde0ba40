package org.lupenghan.eazystorage.query.models;

import java.util.ArrayList;
import java.util.List;

/**
 * 查询的数据来源：一张表，或者一个子查询。
 */
public final class QuerySource {
    private final TableIdentifier table;
    private final Query query;

    private QuerySource(TableIdentifier table, Query query) {
        this.table = table;
        this.query = query;
    }

    public static QuerySource of(TableIdentifier table) {
        return new QuerySource(table, null);
    }

    public static QuerySource of(Query query) {
        return new QuerySource(null, query);
    }

    public boolean isQuery() {
        return query != null;
    }

    public TableIdentifier getTable() {
        if (table == null) {
            throw new IllegalStateException("Source is a sub query");
        }
        return table;
    }

    public Query getQuery() {
        if (query == null) {
            throw new IllegalStateException("Source is a table");
        }
        return query;
    }

    /**
     * 来源对外暴露的字段名。子查询的输出就是它的 SELECT 列表。
     */
    public List<String> outputNames() {
        List<String> names = new ArrayList<>();
        if (isQuery()) {
            for (SelectExpression expression : query.getOutputs()) {
                names.add(expression.getName());
            }
        } else {
            for (FieldIdentifier output : table.getOutputs()) {
                names.add(output.getName());
            }
        }
        return names;
    }

    public TableIdentifier withAlias() {
        return isQuery() ? AliasedTable.next(outputNames()) : table.withAlias();
    }

    @Override
    public String toString() {
        return isQuery() ? "Query(" + query + ")" : String.join(".", table.raw());
    }
}
