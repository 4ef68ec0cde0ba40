package org.lupenghan.eazystorage.query.models;

/**
 * 作为条件目标的子查询，例如 {@code (SELECT COUNT(*) FROM ...) > 3}
 */
public class SubQuery implements RestrictionTarget {
    private final Query query;

    public SubQuery(Query query) {
        this.query = query;
    }

    @Override
    public boolean isSubQuery() {
        return true;
    }

    @Override
    public FieldIdentifier asField() {
        throw new IllegalStateException("Target is a sub query");
    }

    @Override
    public Query asSubQuery() {
        return query;
    }

    @Override
    public String toString() {
        return "SubQuery(" + query + ")";
    }
}
