package org.lupenghan.eazystorage.query.models;

/**
 * 条件的左侧：要么是一个字段，要么是一个子查询。
 */
public interface RestrictionTarget {

    boolean isSubQuery();

    /**
     * @throws IllegalStateException 目标是子查询时
     */
    FieldIdentifier asField();

    /**
     * @throws IllegalStateException 目标是字段时
     */
    Query asSubQuery();
}
