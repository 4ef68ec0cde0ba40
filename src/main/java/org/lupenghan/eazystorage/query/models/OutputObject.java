package org.lupenghan.eazystorage.query.models;

/**
 * 查询中可以被输出的对象，例如 {@code SELECT SUM(a) AS total, b FROM ...} 中的每一项。
 */
public interface OutputObject {

    /**
     * 所属的表，匿名对象（如聚合）返回 null
     */
    TableIdentifier getTable();

    /**
     * 在表中的名称，匿名对象返回 null
     */
    String getName();

    /**
     * 在查询中引用它时使用的名称，未设置别名时返回 null
     */
    String getAlias();
}
