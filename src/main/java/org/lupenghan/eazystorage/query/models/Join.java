package org.lupenghan.eazystorage.query.models;

import lombok.Getter;

/**
 * 连接到查询上的一张表。ON 条件写在它自己的条件组里，作用域是被连接表的别名。
 * <p>
 * 本层不负责把连接和主查询关联起来，调用方（或模型层）需要自己写出关联条件。
 */
@Getter
public class Join {
    private final JoinType type;
    private final Alias source;
    private final RestrictionGroup restrictions;

    public Join(JoinType type, Alias source) {
        this.type = type;
        this.source = source;
        this.restrictions = new RestrictionGroup(source.output());
    }

    private Join(Join other) {
        this.type = other.type;
        this.source = other.source;
        this.restrictions = other.restrictions.copy();
    }

    public TableIdentifier output() {
        return source.output();
    }

    public FieldIdentifier getOutput(String name) {
        return source.output().getOutput(name);
    }

    /**
     * 添加 ON 条件：本连接的字段与另一个字段（通常来自主查询）比较
     */
    public Join on(String field, String operator, FieldIdentifier other) {
        restrictions.where(field, operator, other);
        return this;
    }

    Join copy() {
        return new Join(this);
    }
}
