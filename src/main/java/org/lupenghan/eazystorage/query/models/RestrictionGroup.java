package org.lupenghan.eazystorage.query.models;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 条件组：按 AND 或 OR 连接的 Restriction / 子组，可以任意嵌套。空组恒为真。
 * <p>
 * 按名字添加条件时，字段在组的作用域（查询来源的输出命名空间）中解析，解析失败抛出
 * NotFoundException。
 */
public class RestrictionGroup implements RestrictionNode {

    public enum Type {
        AND, OR
    }

    @Getter
    private final TableIdentifier scope;
    @Getter
    @Setter
    private Type type;
    private final List<RestrictionNode> restrictions = new ArrayList<>();

    public RestrictionGroup(TableIdentifier scope) {
        this(scope, Type.AND);
    }

    public RestrictionGroup(TableIdentifier scope, Type type) {
        this.scope = scope;
        this.type = type;
    }

    public RestrictionGroup where(String field, Object value) {
        return where(field, Restriction.EQUAL_OPERATOR, value);
    }

    public RestrictionGroup where(String field, String operator, Object value) {
        return where(scope.getOutput(field), operator, value);
    }

    public RestrictionGroup where(RestrictionTarget target, String operator, Object value) {
        return push(new Restriction(target, operator, value));
    }

    public RestrictionGroup push(RestrictionNode node) {
        restrictions.add(node);
        return this;
    }

    public RestrictionGroup and(RestrictionNode... nodes) {
        return connect(Type.AND, nodes);
    }

    public RestrictionGroup or(RestrictionNode... nodes) {
        return connect(Type.OR, nodes);
    }

    /**
     * 追加一个嵌套组并返回它，用于继续构建子条件
     */
    public RestrictionGroup group(Type type) {
        RestrictionGroup group = new RestrictionGroup(scope, type);
        restrictions.add(group);
        return group;
    }

    /**
     * 保证本组按 AND 连接：若当前为 OR，原有条件整体下沉为一个 OR 子组，本组改为 AND。
     * 之后追加的条件与原条件是交集关系。
     */
    public RestrictionGroup conjunctive() {
        if (type == Type.AND) {
            return this;
        }
        RestrictionGroup nested = new RestrictionGroup(scope, type);
        nested.restrictions.addAll(restrictions);
        restrictions.clear();
        if (!nested.isEmpty()) {
            restrictions.add(nested);
        }
        type = Type.AND;
        return this;
    }

    private RestrictionGroup connect(Type connective, RestrictionNode... nodes) {
        if (type == connective) {
            Collections.addAll(restrictions, nodes);
            return this;
        }
        RestrictionGroup nested = group(connective);
        Collections.addAll(nested.restrictions, nodes);
        return this;
    }

    public List<RestrictionNode> restrictions() {
        return Collections.unmodifiableList(restrictions);
    }

    public boolean isEmpty() {
        return restrictions.isEmpty();
    }

    @Override
    public RestrictionGroup copy() {
        RestrictionGroup copy = new RestrictionGroup(scope, type);
        for (RestrictionNode node : restrictions) {
            copy.restrictions.add(node.copy());
        }
        return copy;
    }

    @Override
    public String toString() {
        return type + restrictions.toString();
    }
}
