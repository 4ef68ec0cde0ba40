package org.lupenghan.eazystorage.query.models;

/**
 * 条件树中的节点：单个 Restriction 或嵌套的 RestrictionGroup
 */
public interface RestrictionNode {

    RestrictionNode copy();
}
