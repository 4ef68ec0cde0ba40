package org.lupenghan.eazystorage.query.models;

public enum JoinType {
    INNER, LEFT, RIGHT
}
