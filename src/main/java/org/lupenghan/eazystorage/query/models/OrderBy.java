package org.lupenghan.eazystorage.query.models;

import lombok.Getter;

@Getter
public class OrderBy {

    public enum Direction {
        ASC, DESC
    }

    private final FieldIdentifier field;
    private final Direction direction;

    public OrderBy(FieldIdentifier field, Direction direction) {
        this.field = field;
        this.direction = direction;
    }

    public OrderBy(FieldIdentifier field) {
        this(field, Direction.ASC);
    }
}
