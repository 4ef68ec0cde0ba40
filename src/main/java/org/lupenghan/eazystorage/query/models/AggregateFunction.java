package org.lupenghan.eazystorage.query.models;

import lombok.Getter;

@Getter
public enum AggregateFunction {
    COUNT("count"),
    SUM("sum"),
    MIN("min"),
    MAX("max"),
    AVG("avg");

    private final String code;

    AggregateFunction(String code) {
        this.code = code;
    }
}
