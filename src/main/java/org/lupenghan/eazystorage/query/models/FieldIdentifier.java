package org.lupenghan.eazystorage.query.models;

import lombok.Getter;

import java.util.Objects;

/**
 * 指向某个表标识下的一个字段。两个标识相等当且仅当表别名与字段名都相同。
 */
@Getter
public class FieldIdentifier implements OutputObject, RestrictionTarget {
    private final TableIdentifier table;
    private final String name;

    public FieldIdentifier(TableIdentifier table, String name) {
        this.table = table;
        this.name = name;
    }

    @Override
    public String getAlias() {
        return name;
    }

    @Override
    public boolean isSubQuery() {
        return false;
    }

    @Override
    public FieldIdentifier asField() {
        return this;
    }

    @Override
    public Query asSubQuery() {
        throw new IllegalStateException("Field " + this + " is not a sub query");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldIdentifier)) return false;
        FieldIdentifier that = (FieldIdentifier) o;
        return table.getAlias().equals(that.table.getAlias()) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table.getAlias(), name);
    }

    @Override
    public String toString() {
        return table.getAlias() + "." + name;
    }
}
