package org.lupenghan.eazystorage.table.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 外键：本表的一个字段引用远端表的主键字段
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ForeignKey extends Index {
    private final String referencedTable;    // 引用的目标表名
    private final Field referencedField;     // 引用的目标列

    public ForeignKey(String name, Field field, String referencedTable, Field referencedField) {
        this(name, List.of(field), referencedTable, referencedField);
    }

    @JsonCreator
    private ForeignKey(@JsonProperty("name") String name,
                       @JsonProperty("fields") List<Field> fields,
                       @JsonProperty("referencedTable") String referencedTable,
                       @JsonProperty("referencedField") Field referencedField) {
        super(name, fields, false, false);
        this.referencedTable = referencedTable;
        this.referencedField = referencedField;
    }

    public Field getField() {
        return getFields().get(0);
    }
}
