package org.lupenghan.eazystorage.table.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 列定义类
 */
@Getter
@ToString
@EqualsAndHashCode
public class Field {
    private final String name;           // 列名
    private final FieldType type;        // 数据类型
    private final boolean nullable;      // 是否允许 NULL
    private final boolean autoIncrement; // 是否自增

    @JsonCreator
    public Field(@JsonProperty("name") String name,
                 @JsonProperty("type") FieldType type,
                 @JsonProperty("nullable") boolean nullable,
                 @JsonProperty("autoIncrement") boolean autoIncrement) {
        this.name = name;
        this.type = type;
        this.nullable = nullable;
        this.autoIncrement = autoIncrement;
    }

    public Field withName(String name) {
        return new Field(name, type, nullable, autoIncrement);
    }
}
