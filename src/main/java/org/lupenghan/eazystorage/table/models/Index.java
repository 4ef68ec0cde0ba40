package org.lupenghan.eazystorage.table.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 索引定义。主键也是索引，只是 primary 为 true。
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = Index.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Index.class, name = "index"),
        @JsonSubTypes.Type(value = ForeignKey.class, name = "foreign")
})
public class Index {
    private final String name;
    private final List<Field> fields;   // 有序
    private final boolean unique;
    private final boolean primary;

    @JsonCreator
    public Index(@JsonProperty("name") String name,
                 @JsonProperty("fields") List<Field> fields,
                 @JsonProperty("unique") boolean unique,
                 @JsonProperty("primary") boolean primary) {
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.unique = unique;
        this.primary = primary;
    }

    public Index(String name, List<Field> fields) {
        this(name, fields, false, false);
    }

    /**
     * 主键总是唯一的。需要判断唯一性时必须调用这个方法，而不是读取 unique 字段。
     */
    public boolean isUnique() {
        return unique || primary;
    }

    public boolean references(String fieldName) {
        for (Field field : fields) {
            if (field.getName().equals(fieldName)) {
                return true;
            }
        }
        return false;
    }
}
