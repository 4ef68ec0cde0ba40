package org.lupenghan.eazystorage.table.models;

import lombok.Getter;

/**
 * 数据类型枚举
 */
@Getter
public enum DataType {
    INT("int", 4),
    LONG("long", 8),
    DOUBLE("double", 8),
    BOOLEAN("bool", 1),
    STRING("string", -1),
    TEXT("text", -1),
    ENUM("enum", -1);

    // 编码形式中的类型名，如 string:255 里的 string
    private final String code;
    private final int defaultLength;

    DataType(String code, int defaultLength) {
        this.code = code;
        this.defaultLength = defaultLength;
    }

    public static DataType fromCode(String code) {
        for (DataType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported data type: " + code);
    }
}
