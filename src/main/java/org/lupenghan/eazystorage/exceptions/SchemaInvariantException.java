package org.lupenghan.eazystorage.exceptions;

/**
 * 结构不变量被破坏（重复主键、枚举选项含分隔符、外键指向无主键的表等）。
 * 这些都是编写迁移时的编程错误，构造时立即失败。
 */
public class SchemaInvariantException extends IllegalStateException {

    public SchemaInvariantException(String message) {
        super(message);
    }
}
