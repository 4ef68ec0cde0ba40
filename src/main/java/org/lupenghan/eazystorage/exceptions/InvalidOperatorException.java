package org.lupenghan.eazystorage.exceptions;

import lombok.Getter;

/**
 * 运算符没有定义取反形式
 */
@Getter
public class InvalidOperatorException extends IllegalArgumentException {
    private final String operator;

    public InvalidOperatorException(String operator) {
        super("Invalid operator detected: " + operator);
        this.operator = operator;
    }
}
