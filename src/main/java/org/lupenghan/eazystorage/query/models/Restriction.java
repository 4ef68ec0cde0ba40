package org.lupenghan.eazystorage.query.models;

import lombok.Getter;
import org.lupenghan.eazystorage.exceptions.InvalidOperatorException;

import java.util.Collection;
import java.util.Map;

/**
 * 一条比较条件，记录必须满足它才会被查询返回。
 * <p>
 * 值可以是标量、标量集合、另一个字段（{@link FieldIdentifier}）或 null。
 * 运算符只去掉首尾空白，不做校验，由各个方言的 grammar 解释。
 */
public class Restriction implements RestrictionNode {
    public static final String EQUAL_OPERATOR = "=";
    public static final String NOT_EQUAL_OPERATOR = "<>";
    public static final String GREATER_OPERATOR = ">";
    public static final String LESS_OPERATOR = "<";
    public static final String IS_OPERATOR = "IS";
    public static final String IS_NOT_OPERATOR = "IS NOT";
    public static final String LIKE_OPERATOR = "LIKE";
    public static final String NOT_LIKE_OPERATOR = "NOT LIKE";
    public static final String IN_OPERATOR = "IN";
    public static final String NOT_IN_OPERATOR = "NOT IN";

    private static final Map<String, String> COMPLEMENTS = Map.of(
            EQUAL_OPERATOR, NOT_EQUAL_OPERATOR,
            NOT_EQUAL_OPERATOR, EQUAL_OPERATOR,
            GREATER_OPERATOR, LESS_OPERATOR,
            LESS_OPERATOR, GREATER_OPERATOR,
            IS_OPERATOR, IS_NOT_OPERATOR,
            IS_NOT_OPERATOR, IS_OPERATOR,
            LIKE_OPERATOR, NOT_LIKE_OPERATOR,
            NOT_LIKE_OPERATOR, LIKE_OPERATOR
    );

    @Getter
    private final RestrictionTarget target;
    private String operator;
    @Getter
    private final Object value;

    public Restriction(RestrictionTarget target, String operator, Object value) {
        this.target = target;
        this.operator = operator.trim();
        this.value = value;
    }

    /**
     * 实际生效的运算符：值是集合而运算符不是 IN / NOT IN 时视为 IN。不修改存储的运算符。
     */
    public String getOperator() {
        if (isSequence() && !IN_OPERATOR.equals(operator) && !NOT_IN_OPERATOR.equals(operator)) {
            return IN_OPERATOR;
        }
        return operator;
    }

    public String getRawOperator() {
        return operator;
    }

    public boolean isSequence() {
        return value instanceof Collection || (value != null && value.getClass().isArray());
    }

    /**
     * 把运算符替换为它的取反形式并返回新运算符。
     *
     * @throws InvalidOperatorException 运算符没有取反形式，此时条件保持不变
     */
    public String negate() {
        String complement = COMPLEMENTS.get(operator);
        if (complement == null) {
            throw new InvalidOperatorException(operator);
        }
        operator = complement;
        return operator;
    }

    @Override
    public Restriction copy() {
        return new Restriction(target, operator, value);
    }

    @Override
    public String toString() {
        return target + " " + getOperator() + " " + value;
    }
}
