package org.lupenghan.eazystorage.driver.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 条件树的 JSON 形式。connective 不为空时是分组，否则是一条比较。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemoryFilter {
    private String connective;
    private List<MemoryFilter> children;

    private String field;
    private String operator;
    private Object value;
    private String valueField;   // 与同一行的另一列比较

    public static MemoryFilter group(String connective) {
        MemoryFilter filter = new MemoryFilter();
        filter.connective = connective;
        filter.children = new ArrayList<>();
        return filter;
    }

    public static MemoryFilter compare(String field, String operator, Object value, String valueField) {
        MemoryFilter filter = new MemoryFilter();
        filter.field = field;
        filter.operator = operator;
        filter.value = value;
        filter.valueField = valueField;
        return filter;
    }

    public boolean test(Map<String, Object> row) throws IOException {
        if (connective != null) {
            boolean any = "OR".equals(connective);
            if (children.isEmpty()) {
                return true;
            }
            for (MemoryFilter child : children) {
                boolean result = child.test(row);
                if (any && result) {
                    return true;
                }
                if (!any && !result) {
                    return false;
                }
            }
            return !any;
        }

        Object left = column(row, field);
        Object right = valueField != null ? column(row, valueField) : value;

        switch (operator) {
            case "=":
                return left != null && right != null && same(left, right);
            case "<>":
            case "!=":
                return left != null && right != null && !same(left, right);
            case "<":
                return left != null && right != null && compare(left, right) < 0;
            case ">":
                return left != null && right != null && compare(left, right) > 0;
            case "<=":
                return left != null && right != null && compare(left, right) <= 0;
            case ">=":
                return left != null && right != null && compare(left, right) >= 0;
            case "IN":
                return left != null && contains(right, left);
            case "NOT IN":
                return left != null && !contains(right, left);
            case "IS":
                return right == null ? left == null : left != null && same(left, right);
            case "IS NOT":
                return right == null ? left != null : left == null || !same(left, right);
            case "LIKE":
                return left != null && right != null && like(left, right);
            case "NOT LIKE":
                return left != null && right != null && !like(left, right);
            default:
                throw new IOException("Unsupported operator: " + operator);
        }
    }

    private static Object column(Map<String, Object> row, String name) throws IOException {
        if (!row.containsKey(name)) {
            throw new IOException("Unknown column: " + name);
        }
        return row.get(name);
    }

    static boolean same(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return decimal(left).compareTo(decimal(right)) == 0;
        }
        return left.equals(right);
    }

    static int compare(Object left, Object right) throws IOException {
        Integer result = order(left, right);
        if (result == null) {
            throw new IOException("Cannot compare " + left + " with " + right);
        }
        return result;
    }

    /**
     * 数字之间、字符串之间、布尔之间可比较，其余组合返回 null
     */
    static Integer order(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return decimal(left).compareTo(decimal(right));
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        return null;
    }

    private static boolean contains(Object options, Object value) throws IOException {
        if (!(options instanceof Collection)) {
            throw new IOException("IN requires a list, got: " + options);
        }
        for (Object option : (Collection<?>) options) {
            if (option != null && same(value, option)) {
                return true;
            }
        }
        return false;
    }

    // % 匹配任意串，_ 匹配单个字符，区分大小写
    private static boolean like(Object value, Object pattern) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toString().toCharArray()) {
            if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL).matcher(value.toString()).matches();
    }

    private static BigDecimal decimal(Object number) {
        return new BigDecimal(number.toString());
    }
}
