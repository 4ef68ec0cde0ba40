package org.lupenghan.eazystorage.driver.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.connection.Settings;
import org.lupenghan.eazystorage.driver.interfaces.Driver;
import org.lupenghan.eazystorage.driver.interfaces.QueryGrammar;
import org.lupenghan.eazystorage.driver.interfaces.QueryResult;
import org.lupenghan.eazystorage.driver.interfaces.RecordGrammar;
import org.lupenghan.eazystorage.driver.interfaces.SchemaGrammar;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 完全在内存中运行的驱动，语句是 {@link MemoryStatement} 的 JSON 形式。
 * 用于测试和不需要持久化的场景。不支持连接查询和子查询。
 */
@Slf4j
public class InMemoryDriver implements Driver {
    public static final String SCHEME = "memory";

    @Getter
    private final Settings settings;
    private final boolean tags;
    private final ObjectMapper mapper = new ObjectMapper();
    private final MemoryGrammar grammar;
    private final Map<String, MemoryTable> tables = new LinkedHashMap<>();
    private final List<String> statements = new ArrayList<>();
    private boolean connected;
    private long lastInsertId;

    public InMemoryDriver(Settings settings) {
        this(settings, true);
    }

    public InMemoryDriver(Settings settings, boolean supportsTags) {
        this.settings = settings;
        this.tags = supportsTags;
        this.grammar = new MemoryGrammar(mapper, settings.getPrefix());
    }

    @Override
    public void connect() {
        connected = true;
        log.info("内存数据库 {} 已连接", settings.getSchema());
    }

    /**
     * 已执行语句的记录，按执行顺序
     */
    public List<String> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public boolean hasTable(String table) {
        return tables.containsKey(table);
    }

    @Override
    public int write(String statement) throws IOException {
        MemoryStatement parsed = parse(statement);
        switch (parsed.getOp()) {
            case MemoryStatement.CREATE: {
                if (tables.containsKey(parsed.getTable())) {
                    throw new IOException("Table already exists: " + parsed.getTable());
                }
                tables.put(parsed.getTable(), new MemoryTable(parsed.getTable(), parsed.getColumns(),
                        parsed.getIndexes(), parsed.getPrimary(), parsed.getAutoIncrement()));
                return 0;
            }
            case MemoryStatement.DROP: {
                if (tables.remove(parsed.getTable()) == null) {
                    throw new IOException("Table does not exist: " + parsed.getTable());
                }
                return 0;
            }
            case MemoryStatement.ADD_FIELD:
                table(parsed).addColumn(parsed.getName());
                return 0;
            case MemoryStatement.ALTER_FIELD:
                table(parsed).alterColumn(parsed.getName(), parsed.getAutoIncrement() != null);
                return 0;
            case MemoryStatement.DROP_FIELD:
                table(parsed).dropColumn(parsed.getName());
                return 0;
            case MemoryStatement.ADD_INDEX:
                table(parsed).addIndex(parsed.getName(), parsed.getColumns(), Boolean.TRUE.equals(parsed.getPrimaryIndex()));
                return 0;
            case MemoryStatement.DROP_INDEX:
                table(parsed).dropIndex(parsed.getName(), Boolean.TRUE.equals(parsed.getPrimaryIndex()));
                return 0;
            case MemoryStatement.INSERT:
                lastInsertId = table(parsed).insert(parsed.getValues());
                return 1;
            case MemoryStatement.UPDATE:
                return table(parsed).update(locator(parsed), parsed.getValues());
            case MemoryStatement.DELETE:
                return table(parsed).delete(locator(parsed), parsed.getKey() == null);
            default:
                throw new IOException("Not a write statement: " + parsed.getOp());
        }
    }

    @Override
    public QueryResult read(String statement) throws IOException {
        MemoryStatement parsed = parse(statement);
        switch (parsed.getOp()) {
            case MemoryStatement.HAS_TABLE: {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("count", tables.containsKey(parsed.getTable()) ? 1 : 0);
                return new MemoryResult(List.of(row));
            }
            case MemoryStatement.SELECT:
                return new MemoryResult(select(parsed));
            default:
                throw new IOException("Not a read statement: " + parsed.getOp());
        }
    }

    @Override
    public long lastInsertId() {
        return lastInsertId;
    }

    @Override
    public QueryGrammar getDefaultQueryGrammar() {
        return grammar;
    }

    @Override
    public RecordGrammar getDefaultRecordGrammar() {
        return grammar;
    }

    @Override
    public SchemaGrammar getDefaultSchemaGrammar() {
        return grammar;
    }

    @Override
    public boolean supportsTags() {
        return tags;
    }

    private MemoryStatement parse(String statement) throws IOException {
        if (!connected) {
            throw new IOException("Driver is not connected");
        }
        statements.add(statement);
        MemoryStatement parsed = mapper.readValue(statement, MemoryStatement.class);
        if (parsed.getUnsupported() != null) {
            log.error("内存驱动无法执行语句: {}", statement);
            throw new IOException("Unsupported by the in-memory driver: " + parsed.getUnsupported());
        }
        return parsed;
    }

    private MemoryTable table(MemoryStatement statement) throws IOException {
        MemoryTable table = tables.get(statement.getTable());
        if (table == null) {
            throw new IOException("Table does not exist: " + statement.getTable());
        }
        return table;
    }

    private static Map<String, Object> locator(MemoryStatement statement) throws IOException {
        if (statement.getKey() != null) {
            return statement.getKey();
        }
        if (statement.getMatch() != null) {
            return statement.getMatch();
        }
        throw new IOException("Statement does not locate a row: " + statement.getOp());
    }

    private List<Map<String, Object>> select(MemoryStatement statement) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : table(statement).rows()) {
            if (statement.getWhere() == null || statement.getWhere().test(row)) {
                rows.add(row);
            }
        }

        if (statement.getOrder() != null && !statement.getOrder().isEmpty()) {
            for (MemoryStatement.Order order : statement.getOrder()) {
                for (Map<String, Object> row : rows) {
                    if (!row.containsKey(order.getField())) {
                        throw new IOException("Unknown column: " + order.getField());
                    }
                }
            }
            for (MemoryStatement.Order order : statement.getOrder()) {
                comparable(rows, order.getField());
            }
            rows.sort(ordering(statement.getOrder()));
        }

        List<Map<String, Object>> projected = project(statement, rows);

        int from = statement.getOffset() == null ? 0 : Math.min(statement.getOffset(), projected.size());
        int to = statement.getLimit() == null ? projected.size() : Math.min(from + statement.getLimit(), projected.size());
        return new ArrayList<>(projected.subList(from, to));
    }

    // 排序前确认该列的非空值两两可比较，与第一个非空值可比较即可
    private static void comparable(List<Map<String, Object>> rows, String field) throws IOException {
        Object first = null;
        for (Map<String, Object> row : rows) {
            Object value = row.get(field);
            if (value == null) {
                continue;
            }
            if (first == null) {
                first = value;
            } else {
                MemoryFilter.compare(first, value);
            }
        }
    }

    private static Comparator<Map<String, Object>> ordering(List<MemoryStatement.Order> orders) {
        return (a, b) -> {
            for (MemoryStatement.Order order : orders) {
                Object left = a.get(order.getField());
                Object right = b.get(order.getField());
                int result;
                if (left == null || right == null) {
                    // NULL 排在最前
                    result = left == null ? (right == null ? 0 : -1) : 1;
                } else {
                    Integer compared = MemoryFilter.order(left, right);
                    result = compared == null ? 0 : compared;
                }
                if (result != 0) {
                    return order.isDescending() ? -result : result;
                }
            }
            return 0;
        };
    }

    private static List<Map<String, Object>> project(MemoryStatement statement, List<Map<String, Object>> rows) throws IOException {
        List<MemoryStatement.Output> outputs = statement.getSelect() == null ? List.of() : statement.getSelect();
        List<String> groupBy = statement.getGroupBy() == null ? List.of() : statement.getGroupBy();

        boolean aggregated = !groupBy.isEmpty();
        for (MemoryStatement.Output output : outputs) {
            aggregated |= output.getAggregate() != null;
        }

        if (!aggregated) {
            List<Map<String, Object>> result = new ArrayList<>();
            for (Map<String, Object> row : rows) {
                if (outputs.isEmpty()) {
                    result.add(new LinkedHashMap<>(row));
                    continue;
                }
                Map<String, Object> projected = new LinkedHashMap<>();
                for (MemoryStatement.Output output : outputs) {
                    projected.put(output.getAlias(), value(row, output.getField()));
                }
                result.add(projected);
            }
            return result;
        }

        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            List<Object> key = new ArrayList<>();
            for (String column : groupBy) {
                key.add(value(row, column));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        if (groups.isEmpty() && groupBy.isEmpty()) {
            groups.put(List.of(), List.of());
        }

        List<Map<String, Object>> result = new ArrayList<>();
        for (List<Map<String, Object>> group : groups.values()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (MemoryStatement.Output output : outputs) {
                if (output.getAggregate() == null) {
                    projected.put(output.getAlias(), group.isEmpty() ? null : value(group.get(0), output.getField()));
                } else {
                    projected.put(output.getAlias(), aggregate(output, group));
                }
            }
            result.add(projected);
        }
        return result;
    }

    private static Object aggregate(MemoryStatement.Output output, List<Map<String, Object>> group) throws IOException {
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> row : group) {
            Object value = value(row, output.getField());
            if (value != null) {
                values.add(value);
            }
        }

        switch (output.getAggregate()) {
            case "count":
                return (long) values.size();
            case "sum":
            case "avg": {
                if (values.isEmpty()) {
                    return null;
                }
                double sum = 0;
                for (Object value : values) {
                    if (!(value instanceof Number)) {
                        throw new IOException("Cannot " + output.getAggregate() + " non numeric value " + value);
                    }
                    sum += ((Number) value).doubleValue();
                }
                return "sum".equals(output.getAggregate()) ? sum : sum / values.size();
            }
            case "min":
            case "max": {
                Object best = null;
                for (Object value : values) {
                    if (best == null) {
                        best = value;
                        continue;
                    }
                    int result = MemoryFilter.compare(value, best);
                    if ("min".equals(output.getAggregate()) ? result < 0 : result > 0) {
                        best = value;
                    }
                }
                return best;
            }
            default:
                throw new IOException("Unsupported aggregate: " + output.getAggregate());
        }
    }

    private static Object value(Map<String, Object> row, String column) throws IOException {
        if (!row.containsKey(column)) {
            throw new IOException("Unknown column: " + column);
        }
        return row.get(column);
    }
}
