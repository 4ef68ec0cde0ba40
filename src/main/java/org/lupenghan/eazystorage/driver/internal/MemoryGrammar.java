package org.lupenghan.eazystorage.driver.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.lupenghan.eazystorage.driver.interfaces.QueryGrammar;
import org.lupenghan.eazystorage.driver.interfaces.RecordGrammar;
import org.lupenghan.eazystorage.driver.interfaces.SchemaGrammar;
import org.lupenghan.eazystorage.query.models.FieldIdentifier;
import org.lupenghan.eazystorage.query.models.OrderBy;
import org.lupenghan.eazystorage.query.models.Query;
import org.lupenghan.eazystorage.query.models.QuerySource;
import org.lupenghan.eazystorage.query.models.Restriction;
import org.lupenghan.eazystorage.query.models.RestrictionGroup;
import org.lupenghan.eazystorage.query.models.RestrictionNode;
import org.lupenghan.eazystorage.query.models.SelectExpression;
import org.lupenghan.eazystorage.query.models.SubQuery;
import org.lupenghan.eazystorage.query.models.TableReference;
import org.lupenghan.eazystorage.record.models.Record;
import org.lupenghan.eazystorage.table.models.Field;
import org.lupenghan.eazystorage.table.models.Index;
import org.lupenghan.eazystorage.table.models.Layout;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把查询、记录和结构变更渲染为内存驱动的 JSON 语句。表名统一加上配置的前缀。
 */
public class MemoryGrammar implements QueryGrammar, RecordGrammar, SchemaGrammar {
    private final ObjectMapper mapper;
    private final String prefix;

    public MemoryGrammar(ObjectMapper mapper, String prefix) {
        this.mapper = mapper;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String table(String name) {
        return prefix + name;
    }

    private String render(MemoryStatement statement) {
        try {
            return mapper.writeValueAsString(statement);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String query(Query query) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.SELECT, null);
        QuerySource source = query.getFrom().input();

        if (source.isQuery()) {
            statement.setUnsupported("sub query source");
            return render(statement);
        }
        if (!(source.getTable() instanceof TableReference)) {
            statement.setUnsupported("source " + source);
            return render(statement);
        }
        statement.setTable(table(((TableReference) source.getTable()).getTableName()));
        if (!query.getJoined().isEmpty()) {
            statement.setUnsupported("join");
            return render(statement);
        }

        statement.setWhere(filter(query.restrictions(), statement));

        List<MemoryStatement.Output> outputs = new ArrayList<>();
        for (SelectExpression expression : query.getOutputs()) {
            outputs.add(new MemoryStatement.Output(
                    expression.getInput().getName(),
                    expression.getName(),
                    expression.isAggregate() ? expression.getAggregate().getCode() : null));
        }
        statement.setSelect(outputs);

        List<String> groupBy = new ArrayList<>();
        for (FieldIdentifier field : query.getGroupBy()) {
            groupBy.add(field.getName());
        }
        statement.setGroupBy(groupBy);

        List<MemoryStatement.Order> order = new ArrayList<>();
        for (OrderBy orderBy : query.getOrder()) {
            order.add(new MemoryStatement.Order(orderBy.getField().getName(), orderBy.getDirection() == OrderBy.Direction.DESC));
        }
        statement.setOrder(order);

        statement.setOffset(query.getOffset());
        statement.setLimit(query.getLimit());
        return render(statement);
    }

    private MemoryFilter filter(RestrictionNode node, MemoryStatement statement) {
        if (node instanceof RestrictionGroup) {
            RestrictionGroup group = (RestrictionGroup) node;
            MemoryFilter filter = MemoryFilter.group(group.getType().name());
            for (RestrictionNode child : group.restrictions()) {
                filter.getChildren().add(filter(child, statement));
            }
            return filter;
        }

        Restriction restriction = (Restriction) node;
        if (restriction.getTarget().isSubQuery()) {
            statement.setUnsupported("sub query target");
            return MemoryFilter.group(RestrictionGroup.Type.AND.name());
        }

        Object value = restriction.getValue();
        String valueField = null;
        if (value instanceof FieldIdentifier) {
            valueField = ((FieldIdentifier) value).getName();
            value = null;
        } else if (value instanceof Query || value instanceof SubQuery) {
            statement.setUnsupported("sub query value");
            value = null;
        } else if (restriction.isSequence()) {
            if (value instanceof Collection) {
                value = new ArrayList<>((Collection<?>) value);
            } else if (value instanceof Object[]) {
                value = new ArrayList<>(Arrays.asList((Object[]) value));
            } else {
                statement.setUnsupported("primitive array value");
                value = null;
            }
        }
        return MemoryFilter.compare(restriction.getTarget().asField().getName(), restriction.getOperator(), value, valueField);
    }

    @Override
    public String insertRecord(Layout layout, Record record) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.INSERT, table(layout.getTableName()));
        statement.setValues(new LinkedHashMap<>(record.raw()));
        return render(statement);
    }

    @Override
    public String updateRecord(Layout layout, Record record) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.UPDATE, table(layout.getTableName()));
        statement.setValues(new LinkedHashMap<>(record.diff()));
        locate(statement, record);
        return render(statement);
    }

    @Override
    public String deleteRecord(Layout layout, Record record) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.DELETE, table(layout.getTableName()));
        locate(statement, record);
        return render(statement);
    }

    // 有完整主键时按主键定位，否则按未修改的列整行匹配
    private static void locate(MemoryStatement statement, Record record) {
        Map<String, Object> primary = record.getPrimary();
        if (!primary.isEmpty() && !primary.containsValue(null)) {
            statement.setKey(new LinkedHashMap<>(primary));
            return;
        }
        Map<String, Object> match = new LinkedHashMap<>(record.raw());
        match.keySet().removeAll(record.diff().keySet());
        statement.setMatch(match);
    }

    @Override
    public String createTable(Layout layout) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.CREATE, table(layout.getTableName()));
        statement.setColumns(layout.getFieldNames());
        Field autoIncrement = layout.getAutoIncrement();
        statement.setAutoIncrement(autoIncrement == null ? null : autoIncrement.getName());
        Index primary = layout.getPrimaryKey();
        statement.setPrimary(primary == null ? null : names(primary));
        List<String> indexes = new ArrayList<>();
        for (Index index : layout.getIndexes()) {
            indexes.add(index.getName());
        }
        statement.setIndexes(indexes);
        return render(statement);
    }

    @Override
    public String dropTable(String table) {
        return render(new MemoryStatement(MemoryStatement.DROP, table(table)));
    }

    @Override
    public String addField(Layout layout, Field field) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.ADD_FIELD, table(layout.getTableName()));
        statement.setName(field.getName());
        return render(statement);
    }

    @Override
    public String alterField(Layout layout, Field field) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.ALTER_FIELD, table(layout.getTableName()));
        statement.setName(field.getName());
        statement.setAutoIncrement(field.isAutoIncrement() ? field.getName() : null);
        return render(statement);
    }

    @Override
    public String dropField(Layout layout, String field) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.DROP_FIELD, table(layout.getTableName()));
        statement.setName(field);
        return render(statement);
    }

    @Override
    public String addIndex(Layout layout, Index index) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.ADD_INDEX, table(layout.getTableName()));
        statement.setName(index.getName());
        statement.setColumns(names(index));
        statement.setPrimaryIndex(index.isPrimary());
        return render(statement);
    }

    /**
     * 调用时索引可能已经从 layout 中移除，所以按索引名判断是否为主键
     */
    @Override
    public String dropIndex(Layout layout, String index) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.DROP_INDEX, table(layout.getTableName()));
        statement.setName(index);
        statement.setPrimaryIndex(Layout.PRIMARY_KEY.equals(index));
        return render(statement);
    }

    @Override
    public String hasTable(String schema, String table) {
        MemoryStatement statement = new MemoryStatement(MemoryStatement.HAS_TABLE, table(table));
        statement.setSchema(schema);
        return render(statement);
    }

    private static List<String> names(Index index) {
        List<String> names = new ArrayList<>();
        for (Field field : index.getFields()) {
            names.add(field.getName());
        }
        return names;
    }
}
