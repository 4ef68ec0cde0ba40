package org.lupenghan.eazystorage.driver.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 内存驱动的“方言”：一条语句就是这个对象的 JSON 形式
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemoryStatement {
    public static final String CREATE = "create";
    public static final String DROP = "drop";
    public static final String ADD_FIELD = "addField";
    public static final String ALTER_FIELD = "alterField";
    public static final String DROP_FIELD = "dropField";
    public static final String ADD_INDEX = "addIndex";
    public static final String DROP_INDEX = "dropIndex";
    public static final String HAS_TABLE = "hasTable";
    public static final String INSERT = "insert";
    public static final String UPDATE = "update";
    public static final String DELETE = "delete";
    public static final String SELECT = "select";

    private String op;
    private String schema;
    private String table;
    private String name;                 // 字段名或索引名
    private List<String> columns;
    private String autoIncrement;
    private List<String> primary;
    private List<String> indexes;
    private Boolean primaryIndex;
    private Map<String, Object> values;
    private Map<String, Object> key;     // 按主键定位
    private Map<String, Object> match;   // 没有主键时按整行匹配
    private MemoryFilter where;
    private List<Output> select;
    private List<String> groupBy;
    private List<Order> order;
    private Integer offset;
    private Integer limit;
    private String unsupported;          // 无法表示的查询结构，执行时报错

    public MemoryStatement(String op, String table) {
        this.op = op;
        this.table = table;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Output {
        private String field;
        private String alias;
        private String aggregate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Order {
        private String field;
        private boolean descending;
    }
}
