package org.lupenghan.eazystorage.driver.interfaces;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public interface QueryResult {

    /**
     * 下一行（列名到值，按列顺序），没有更多数据时返回 null
     */
    Map<String, Object> fetch() throws IOException;

    default List<Map<String, Object>> fetchAll() throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, Object> row;
        while ((row = fetch()) != null) {
            rows.add(row);
        }
        return rows;
    }
}
