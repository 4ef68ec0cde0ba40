package org.lupenghan.eazystorage.driver.interfaces;

import org.lupenghan.eazystorage.table.models.Field;
import org.lupenghan.eazystorage.table.models.Index;
import org.lupenghan.eazystorage.table.models.Layout;

public interface SchemaGrammar {

    String createTable(Layout layout);

    String dropTable(String table);

    String addField(Layout layout, Field field);

    String alterField(Layout layout, Field field);

    String dropField(Layout layout, String field);

    String addIndex(Layout layout, Index index);

    String dropIndex(Layout layout, String index);

    /**
     * 查询表是否存在的语句，结果第一列是匹配的表数量
     */
    String hasTable(String schema, String table);
}
