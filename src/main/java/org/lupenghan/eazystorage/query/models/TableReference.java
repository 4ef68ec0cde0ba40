package org.lupenghan.eazystorage.query.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 物理表的引用，由 Layout.getTableReference() 生成
 */
public class TableReference implements TableIdentifier {
    private final String tableName;
    private final List<FieldIdentifier> outputs;

    public TableReference(String tableName, List<String> fieldNames) {
        this.tableName = tableName;
        List<FieldIdentifier> list = new ArrayList<>();
        for (String fieldName : fieldNames) {
            list.add(new FieldIdentifier(this, fieldName));
        }
        this.outputs = Collections.unmodifiableList(list);
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public List<String> raw() {
        return List.of(tableName);
    }

    @Override
    public String getAlias() {
        return tableName;
    }

    @Override
    public List<FieldIdentifier> getOutputs() {
        return outputs;
    }

    @Override
    public TableIdentifier withAlias() {
        return AliasedTable.next(outputNames());
    }

    List<String> outputNames() {
        List<String> names = new ArrayList<>();
        for (FieldIdentifier output : outputs) {
            names.add(output.getName());
        }
        return names;
    }

    @Override
    public String toString() {
        return "TableReference(" + tableName + ")";
    }
}
