package org.lupenghan.eazystorage.query.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 带别名的表标识。每次 withAlias() 都会生成新的别名 t_n，
 * 同一个表在一个查询里出现多次（自连接）时也能区分。
 */
public class AliasedTable implements TableIdentifier {
    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final String alias;
    private final List<String> outputNames;
    private final List<FieldIdentifier> outputs;

    public AliasedTable(String alias, List<String> outputNames) {
        this.alias = alias;
        this.outputNames = List.copyOf(outputNames);
        List<FieldIdentifier> list = new ArrayList<>();
        for (String name : outputNames) {
            list.add(new FieldIdentifier(this, name));
        }
        this.outputs = Collections.unmodifiableList(list);
    }

    static AliasedTable next(List<String> outputNames) {
        return new AliasedTable("t_" + COUNTER.incrementAndGet(), outputNames);
    }

    @Override
    public List<String> raw() {
        return List.of(alias);
    }

    @Override
    public String getAlias() {
        return alias;
    }

    @Override
    public List<FieldIdentifier> getOutputs() {
        return outputs;
    }

    @Override
    public TableIdentifier withAlias() {
        return next(outputNames);
    }

    @Override
    public String toString() {
        return "AliasedTable(" + alias + ")";
    }
}
