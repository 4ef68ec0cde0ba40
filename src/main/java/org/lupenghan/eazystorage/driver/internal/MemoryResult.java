package org.lupenghan.eazystorage.driver.internal;

import org.lupenghan.eazystorage.driver.interfaces.QueryResult;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class MemoryResult implements QueryResult {
    private final Iterator<Map<String, Object>> rows;

    public MemoryResult(List<Map<String, Object>> rows) {
        this.rows = rows.iterator();
    }

    @Override
    public Map<String, Object> fetch() {
        return rows.hasNext() ? rows.next() : null;
    }
}
