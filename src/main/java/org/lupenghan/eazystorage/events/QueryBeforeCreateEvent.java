package org.lupenghan.eazystorage.events;

import lombok.Getter;
import org.lupenghan.eazystorage.connection.Connection;
import org.lupenghan.eazystorage.query.models.Query;
import org.lupenghan.eazystorage.table.models.Layout;

/**
 * 查询交给 grammar 之前触发，监听器可以继续往查询里加条件
 */
@Getter
public class QueryBeforeCreateEvent extends Event {
    private final Connection connection;
    private final Layout layout;
    private final Query query;

    public QueryBeforeCreateEvent(Connection connection, Layout layout, Query query) {
        this.connection = connection;
        this.layout = layout;
        this.query = query;
    }
}
