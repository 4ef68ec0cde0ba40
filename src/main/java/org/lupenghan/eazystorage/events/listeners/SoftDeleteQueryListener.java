package org.lupenghan.eazystorage.events.listeners;

import org.lupenghan.eazystorage.events.EventListener;
import org.lupenghan.eazystorage.events.QueryBeforeCreateEvent;
import org.lupenghan.eazystorage.query.models.Restriction;

/**
 * 查询默认排除已软删除的记录，过滤条件总是与调用方的条件取交集
 */
public class SoftDeleteQueryListener implements EventListener<QueryBeforeCreateEvent> {
    private final String field;

    public SoftDeleteQueryListener(String field) {
        this.field = field;
    }

    @Override
    public void handle(QueryBeforeCreateEvent event) {
        event.getQuery().restrictions().conjunctive().where(field, Restriction.IS_OPERATOR, null);
    }
}
