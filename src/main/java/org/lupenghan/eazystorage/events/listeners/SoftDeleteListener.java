package org.lupenghan.eazystorage.events.listeners;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.events.EventListener;
import org.lupenghan.eazystorage.events.RecordBeforeDeleteEvent;

import java.io.IOException;
import java.time.Instant;

/**
 * 软删除：把删除改写为更新删除时间字段，并阻止真正的删除
 */
@Slf4j
public class SoftDeleteListener implements EventListener<RecordBeforeDeleteEvent> {
    private final String field;

    public SoftDeleteListener(String field) {
        this.field = field;
    }

    @Override
    public void handle(RecordBeforeDeleteEvent event) throws IOException {
        event.getRecord().set(field, Instant.now().getEpochSecond());
        event.getConnection().update(event.getLayout(), event.getRecord());
        event.preventDefault();
        log.debug("表 {} 的记录 {} 已软删除", event.getLayout().getTableName(), event.getRecord().getPrimary());
    }
}
