package org.lupenghan.eazystorage.events.listeners;

import org.lupenghan.eazystorage.events.EventListener;
import org.lupenghan.eazystorage.events.RecordEvent;

import java.time.Instant;

/**
 * 把指定字段设置为当前时间（Unix 秒）
 */
public class UpdateTimestampListener implements EventListener<RecordEvent> {
    private final String field;

    public UpdateTimestampListener(String field) {
        this.field = field;
    }

    @Override
    public void handle(RecordEvent event) {
        event.getRecord().set(field, Instant.now().getEpochSecond());
    }
}
