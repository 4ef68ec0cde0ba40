package org.lupenghan.eazystorage.table.models;

import org.lupenghan.eazystorage.events.EventDispatcher;
import org.lupenghan.eazystorage.events.QueryBeforeCreateEvent;
import org.lupenghan.eazystorage.events.RecordBeforeDeleteEvent;
import org.lupenghan.eazystorage.events.RecordBeforeInsertEvent;
import org.lupenghan.eazystorage.events.RecordBeforeUpdateEvent;
import org.lupenghan.eazystorage.events.listeners.SoftDeleteListener;
import org.lupenghan.eazystorage.events.listeners.SoftDeleteQueryListener;
import org.lupenghan.eazystorage.events.listeners.UpdateTimestampListener;

/**
 * 迁移中启用的字段约定，以及它们带来的生命周期钩子
 */
public enum LayoutConvention {
    TIMESTAMPS {
        @Override
        public void hook(EventDispatcher events) {
            events.hook(RecordBeforeInsertEvent.class, new UpdateTimestampListener(CREATED));
            events.hook(RecordBeforeUpdateEvent.class, new UpdateTimestampListener(UPDATED));
        }
    },
    SOFT_DELETE {
        @Override
        public void hook(EventDispatcher events) {
            events.hook(RecordBeforeDeleteEvent.class, new SoftDeleteListener(REMOVED));
            events.hook(QueryBeforeCreateEvent.class, new SoftDeleteQueryListener(REMOVED));
        }
    };

    public static final String CREATED = "created";
    public static final String UPDATED = "updated";
    public static final String REMOVED = "removed";

    public abstract void hook(EventDispatcher events);
}
