package org.lupenghan.eazystorage.events;

import lombok.Getter;
import org.lupenghan.eazystorage.connection.Connection;
import org.lupenghan.eazystorage.record.models.Record;
import org.lupenghan.eazystorage.table.models.Layout;

@Getter
public abstract class RecordEvent extends Event {
    private final Connection connection;
    private final Layout layout;
    private final Record record;

    protected RecordEvent(Connection connection, Layout layout, Record record) {
        this.connection = connection;
        this.layout = layout;
        this.record = record;
    }
}
