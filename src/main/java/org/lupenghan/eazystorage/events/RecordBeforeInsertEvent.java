package org.lupenghan.eazystorage.events;

import org.lupenghan.eazystorage.connection.Connection;
import org.lupenghan.eazystorage.record.models.Record;
import org.lupenghan.eazystorage.table.models.Layout;

public class RecordBeforeInsertEvent extends RecordEvent {

    public RecordBeforeInsertEvent(Connection connection, Layout layout, Record record) {
        super(connection, layout, record);
    }
}
