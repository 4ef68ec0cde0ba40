package org.lupenghan.eazystorage.table.interfaces;

import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;

public interface SchemaSnapshotManager {
    boolean exists();
    Schema load() throws IOException;
    void save(Schema schema) throws IOException;
}
