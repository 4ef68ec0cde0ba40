package org.lupenghan.eazystorage.driver.interfaces;

import org.lupenghan.eazystorage.record.models.Record;
import org.lupenghan.eazystorage.table.models.Layout;

public interface RecordGrammar {

    String insertRecord(Layout layout, Record record);

    /**
     * 只包含 record.diff() 中的列
     */
    String updateRecord(Layout layout, Record record);

    String deleteRecord(Layout layout, Record record);
}
