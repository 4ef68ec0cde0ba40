package org.lupenghan.eazystorage.driver.interfaces;

import org.lupenghan.eazystorage.query.models.Query;

public interface QueryGrammar {

    String query(Query query);
}
