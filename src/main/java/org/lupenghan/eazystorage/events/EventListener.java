package org.lupenghan.eazystorage.events;

import java.io.IOException;

@FunctionalInterface
public interface EventListener<E extends Event> {

    void handle(E event) throws IOException;
}
