package org.lupenghan.eazystorage.events;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按事件类型登记监听器，并按登记顺序分发
 */
public class EventDispatcher {
    private final Map<Class<? extends Event>, List<EventListener<Event>>> listeners = new LinkedHashMap<>();

    public <E extends Event> EventDispatcher hook(Class<E> type, EventListener<? super E> listener) {
        // 登记时绑定事件类型，分发时做受检转换
        listeners.computeIfAbsent(type, k -> new ArrayList<>()).add(event -> listener.handle(type.cast(event)));
        return this;
    }

    public <E extends Event> E dispatch(E event) throws IOException {
        List<EventListener<Event>> hooked = listeners.get(event.getClass());
        if (hooked == null) {
            return event;
        }
        for (EventListener<Event> listener : new ArrayList<>(hooked)) {
            listener.handle(event);
        }
        return event;
    }

    public int count(Class<? extends Event> type) {
        List<EventListener<Event>> hooked = listeners.get(type);
        return hooked == null ? 0 : hooked.size();
    }
}
