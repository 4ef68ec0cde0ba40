package org.lupenghan.eazystorage.events;

/**
 * 生命周期事件。监听器调用 preventDefault() 后，触发方不再执行默认操作。
 */
public abstract class Event {
    private boolean prevented;

    public void preventDefault() {
        this.prevented = true;
    }

    public boolean isPrevented() {
        return prevented;
    }
}
