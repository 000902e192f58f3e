package com.rescontrol.observer;

/**
 * Fire-and-forget sink for {@link ResourceEvent}s. Implementations must not block the caller
 * and must not throw.
 */
public interface ObserverHook {

    void notify(ResourceEvent event);

    ObserverHook NOOP = event -> { };
}
