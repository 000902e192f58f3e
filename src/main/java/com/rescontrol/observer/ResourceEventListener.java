package com.rescontrol.observer;

/**
 * Downstream consumer of resource notifications, such as a threshold engine.
 */
public interface ResourceEventListener {

    void onResourceEvent(ResourceEvent event);
}
