package com.rescontrol.observer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingResourceEventListener implements ResourceEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingResourceEventListener.class);

    @Override
    public void onResourceEvent(ResourceEvent event) {
        log.info("Resource {} {}:{} usage={} total={} thresholds={}",
            event.eventType(), event.tenant(), event.poolId(),
            event.usage().id(), event.totalUsage(), event.thresholdIds());
    }
}
