package com.rescontrol.observer;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Hands events to a single dispatcher thread through a bounded queue.
 *
 * Delivery is at most once with no retry: when the queue is full the event is dropped, and a
 * listener or subscriber that throws is logged and skipped.
 */
public class AsyncObserverHook implements ObserverHook {

    private static final Logger log = LoggerFactory.getLogger(AsyncObserverHook.class);

    private final List<ResourceEventListener> listeners;
    private final ConcurrentHashMap<String, Consumer<ResourceEvent>> subscribers = new ConcurrentHashMap<>();
    private final ThreadPoolExecutor executor;
    private final AtomicLong dropped = new AtomicLong();

    public AsyncObserverHook(List<ResourceEventListener> listeners, int queueCapacity) {
        this.listeners = List.copyOf(listeners);
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            runnable -> {
                Thread thread = new Thread(runnable, "resource-observer");
                thread.setDaemon(true);
                return thread;
            },
            (runnable, pool) -> {
                dropped.incrementAndGet();
                log.warn("Observer queue full, dropping resource notification");
            });
    }

    @Override
    public void notify(ResourceEvent event) {
        executor.execute(() -> dispatch(event));
    }

    public String subscribe(Consumer<ResourceEvent> consumer) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, consumer);
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }

    public long droppedCount() {
        return dropped.get();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(ResourceEvent event) {
        for (ResourceEventListener listener : listeners) {
            try {
                listener.onResourceEvent(event);
            } catch (Exception ex) {
                log.warn("Resource listener {} failed for {}:{}: {}",
                    listener.getClass().getSimpleName(), event.tenant(), event.poolId(), ex.getMessage());
            }
        }
        subscribers.values().forEach(consumer -> {
            try {
                consumer.accept(event);
            } catch (Exception ex) {
                log.warn("Subscriber notification failed for {}:{}: {}",
                    event.tenant(), event.poolId(), ex.getMessage());
            }
        });
    }
}
