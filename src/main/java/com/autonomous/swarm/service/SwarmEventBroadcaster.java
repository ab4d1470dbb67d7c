package com.autonomous.swarm.service;

import com.autonomous.swarm.model.SwarmEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Fire-and-forget fan-out of {@link SwarmEvent}s to observers.
 */
@Slf4j
@Service
public class SwarmEventBroadcaster {

    private final List<Consumer<SwarmEvent>> subscribers = new CopyOnWriteArrayList<>();
    private final Executor delivery;

    public SwarmEventBroadcaster() {
        this(Executors.newSingleThreadExecutor());
    }

    SwarmEventBroadcaster(Executor delivery) {
        this.delivery = delivery;
    }

    public void broadcast(String type, String sessionId, Map<String, Object> data) {
        broadcast(SwarmEvent.of(type, sessionId, data));
    }

    public void broadcast(SwarmEvent event) {
        log.debug("Broadcasting {} for {}", event.getType(), event.getSessionId());
        for (Consumer<SwarmEvent> subscriber : subscribers) {
            deliver(subscriber, event);
        }
    }

    /**
     * Delivers to one subscriber only, used for the snapshot a new subscriber receives.
     */
    public void send(Consumer<SwarmEvent> subscriber, SwarmEvent event) {
        deliver(subscriber, event);
    }

    /**
     * @return a handle that removes the subscriber
     */
    public Runnable subscribe(Consumer<SwarmEvent> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    private void deliver(Consumer<SwarmEvent> subscriber, SwarmEvent event) {
        delivery.execute(() -> {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {} event: {}", event.getType(), e.getMessage());
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        if (delivery instanceof ExecutorService executorService) {
            executorService.shutdown();
        }
    }
}
