package com.berrys.resilience.observability;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Publishes resilience events for real-time monitoring and alerting.
 * Provides a reactive stream for event subscription and distributes
 * events to multiple subscribers.
 *
 * <p>Emission is serialized without blocking: an event published while another thread is
 * delivering is queued and delivered by that thread, in order, before it returns.
 */
public class ResilienceEventPublisher implements ResilienceEventListener {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilienceEventPublisher.class);
    
    private final Sinks.Many<ResilienceEvent> eventSink;
    private final ConcurrentMap<String, Boolean> subscribers;
    private final AtomicLong subscriberSequence;
    private final Queue<ResilienceEvent> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger drainRequests = new AtomicInteger();
    private volatile boolean completeRequested;
    private boolean completed;
    
    public ResilienceEventPublisher() {
        this.eventSink = Sinks.many().multicast().directBestEffort();
        this.subscribers = new ConcurrentHashMap<>();
        this.subscriberSequence = new AtomicLong();
        
        logger.info("ResilienceEventPublisher initialized");
    }
    
    @Override
    public void onEvent(ResilienceEvent event) {
        publish(event);
    }
    
    /**
     * Publishes an event to all current subscribers. Returns without waiting when another
     * thread is already delivering; that thread delivers this event too.
     *
     * @param event the event to publish
     */
    public void publish(ResilienceEvent event) {
        pending.offer(event);
        drain();
    }
    
    private void drain() {
        if (drainRequests.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            ResilienceEvent event;
            while ((event = pending.poll()) != null) {
                emit(event);
            }
            if (completeRequested && !completed) {
                completed = true;
                eventSink.tryEmitComplete();
            }
            missed = drainRequests.addAndGet(-missed);
        } while (missed != 0);
    }
    
    private void emit(ResilienceEvent event) {
        Sinks.EmitResult result;
        try {
            result = eventSink.tryEmitNext(event);
        } catch (RuntimeException e) {
            logger.warn("Resilience event subscriber failed on {}", event, e);
            return;
        }
        
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.trace("No subscribers for resilience event {}", event);
        } else if (result.isFailure()) {
            logger.warn("Failed to publish resilience event {}: {}", event, result);
        } else {
            logger.debug("Published resilience event: {}", event);
        }
    }
    
    /**
     * Subscribes to all resilience events.
     * 
     * @param listener the callback for events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(Consumer<ResilienceEvent> listener) {
        return subscribe(null, listener);
    }
    
    /**
     * Subscribes to resilience events of one type.
     * 
     * @param type the event type to receive, or null for all types
     * @param listener the callback for events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(ResilienceEvent.Type type, Consumer<ResilienceEvent> listener) {
        String subscriberId = "resilience-" + subscriberSequence.incrementAndGet();
        subscribers.put(subscriberId, Boolean.TRUE);
        
        logger.info("New resilience event subscriber: {} (total subscribers: {})", 
            subscriberId, subscribers.size());
        
        return eventSink.asFlux()
            .filter(event -> type == null || event.getType() == type)
            .doOnCancel(() -> {
                subscribers.remove(subscriberId);
                logger.info("Resilience event subscription cancelled: {} (remaining: {})", 
                    subscriberId, subscribers.size());
            })
            .subscribe(
                listener,
                error -> logger.error("Resilience event subscriber {} failed", subscriberId, error)
            );
    }
    
    /**
     * Gets the current number of active subscribers.
     * 
     * @return number of active subscribers
     */
    public int getSubscriberCount() {
        return subscribers.size();
    }
    
    /**
     * Gets the event stream for advanced reactive operations.
     * 
     * @return Flux of resilience events
     */
    public Flux<ResilienceEvent> getEventStream() {
        return eventSink.asFlux();
    }
    
    /**
     * Closes the publisher and completes all active streams.
     */
    public void close() {
        logger.info("Closing ResilienceEventPublisher with {} active subscribers", subscribers.size());
        
        completeRequested = true;
        drain();
        subscribers.clear();
        
        logger.info("ResilienceEventPublisher closed");
    }
}
