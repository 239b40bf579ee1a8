package com.berrys.resilience;

import com.berrys.resilience.config.ResilienceConfig;
import com.berrys.resilience.config.StoreEndpoint;
import com.berrys.resilience.connection.RedisStoreFactory;
import com.berrys.resilience.observability.ResilienceEventListener;
import com.berrys.resilience.observability.ResilienceMetrics;
import com.berrys.resilience.store.SharedStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builder for {@link ResilienceToolkit}.
 *
 * <p>A shared store can be given directly or as an endpoint to connect to. When the endpoint
 * cannot be reached the toolkit is built without a shared store and runs on local state.
 */
public class ResilienceToolkitBuilder {
    
    private ResilienceConfig config;
    private SharedStore sharedStore;
    private StoreEndpoint storeEndpoint;
    private MeterRegistry meterRegistry;
    private ResilienceEventListener listener;
    private ExecutorService revalidationExecutor;
    private ObjectMapper objectMapper;
    private Clock clock = Clock.systemUTC();
    
    ResilienceToolkitBuilder() {
    }
    
    /**
     * Configuration to use. Defaults to {@link ResilienceConfig#load()}.
     */
    public ResilienceToolkitBuilder config(ResilienceConfig config) {
        this.config = config;
        return this;
    }
    
    public ResilienceToolkitBuilder sharedStore(SharedStore sharedStore) {
        this.sharedStore = sharedStore;
        return this;
    }
    
    /**
     * Redis endpoint to connect to at build time. Ignored when a shared store is set.
     */
    public ResilienceToolkitBuilder storeEndpoint(StoreEndpoint storeEndpoint) {
        this.storeEndpoint = storeEndpoint;
        return this;
    }
    
    public ResilienceToolkitBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }
    
    /**
     * Additional listener notified of every event, after metrics and the event publisher.
     */
    public ResilienceToolkitBuilder listener(ResilienceEventListener listener) {
        this.listener = listener;
        return this;
    }
    
    /**
     * Executor for background cache refreshes. The toolkit does not shut down an executor it
     * was given; without one it creates and owns a small daemon pool.
     */
    public ResilienceToolkitBuilder revalidationExecutor(ExecutorService revalidationExecutor) {
        this.revalidationExecutor = revalidationExecutor;
        return this;
    }
    
    public ResilienceToolkitBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }
    
    public ResilienceToolkitBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }
    
    public ResilienceToolkit build() {
        ResilienceConfig effectiveConfig = config != null ? config : ResilienceConfig.load();
        
        SharedStore store = sharedStore;
        RedisStoreFactory storeFactory = null;
        if (store == null && storeEndpoint != null) {
            storeFactory = new RedisStoreFactory();
            store = storeFactory.connect(storeEndpoint).orElse(null);
            if (store == null) {
                storeFactory.close();
                storeFactory = null;
            }
        }
        
        boolean ownsExecutor = revalidationExecutor == null;
        ExecutorService executor = ownsExecutor ? createRevalidationExecutor() : revalidationExecutor;
        
        return new ResilienceToolkit(
            effectiveConfig,
            store,
            clock,
            objectMapper != null ? objectMapper : new ObjectMapper(),
            new ResilienceMetrics(meterRegistry != null ? meterRegistry : new SimpleMeterRegistry()),
            listener,
            executor,
            ownsExecutor,
            storeFactory);
    }
    
    private static ExecutorService createRevalidationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "cache-revalidation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
