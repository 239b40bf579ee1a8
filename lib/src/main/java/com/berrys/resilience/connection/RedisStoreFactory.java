package com.berrys.resilience.connection;

import com.berrys.resilience.config.StoreEndpoint;
import com.berrys.resilience.store.LettuceSharedStore;
import com.berrys.resilience.store.SharedStoreException;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Creates Lettuce-backed shared stores. One {@link RedisClient} is kept per endpoint and all
 * clients share a single set of client resources.
 */
public class RedisStoreFactory implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(RedisStoreFactory.class);
    
    private final ClientResources clientResources;
    private final ConcurrentMap<String, RedisClient> clients;
    private volatile boolean closed = false;
    
    public RedisStoreFactory() {
        this(DefaultClientResources.create());
    }
    
    public RedisStoreFactory(ClientResources clientResources) {
        this.clientResources = clientResources;
        this.clients = new ConcurrentHashMap<>();
    }
    
    /**
     * Connects to the endpoint and verifies it with PING.
     *
     * @return the store, or empty when the endpoint is unreachable so callers run on local state
     */
    public Optional<LettuceSharedStore> connect(StoreEndpoint endpoint) {
        try {
            return Optional.of(connectOrThrow(endpoint));
        } catch (SharedStoreException e) {
            logger.warn("Shared store {} unavailable, continuing with local state: {}", endpoint.getId(), e.getMessage());
            return Optional.empty();
        }
    }
    
    /**
     * Connects to the endpoint and verifies it with PING.
     *
     * @throws SharedStoreException if the connection or the ping fails
     */
    public LettuceSharedStore connectOrThrow(StoreEndpoint endpoint) {
        if (closed) {
            throw new IllegalStateException("RedisStoreFactory is closed");
        }
        
        StatefulRedisConnection<String, String> connection = null;
        try {
            RedisClient client = getOrCreateClient(endpoint);
            connection = client.connect(buildRedisURI(endpoint));
            
            String pong = connection.sync().ping();
            if (!"PONG".equalsIgnoreCase(pong)) {
                throw new SharedStoreException("ping", "Unexpected ping reply from " + endpoint.getId() + ": " + pong, null);
            }
            
            logger.info("Connected to shared store {}", endpoint.getId());
            return new LettuceSharedStore(connection);
        } catch (SharedStoreException e) {
            connection.close();
            throw e;
        } catch (RuntimeException e) {
            if (connection != null) {
                connection.close();
            }
            throw new SharedStoreException("connect", "Failed to connect to shared store " + endpoint.getId(), e);
        }
    }
    
    private RedisClient getOrCreateClient(StoreEndpoint endpoint) {
        return clients.computeIfAbsent(endpoint.getId(), id -> {
            RedisClient client = RedisClient.create(clientResources);
            client.setOptions(buildClientOptions(endpoint));
            logger.debug("Created Redis client for shared store {}", id);
            return client;
        });
    }
    
    private RedisURI buildRedisURI(StoreEndpoint endpoint) {
        RedisURI.Builder uriBuilder = RedisURI.builder()
            .withHost(endpoint.getHost())
            .withPort(endpoint.getPort())
            .withDatabase(endpoint.getDatabase())
            .withTimeout(endpoint.getCommandTimeout());
        
        if (endpoint.getUsername() != null) {
            uriBuilder.withAuthentication(endpoint.getUsername(), endpoint.getPassword().toCharArray());
        } else if (endpoint.getPassword() != null) {
            uriBuilder.withPassword(endpoint.getPassword().toCharArray());
        }
        
        if (endpoint.isSsl()) {
            uriBuilder.withSsl(true).withVerifyPeer(endpoint.isVerifyPeer());
        }
        
        return uriBuilder.build();
    }
    
    private ClientOptions buildClientOptions(StoreEndpoint endpoint) {
        return ClientOptions.builder()
            .autoReconnect(true)
            .socketOptions(SocketOptions.builder()
                .connectTimeout(endpoint.getConnectTimeout())
                .keepAlive(true)
                .tcpNoDelay(true)
                .build())
            .timeoutOptions(TimeoutOptions.builder()
                .fixedTimeout(endpoint.getCommandTimeout())
                .build())
            .build();
    }
    
    public int getActiveClientCount() {
        return clients.size();
    }
    
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        
        logger.info("Closing RedisStoreFactory with {} clients", clients.size());
        clients.values().forEach(client -> {
            try {
                client.shutdown();
            } catch (RuntimeException e) {
                logger.warn("Error closing Redis client", e);
            }
        });
        clients.clear();
        
        try {
            clientResources.shutdown();
        } catch (RuntimeException e) {
            logger.warn("Error shutting down client resources", e);
        }
    }
}
