package com.berrys.resilience.config;

import java.time.Duration;

/**
 * Connection details for the shared Redis store used by rate limiters and cache fallbacks.
 */
public class StoreEndpoint {
    
    private final String host;
    private final int port;
    private final int database;
    private final String username;
    private final String password;
    private final boolean ssl;
    private final boolean verifyPeer;
    private final Duration connectTimeout;
    private final Duration commandTimeout;
    
    private StoreEndpoint(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.username = builder.username;
        this.password = builder.password;
        this.ssl = builder.ssl;
        this.verifyPeer = builder.verifyPeer;
        this.connectTimeout = builder.connectTimeout;
        this.commandTimeout = builder.commandTimeout;
    }
    
    public String getHost() {
        return host;
    }
    
    public int getPort() {
        return port;
    }
    
    public int getDatabase() {
        return database;
    }
    
    public String getUsername() {
        return username;
    }
    
    public String getPassword() {
        return password;
    }
    
    public boolean isSsl() {
        return ssl;
    }
    
    public boolean isVerifyPeer() {
        return verifyPeer;
    }
    
    public Duration getConnectTimeout() {
        return connectTimeout;
    }
    
    public Duration getCommandTimeout() {
        return commandTimeout;
    }
    
    /**
     * Identifier of the endpoint, used to share one client per host, port and database.
     */
    public String getId() {
        return host + ":" + port + "/" + database;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String username;
        private String password;
        private boolean ssl = false;
        private boolean verifyPeer = true;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration commandTimeout = Duration.ofSeconds(2);
        
        public Builder host(String host) {
            this.host = host;
            return this;
        }
        
        public Builder port(int port) {
            this.port = port;
            return this;
        }
        
        public Builder database(int database) {
            this.database = database;
            return this;
        }
        
        public Builder authentication(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }
        
        public Builder password(String password) {
            this.password = password;
            return this;
        }
        
        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }
        
        public Builder verifyPeer(boolean verifyPeer) {
            this.verifyPeer = verifyPeer;
            return this;
        }
        
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }
        
        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }
        
        public StoreEndpoint build() {
            if (host == null || host.trim().isEmpty()) {
                throw new IllegalArgumentException("Store host cannot be null or empty");
            }
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Store port must be between 1 and 65535");
            }
            if (database < 0) {
                throw new IllegalArgumentException("Store database must not be negative");
            }
            if (username != null && password == null) {
                throw new IllegalArgumentException("Password is required when a username is provided");
            }
            return new StoreEndpoint(this);
        }
    }
    
    @Override
    public String toString() {
        return String.format("StoreEndpoint{host='%s', port=%d, database=%d, ssl=%s}", host, port, database, ssl);
    }
}
