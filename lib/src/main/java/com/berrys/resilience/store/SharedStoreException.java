package com.berrys.resilience.store;

/**
 * Raised when the shared store cannot be reached or a command fails.
 */
public class SharedStoreException extends RuntimeException {
    
    private final String operation;
    
    public SharedStoreException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }
    
    public String getOperation() {
        return operation;
    }
}
