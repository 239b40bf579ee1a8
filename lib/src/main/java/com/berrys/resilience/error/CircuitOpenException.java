package com.berrys.resilience.error;

/**
 * Thrown instead of invoking an operation while its circuit breaker rejects requests.
 */
public class CircuitOpenException extends ServiceException {

    public CircuitOpenException(String circuitName) {
        super(circuitName, ErrorKind.CIRCUIT_OPEN, String.format("Circuit breaker '%s' is open", circuitName));
    }

    public String getCircuitName() {
        return getServiceName();
    }
}
