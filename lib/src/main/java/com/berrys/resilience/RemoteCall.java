package com.berrys.resilience;

/**
 * A niladic call to a peer service that produces a result or fails.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface RemoteCall<T> {

    T call() throws Exception;
}
