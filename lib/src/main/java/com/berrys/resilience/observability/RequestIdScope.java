package com.berrys.resilience.observability;

import org.slf4j.MDC;

/**
 * Places a correlation identifier in the SLF4J MDC for the duration of a block.
 * Closing restores whatever identifier the thread carried before, or removes the key
 * when there was none.
 */
public final class RequestIdScope implements AutoCloseable {

    public static final String MDC_KEY = "requestId";

    private static final RequestIdScope NONE = new RequestIdScope(false, null);

    private final boolean applied;
    private final String previous;

    private RequestIdScope(boolean applied, String previous) {
        this.applied = applied;
        this.previous = previous;
    }

    /**
     * Opens a scope for {@code requestId}. A {@code null} id leaves the MDC untouched.
     */
    public static RequestIdScope open(String requestId) {
        if (requestId == null) {
            return NONE;
        }
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, requestId);
        return new RequestIdScope(true, previous);
    }

    @Override
    public void close() {
        if (!applied) {
            return;
        }
        if (previous != null) {
            MDC.put(MDC_KEY, previous);
        } else {
            MDC.remove(MDC_KEY);
        }
    }
}
