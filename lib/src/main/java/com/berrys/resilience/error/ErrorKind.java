package com.berrys.resilience.error;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Closed set of failure kinds a remote call can end with.
 * Retry policies select retryable failures by kind, and boundary code maps
 * kinds to transport status codes via {@link #httpStatus()}.
 */
public enum ErrorKind {

    UNAVAILABLE(503),
    TIMEOUT(504),
    AUTHENTICATION(401),
    AUTHORIZATION(403),
    NOT_FOUND(404),
    BAD_REQUEST(400),
    INTERNAL(500),
    CIRCUIT_OPEN(503),
    RETRIES_EXHAUSTED(503),
    RATE_LIMITED(429),
    UNKNOWN(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Classifies an arbitrary error. Typed {@link ServiceException}s report their own kind;
     * common JDK transport failures are mapped to {@link #TIMEOUT} or {@link #UNAVAILABLE};
     * everything else is {@link #UNKNOWN}.
     *
     * @param error the failure, may be wrapped in a {@link CompletionException} or {@link ExecutionException}
     * @return the kind of the failure
     */
    public static ErrorKind of(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }

        if (current instanceof ServiceException) {
            return ((ServiceException) current).kind();
        }
        if (current instanceof TimeoutException || current instanceof SocketTimeoutException) {
            return TIMEOUT;
        }
        if (current instanceof ConnectException || current instanceof IOException) {
            return UNAVAILABLE;
        }
        return UNKNOWN;
    }
}
