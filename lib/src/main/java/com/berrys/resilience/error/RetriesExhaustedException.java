package com.berrys.resilience.error;

/**
 * Thrown once the retry budget for an operation is spent, or when a failure is not retryable.
 * The final underlying error is kept as the cause.
 */
public class RetriesExhaustedException extends ServiceException {

    private final int attempts;

    public RetriesExhaustedException(String operationName, int attempts, Throwable lastError) {
        super(operationName, ErrorKind.RETRIES_EXHAUSTED, buildMessage(operationName, attempts, lastError), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public Throwable getLastError() {
        return getCause();
    }

    private static String buildMessage(String operationName, int attempts, Throwable lastError) {
        String message = String.format("Operation '%s' failed after %d attempts", operationName, attempts);
        if (lastError != null && lastError.getMessage() != null) {
            message += ": " + lastError.getMessage();
        }
        return message;
    }
}
