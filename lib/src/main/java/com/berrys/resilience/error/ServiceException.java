package com.berrys.resilience.error;

/**
 * Base type for failures of calls to peer services.
 * Every instance carries the {@link ErrorKind} that retry policies and boundary code act on.
 */
public class ServiceException extends RuntimeException {

    private final String serviceName;
    private final ErrorKind kind;

    public ServiceException(String serviceName, ErrorKind kind, String message) {
        super(message);
        this.serviceName = serviceName;
        this.kind = kind;
    }

    public ServiceException(String serviceName, ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String getServiceName() {
        return serviceName;
    }

    public int getStatusCode() {
        return kind.httpStatus();
    }

    /**
     * The peer service could not be reached or refused the call.
     */
    public static class Unavailable extends ServiceException {
        public Unavailable(String serviceName) {
            super(serviceName, ErrorKind.UNAVAILABLE, String.format("Service '%s' is unavailable", serviceName));
        }

        public Unavailable(String serviceName, String message, Throwable cause) {
            super(serviceName, ErrorKind.UNAVAILABLE, message, cause);
        }
    }

    /**
     * The peer service did not answer in time.
     */
    public static class Timeout extends ServiceException {
        public Timeout(String serviceName) {
            super(serviceName, ErrorKind.TIMEOUT, String.format("Request to service '%s' timed out", serviceName));
        }

        public Timeout(String serviceName, String message, Throwable cause) {
            super(serviceName, ErrorKind.TIMEOUT, message, cause);
        }
    }

    public static class Authentication extends ServiceException {
        public Authentication(String serviceName) {
            super(serviceName, ErrorKind.AUTHENTICATION,
                    String.format("Authentication with service '%s' failed", serviceName));
        }
    }

    public static class Authorization extends ServiceException {
        public Authorization(String serviceName) {
            super(serviceName, ErrorKind.AUTHORIZATION,
                    String.format("Not authorized to access service '%s'", serviceName));
        }
    }

    public static class NotFound extends ServiceException {
        private final String resourceType;
        private final String resourceId;

        public NotFound(String serviceName, String resourceType, String resourceId) {
            super(serviceName, ErrorKind.NOT_FOUND,
                    String.format("%s '%s' not found in service '%s'", resourceType, resourceId, serviceName));
            this.resourceType = resourceType;
            this.resourceId = resourceId;
        }

        public String getResourceType() {
            return resourceType;
        }

        public String getResourceId() {
            return resourceId;
        }
    }

    public static class BadRequest extends ServiceException {
        public BadRequest(String serviceName, String message) {
            super(serviceName, ErrorKind.BAD_REQUEST, message);
        }
    }

    public static class Internal extends ServiceException {
        public Internal(String serviceName) {
            super(serviceName, ErrorKind.INTERNAL, String.format("Service '%s' reported an internal error", serviceName));
        }

        public Internal(String serviceName, String message) {
            super(serviceName, ErrorKind.INTERNAL, message);
        }
    }
}
