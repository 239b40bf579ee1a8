package com.berrys.resilience.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorKindTest {
    
    @Test
    void testServiceExceptionsReportOwnKind() {
        assertEquals(ErrorKind.UNAVAILABLE, ErrorKind.of(new ServiceException.Unavailable("memory")));
        assertEquals(ErrorKind.TIMEOUT, ErrorKind.of(new ServiceException.Timeout("memory")));
        assertEquals(ErrorKind.AUTHENTICATION, ErrorKind.of(new ServiceException.Authentication("memory")));
        assertEquals(ErrorKind.AUTHORIZATION, ErrorKind.of(new ServiceException.Authorization("memory")));
        assertEquals(ErrorKind.NOT_FOUND, ErrorKind.of(new ServiceException.NotFound("memory", "agent", "a-1")));
        assertEquals(ErrorKind.BAD_REQUEST, ErrorKind.of(new ServiceException.BadRequest("memory", "bad")));
        assertEquals(ErrorKind.INTERNAL, ErrorKind.of(new ServiceException.Internal("memory")));
        assertEquals(ErrorKind.CIRCUIT_OPEN, ErrorKind.of(new CircuitOpenException("memory")));
    }
    
    @Test
    void testJdkFailuresAreClassified() {
        assertEquals(ErrorKind.TIMEOUT, ErrorKind.of(new TimeoutException()));
        assertEquals(ErrorKind.TIMEOUT, ErrorKind.of(new SocketTimeoutException()));
        assertEquals(ErrorKind.UNAVAILABLE, ErrorKind.of(new ConnectException()));
        assertEquals(ErrorKind.UNAVAILABLE, ErrorKind.of(new IOException()));
        assertEquals(ErrorKind.UNKNOWN, ErrorKind.of(new IllegalStateException()));
    }
    
    @Test
    void testWrappersAreUnwrapped() {
        assertEquals(ErrorKind.TIMEOUT, ErrorKind.of(new CompletionException(new TimeoutException())));
        assertEquals(ErrorKind.NOT_FOUND, ErrorKind.of(
            new ExecutionException(new ServiceException.NotFound("tools", "tool", "t-9"))));
    }
    
    @Test
    void testHttpStatuses() {
        assertEquals(503, ErrorKind.UNAVAILABLE.httpStatus());
        assertEquals(504, ErrorKind.TIMEOUT.httpStatus());
        assertEquals(401, ErrorKind.AUTHENTICATION.httpStatus());
        assertEquals(403, ErrorKind.AUTHORIZATION.httpStatus());
        assertEquals(404, ErrorKind.NOT_FOUND.httpStatus());
        assertEquals(400, ErrorKind.BAD_REQUEST.httpStatus());
        assertEquals(429, ErrorKind.RATE_LIMITED.httpStatus());
        assertEquals(503, new RetriesExhaustedException("op", 4, new IOException()).getStatusCode());
    }
    
    @Test
    void testNotFoundCarriesResource() {
        ServiceException.NotFound notFound = new ServiceException.NotFound("memory", "agent", "a-1");
        
        assertEquals("memory", notFound.getServiceName());
        assertEquals("agent", notFound.getResourceType());
        assertEquals("a-1", notFound.getResourceId());
    }
}
