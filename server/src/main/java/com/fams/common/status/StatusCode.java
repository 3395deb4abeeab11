package com.fams.common.status;

/**
 * Status codes that correspond to both gRPC status codes and HTTP status codes. The routing layer
 * maps a failed operation onto its transport with {@link #getHttpCode()}.
 */
public enum StatusCode {
    OK(200),                 // 200 OK
    INVALID_ARGUMENT(400),   // 400 Bad Request
    NOT_FOUND(404),          // 404 Not Found
    ALREADY_EXISTS(409),     // 409 Conflict
    PERMISSION_DENIED(403),  // 403 Forbidden
    FAILED_PRECONDITION(409),// 409 Conflict (the entity is in a state that forbids the change)
    INTERNAL(500),           // 500 Internal Server Error
    UNAVAILABLE(503),        // 503 Service Unavailable
    UNAUTHENTICATED(401);    // 401 Unauthorized

    private final int httpCode;

    StatusCode(int httpCode) {
        this.httpCode = httpCode;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns whether this status code represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return !isSuccess();
    }

    /**
     * Returns whether a caller may retry the operation (with backoff). Only a transient storage
     * outage qualifies; validation failures and denials never succeed on retry.
     */
    public boolean isRetryable() {
        return this == UNAVAILABLE;
    }
}
