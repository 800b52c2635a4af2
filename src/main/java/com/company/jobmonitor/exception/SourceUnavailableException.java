package com.company.jobmonitor.exception;

import lombok.Getter;

/**
 * The execution source could not be reached or did not answer usefully.
 * Transient: the next tick simply tries again.
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    public enum Reason {
        TIMEOUT(true),
        NETWORK(true),
        SERVER_ERROR(true),
        AUTH(false),
        NOT_FOUND(false),
        HTTP_STATUS(false),
        PARSE(false),
        CIRCUIT_OPEN(false);

        private final boolean transportFailure;

        Reason(boolean transportFailure) {
            this.transportFailure = transportFailure;
        }

        /** Failures that count against the circuit breaker. */
        public boolean isTransportFailure() {
            return transportFailure;
        }
    }

    private final Reason reason;

    public SourceUnavailableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SourceUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
