package com.storefront.shipping.exception;

/**
 * Raised when a downstream service (rule store, buyer profile) cannot be reached
 * or does not answer in time.
 */
public class ServiceCommunicationException extends RuntimeException {

    public ServiceCommunicationException(String message) {
        super(message);
    }

    public ServiceCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
