package com.storefront.shipping.exception;

public class ShippingEstimateCancelledException extends RuntimeException {

    public ShippingEstimateCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
