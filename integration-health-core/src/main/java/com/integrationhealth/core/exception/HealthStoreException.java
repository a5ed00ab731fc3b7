package com.integrationhealth.core.exception;

public class HealthStoreException extends RuntimeException {

    public HealthStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
