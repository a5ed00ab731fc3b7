package com.integrationhealth.core.exception;

import java.util.List;

public class InvalidIntegrationTypeException extends IllegalArgumentException {

    private final String value;

    public InvalidIntegrationTypeException(String value, List<String> validValues) {
        super("Invalid integration type: " + value + ". Valid types: " + String.join(", ", validValues));
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
