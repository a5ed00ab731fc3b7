package com.integrationhealth.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.integrationhealth.core.exception.InvalidIntegrationTypeException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum IntegrationType {
    SLACK,
    DISCORD,
    LINEAR,
    JIRA,
    GITHUB,
    RAILWAY,
    VERCEL,
    SUPABASE,
    WEBHOOKS;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<String> validValues() {
        return Arrays.stream(values()).map(IntegrationType::value).toList();
    }

    /**
     * Resolves a type received from outside the process. Matching ignores case and surrounding blanks.
     *
     * @throws InvalidIntegrationTypeException when the value is not one of the nine known types
     */
    public static IntegrationType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (IntegrationType type : values()) {
                if (type.value().equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidIntegrationTypeException(value, validValues());
    }
}
