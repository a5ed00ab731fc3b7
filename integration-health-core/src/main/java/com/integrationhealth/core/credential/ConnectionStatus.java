package com.integrationhealth.core.credential;

import java.util.Locale;

public enum ConnectionStatus {
    ACTIVE,
    DISCONNECTED,
    ERROR,
    EXPIRED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConnectionStatus fromValue(String value) {
        return ConnectionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
