package com.integrationhealth.core.credential;

import com.integrationhealth.core.model.IntegrationType;

import java.util.Locale;

/**
 * Providers whose health is inferred from a generic stored connection rather than a live API call.
 */
public enum ConnectionProvider {
    GITHUB(IntegrationType.GITHUB),
    RAILWAY(IntegrationType.RAILWAY),
    VERCEL(IntegrationType.VERCEL),
    SUPABASE(IntegrationType.SUPABASE);

    private final IntegrationType integrationType;

    ConnectionProvider(IntegrationType integrationType) {
        this.integrationType = integrationType;
    }

    public IntegrationType integrationType() {
        return integrationType;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
