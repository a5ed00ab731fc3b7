package com.integrationhealth.core.probe;

import com.integrationhealth.core.credential.ConnectionProvider;
import com.integrationhealth.core.credential.ConnectionStatus;
import com.integrationhealth.core.credential.IntegrationConnection;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Infers health of a generic OAuth connection (GitHub, Railway, Vercel, Supabase) from its stored status and how long
 * ago it was last used. No network call is made.
 */
public class ConnectionStatusProber implements IntegrationProber<IntegrationConnection> {

    private final ConnectionProvider provider;
    private final IntegrationCredentialStore credentialStore;
    private final Duration staleThreshold;
    private final Clock clock;

    public ConnectionStatusProber(ConnectionProvider provider, IntegrationCredentialStore credentialStore,
                                  Duration staleThreshold, Clock clock) {
        this.provider = provider;
        this.credentialStore = credentialStore;
        this.staleThreshold = staleThreshold;
        this.clock = clock;
    }

    @Override
    public IntegrationType type() {
        return provider.integrationType();
    }

    @Override
    public Optional<IntegrationConnection> loadConfiguration(String workspaceId) {
        return credentialStore.findConnection(workspaceId, provider);
    }

    @Override
    public String integrationId(IntegrationConnection connection) {
        return connection.id();
    }

    @Override
    public ProbeResult probe(IntegrationConnection connection) {
        String name = type().value();
        ConnectionStatus status = connection.status();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("connectionStatus", status.value());

        switch (status) {
            case ERROR:
                return ProbeResult.unhealthy(0, name + " connection in error state", details);
            case EXPIRED:
                return ProbeResult.unhealthy(0, name + " connection expired", details);
            case DISCONNECTED:
                return ProbeResult.disconnected(0, name + " disconnected", details);
            default:
                break;
        }

        if (connection.lastUsedAt() != null) {
            Duration idle = Duration.between(connection.lastUsedAt(), clock.instant());
            if (idle.compareTo(staleThreshold) > 0) {
                long days = idle.toDays();
                details.put("daysSinceLastUse", days);
                return ProbeResult.degraded(0, name + " not used in " + days + " days", details);
            }
        }
        return ProbeResult.healthy(0, details);
    }

    @Override
    public String getProberName() {
        return "ConnectionStatusProber[" + provider.value() + "]";
    }
}
