package com.integrationhealth.core.probe;

import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.ProbeResult;

import java.util.Optional;

/**
 * Health check for one integration type.
 * <p>
 * {@link #loadConfiguration} reads the stored configuration; an empty result means the workspace has not connected
 * this integration and nothing is recorded. {@link #probe} turns expected failures (rejected credentials, inactive
 * integration, non-success responses) into a {@link ProbeResult}; anything unexpected may be thrown and is handled
 * by the dispatcher.
 *
 * @param <C> the stored configuration this prober works from
 */
public interface IntegrationProber<C> {

    IntegrationType type();

    Optional<C> loadConfiguration(String workspaceId);

    String integrationId(C configuration);

    ProbeResult probe(C configuration);

    default String getProberName() {
        return getClass().getSimpleName() + "[" + type().value() + "]";
    }
}
