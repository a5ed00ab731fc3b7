package com.integrationhealth.core.probe;

import com.integrationhealth.core.model.IntegrationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lookup of the prober responsible for each integration type. Every type must have exactly one prober.
 */
public class ProberRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProberRegistry.class);

    private final Map<IntegrationType, IntegrationProber<?>> probers = new EnumMap<>(IntegrationType.class);

    public ProberRegistry(Collection<? extends IntegrationProber<?>> candidates) {
        for (IntegrationProber<?> prober : candidates) {
            IntegrationProber<?> existing = probers.putIfAbsent(prober.type(), prober);
            if (existing != null) {
                throw new IllegalStateException("Duplicate prober for " + prober.type().value() + ": "
                    + existing.getProberName() + " and " + prober.getProberName());
            }
        }

        Set<IntegrationType> missing = EnumSet.allOf(IntegrationType.class);
        missing.removeAll(probers.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No prober registered for " + missing);
        }
        logger.info("Registered {} integration probers", probers.size());
    }

    public IntegrationProber<?> get(IntegrationType type) {
        return probers.get(type);
    }
}
