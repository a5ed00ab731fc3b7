package com.integrationhealth.core.exception;

import com.integrationhealth.core.model.IntegrationType;

public class HealthRecordNotFoundException extends RuntimeException {

    public HealthRecordNotFoundException(String workspaceId, IntegrationType type) {
        super("No health record for " + type.value() + " in workspace " + workspaceId);
    }
}
