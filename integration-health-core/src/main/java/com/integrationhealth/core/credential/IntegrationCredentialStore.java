package com.integrationhealth.core.credential;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view over the provider credential records owned by the rest of the platform.
 */
public interface IntegrationCredentialStore {

    Optional<SlackIntegration> findSlackIntegration(String workspaceId);

    Optional<DiscordIntegration> findDiscordIntegration(String workspaceId);

    Optional<LinearIntegration> findLinearIntegration(String workspaceId);

    Optional<JiraIntegration> findJiraIntegration(String workspaceId);

    Optional<IntegrationConnection> findConnection(String workspaceId, ConnectionProvider provider);

    List<OutgoingWebhook> findWebhooks(String workspaceId);

    /**
     * Union of the distinct workspace ids across every provider table.
     */
    Set<String> findWorkspaceIdsWithIntegrations();
}
