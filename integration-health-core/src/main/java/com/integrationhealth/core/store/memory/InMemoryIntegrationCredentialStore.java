package com.integrationhealth.core.store.memory;

import com.integrationhealth.core.credential.ConnectionProvider;
import com.integrationhealth.core.credential.DiscordIntegration;
import com.integrationhealth.core.credential.IntegrationConnection;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.credential.JiraIntegration;
import com.integrationhealth.core.credential.LinearIntegration;
import com.integrationhealth.core.credential.OutgoingWebhook;
import com.integrationhealth.core.credential.SlackIntegration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Credential store fed programmatically. Used when no database adapter supplies one, and in tests.
 */
public class InMemoryIntegrationCredentialStore implements IntegrationCredentialStore {

    private final Map<String, SlackIntegration> slack = new ConcurrentHashMap<>();
    private final Map<String, DiscordIntegration> discord = new ConcurrentHashMap<>();
    private final Map<String, LinearIntegration> linear = new ConcurrentHashMap<>();
    private final Map<String, JiraIntegration> jira = new ConcurrentHashMap<>();
    private final Map<String, IntegrationConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, List<OutgoingWebhook>> webhooks = new ConcurrentHashMap<>();

    public void put(SlackIntegration integration) {
        slack.put(integration.workspaceId(), integration);
    }

    public void put(DiscordIntegration integration) {
        discord.put(integration.workspaceId(), integration);
    }

    public void put(LinearIntegration integration) {
        linear.put(integration.workspaceId(), integration);
    }

    public void put(JiraIntegration integration) {
        jira.put(integration.workspaceId(), integration);
    }

    public void put(IntegrationConnection connection) {
        connections.put(connectionKey(connection.workspaceId(), connection.provider()), connection);
    }

    public void put(OutgoingWebhook webhook) {
        webhooks.computeIfAbsent(webhook.workspaceId(), k -> new CopyOnWriteArrayList<>()).add(webhook);
    }

    @Override
    public Optional<SlackIntegration> findSlackIntegration(String workspaceId) {
        return Optional.ofNullable(slack.get(workspaceId));
    }

    @Override
    public Optional<DiscordIntegration> findDiscordIntegration(String workspaceId) {
        return Optional.ofNullable(discord.get(workspaceId));
    }

    @Override
    public Optional<LinearIntegration> findLinearIntegration(String workspaceId) {
        return Optional.ofNullable(linear.get(workspaceId));
    }

    @Override
    public Optional<JiraIntegration> findJiraIntegration(String workspaceId) {
        return Optional.ofNullable(jira.get(workspaceId));
    }

    @Override
    public Optional<IntegrationConnection> findConnection(String workspaceId, ConnectionProvider provider) {
        return Optional.ofNullable(connections.get(connectionKey(workspaceId, provider)));
    }

    @Override
    public List<OutgoingWebhook> findWebhooks(String workspaceId) {
        return new ArrayList<>(webhooks.getOrDefault(workspaceId, List.of()));
    }

    @Override
    public Set<String> findWorkspaceIdsWithIntegrations() {
        Set<String> workspaceIds = new HashSet<>();
        workspaceIds.addAll(slack.keySet());
        workspaceIds.addAll(discord.keySet());
        workspaceIds.addAll(linear.keySet());
        workspaceIds.addAll(jira.keySet());
        connections.values().forEach(connection -> workspaceIds.add(connection.workspaceId()));
        workspaceIds.addAll(webhooks.keySet());
        return workspaceIds;
    }

    private static String connectionKey(String workspaceId, ConnectionProvider provider) {
        return workspaceId + ":" + provider.value();
    }
}
