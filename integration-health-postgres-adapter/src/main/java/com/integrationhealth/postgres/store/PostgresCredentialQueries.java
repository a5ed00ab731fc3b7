package com.integrationhealth.postgres.store;

/**
 * Reads against the credential tables owned by the integrations module. Nothing here writes.
 */
public final class PostgresCredentialQueries {
    
    private PostgresCredentialQueries() {}
    
    public static final String SELECT_SLACK = """
        SELECT id, workspace_id, status, bot_token, bot_token_iv, error_count, last_error, message_count
        FROM slack_integrations
        WHERE workspace_id = ?
        LIMIT 1
        """;
    
    public static final String SELECT_DISCORD = """
        SELECT id, workspace_id, status, default_webhook_url, default_webhook_url_iv, error_count, message_count
        FROM discord_integrations
        WHERE workspace_id = ?
        LIMIT 1
        """;
    
    public static final String SELECT_LINEAR = """
        SELECT id, workspace_id, is_active, access_token, access_token_iv, error_count, sync_count
        FROM linear_integrations
        WHERE workspace_id = ?
        LIMIT 1
        """;
    
    public static final String SELECT_JIRA = """
        SELECT id, workspace_id, is_active, cloud_id, access_token, access_token_iv, token_expires_at,
               error_count, sync_count
        FROM jira_integrations
        WHERE workspace_id = ?
        LIMIT 1
        """;
    
    public static final String SELECT_CONNECTION = """
        SELECT id, workspace_id, provider, status, last_used_at
        FROM integration_connections
        WHERE workspace_id = ? AND provider = ?
        LIMIT 1
        """;
    
    public static final String SELECT_WEBHOOKS = """
        SELECT id, workspace_id, is_active, consecutive_failures, max_consecutive_failures
        FROM outgoing_webhooks
        WHERE workspace_id = ?
        ORDER BY created_at
        """;
    
    public static final String SELECT_DISTINCT_WORKSPACES = """
        SELECT DISTINCT workspace_id FROM %s
        """;
    
    public static final String[] CREDENTIAL_TABLES = {
        "slack_integrations",
        "discord_integrations",
        "linear_integrations",
        "jira_integrations",
        "integration_connections",
        "outgoing_webhooks"
    };
}
