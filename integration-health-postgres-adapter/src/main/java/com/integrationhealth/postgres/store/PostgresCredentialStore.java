package com.integrationhealth.postgres.store;

import com.integrationhealth.core.credential.ConnectionProvider;
import com.integrationhealth.core.credential.ConnectionStatus;
import com.integrationhealth.core.credential.DiscordIntegration;
import com.integrationhealth.core.credential.IntegrationConnection;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.credential.JiraIntegration;
import com.integrationhealth.core.credential.LinearIntegration;
import com.integrationhealth.core.credential.OutgoingWebhook;
import com.integrationhealth.core.credential.SlackIntegration;
import com.integrationhealth.core.exception.HealthStoreException;
import static com.integrationhealth.postgres.store.PostgresCredentialQueries.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Credential rows are owned by the integrations module, so this store only reads. Encrypted columns are
 * passed through untouched and decrypted by the prober that needs them.
 */
@Repository
public class PostgresCredentialStore implements IntegrationCredentialStore {
    
    private static final Logger logger = LoggerFactory.getLogger(PostgresCredentialStore.class);
    
    private static final RowMapper<SlackIntegration> SLACK_MAPPER = (rs, rowNum) -> new SlackIntegration(
        rs.getString("id"),
        rs.getString("workspace_id"),
        rs.getString("status"),
        rs.getString("bot_token"),
        rs.getString("bot_token_iv"),
        rs.getInt("error_count"),
        rs.getString("last_error"),
        rs.getLong("message_count"));
    
    private static final RowMapper<DiscordIntegration> DISCORD_MAPPER = (rs, rowNum) -> new DiscordIntegration(
        rs.getString("id"),
        rs.getString("workspace_id"),
        rs.getString("status"),
        rs.getString("default_webhook_url"),
        rs.getString("default_webhook_url_iv"),
        rs.getInt("error_count"),
        rs.getLong("message_count"));
    
    private static final RowMapper<LinearIntegration> LINEAR_MAPPER = (rs, rowNum) -> new LinearIntegration(
        rs.getString("id"),
        rs.getString("workspace_id"),
        rs.getBoolean("is_active"),
        rs.getString("access_token"),
        rs.getString("access_token_iv"),
        rs.getInt("error_count"),
        rs.getLong("sync_count"));
    
    private static final RowMapper<JiraIntegration> JIRA_MAPPER = (rs, rowNum) -> {
        Timestamp expiresAt = rs.getTimestamp("token_expires_at");
        return new JiraIntegration(
            rs.getString("id"),
            rs.getString("workspace_id"),
            rs.getBoolean("is_active"),
            rs.getString("cloud_id"),
            rs.getString("access_token"),
            rs.getString("access_token_iv"),
            expiresAt != null ? expiresAt.toInstant() : null,
            rs.getInt("error_count"),
            rs.getLong("sync_count"));
    };
    
    private static final RowMapper<OutgoingWebhook> WEBHOOK_MAPPER = (rs, rowNum) -> new OutgoingWebhook(
        rs.getString("id"),
        rs.getString("workspace_id"),
        rs.getBoolean("is_active"),
        rs.getInt("consecutive_failures"),
        rs.getInt("max_consecutive_failures"));
    
    private final JdbcTemplate jdbcTemplate;
    
    public PostgresCredentialStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }
    
    @Override
    public Optional<SlackIntegration> findSlackIntegration(String workspaceId) {
        return findOne(SELECT_SLACK, SLACK_MAPPER, "slack", workspaceId);
    }
    
    @Override
    public Optional<DiscordIntegration> findDiscordIntegration(String workspaceId) {
        return findOne(SELECT_DISCORD, DISCORD_MAPPER, "discord", workspaceId);
    }
    
    @Override
    public Optional<LinearIntegration> findLinearIntegration(String workspaceId) {
        return findOne(SELECT_LINEAR, LINEAR_MAPPER, "linear", workspaceId);
    }
    
    @Override
    public Optional<JiraIntegration> findJiraIntegration(String workspaceId) {
        return findOne(SELECT_JIRA, JIRA_MAPPER, "jira", workspaceId);
    }
    
    @Override
    public Optional<IntegrationConnection> findConnection(String workspaceId, ConnectionProvider provider) {
        RowMapper<IntegrationConnection> mapper = (rs, rowNum) -> {
            Timestamp lastUsedAt = rs.getTimestamp("last_used_at");
            return new IntegrationConnection(
                rs.getString("id"),
                rs.getString("workspace_id"),
                provider,
                ConnectionStatus.fromValue(rs.getString("status")),
                lastUsedAt != null ? lastUsedAt.toInstant() : null);
        };
        return findOne(SELECT_CONNECTION, mapper, provider.value(), workspaceId, provider.value());
    }
    
    @Override
    public List<OutgoingWebhook> findWebhooks(String workspaceId) {
        try {
            return jdbcTemplate.query(SELECT_WEBHOOKS, WEBHOOK_MAPPER, workspaceId);
        } catch (Exception e) {
            logger.error("Failed to load webhooks for workspace {}", workspaceId, e);
            throw new HealthStoreException("Webhook lookup failed", e);
        }
    }
    
    @Override
    public Set<String> findWorkspaceIdsWithIntegrations() {
        Set<String> workspaceIds = new LinkedHashSet<>();
        for (String table : CREDENTIAL_TABLES) {
            try {
                workspaceIds.addAll(jdbcTemplate.queryForList(
                    String.format(SELECT_DISTINCT_WORKSPACES, table), String.class));
            } catch (Exception e) {
                logger.error("Failed to discover workspaces from {}", table, e);
                throw new HealthStoreException("Workspace discovery failed", e);
            }
        }
        logger.debug("Discovered {} workspaces with integrations", workspaceIds.size());
        return workspaceIds;
    }
    
    private <T> Optional<T> findOne(String sql, RowMapper<T> mapper, String source, Object... args) {
        try {
            return jdbcTemplate.query(sql, mapper, args).stream().findFirst();
        } catch (Exception e) {
            logger.error("Failed to load {} integration for workspace {}", source, args[0], e);
            throw new HealthStoreException("Credential lookup failed for " + source, e);
        }
    }
}
