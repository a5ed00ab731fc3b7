package com.integrationhealth.postgres.store;

public final class PostgresHealthQueries {
    
    private PostgresHealthQueries() {}
    
    private static final String HEALTH_COLUMNS = """
        id, workspace_id, integration_type, integration_id, status, last_success_at, last_error_at,
        last_error_message, error_count_24h, uptime_30d, response_time_ms, consecutive_failures,
        health_details, checked_at, created_at, updated_at
        """;
    
    public static final String UPSERT_HEALTH_CHECK = """
        INSERT INTO integration_health_checks (
            id, workspace_id, integration_type, integration_id, status, last_success_at, last_error_at,
            last_error_message, error_count_24h, uptime_30d, response_time_ms, consecutive_failures,
            health_details, checked_at, created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
        ON CONFLICT (workspace_id, integration_type) DO UPDATE SET
            integration_id = EXCLUDED.integration_id,
            status = EXCLUDED.status,
            last_success_at = EXCLUDED.last_success_at,
            last_error_at = EXCLUDED.last_error_at,
            last_error_message = EXCLUDED.last_error_message,
            error_count_24h = EXCLUDED.error_count_24h,
            uptime_30d = EXCLUDED.uptime_30d,
            response_time_ms = EXCLUDED.response_time_ms,
            consecutive_failures = EXCLUDED.consecutive_failures,
            health_details = EXCLUDED.health_details,
            checked_at = EXCLUDED.checked_at,
            updated_at = EXCLUDED.updated_at
        """;
    
    public static final String SELECT_BY_WORKSPACE_AND_TYPE = "SELECT " + HEALTH_COLUMNS + """
        FROM integration_health_checks
        WHERE workspace_id = ? AND integration_type = ?
        """;
    
    public static final String SELECT_BY_WORKSPACE = "SELECT " + HEALTH_COLUMNS + """
        FROM integration_health_checks
        WHERE workspace_id = ?
        ORDER BY integration_type
        """;
    
    public static final String COUNT_GROUP_BY_STATUS = """
        SELECT status, COUNT(*) AS total FROM integration_health_checks GROUP BY status
        """;
}
