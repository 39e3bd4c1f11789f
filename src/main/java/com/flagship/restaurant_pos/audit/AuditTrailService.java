package com.flagship.restaurant_pos.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.restaurant_pos.access.ActorContext;
import com.flagship.restaurant_pos.access.CapabilityGuard;
import com.flagship.restaurant_pos.access.Role;
import com.flagship.restaurant_pos.observability.PosMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Write-once audit trail backed by {@code audit_logs}.
 *
 * The public surface is append, query and an age-based purge. The table
 * rejects UPDATE outright and rejects DELETE unless the purge flag is set on
 * the current transaction (see the V1 migration).
 *
 * A failed insert never aborts the caller. Inside a business transaction the
 * insert runs under a JDBC savepoint on the transaction's own connection, so
 * a failure rolls back only the audit row; it is then logged and counted.
 */
@Service
@Slf4j
public class AuditTrailService {

    private static final String INSERT_SQL =
            "INSERT INTO audit_logs (id, user_id, action_type, table_name, record_id, description, " +
            "ip_address, device_id, metadata, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)";

    private static final int MAX_QUERY_LIMIT = 200;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final CapabilityGuard capabilities;
    private final PosMetrics metrics;

    @Value("${pos.audit.retention-days:90}")
    private int retentionDays;

    public AuditTrailService(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                             CapabilityGuard capabilities, PosMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.capabilities = capabilities;
        this.metrics = metrics;
    }

    /**
     * Appends an entry. Returns the new id, or empty if the write failed.
     */
    public Optional<UUID> record(AuditRecord entry) {
        UUID id = UUID.randomUUID();
        try {
            String metadataJson = objectMapper.writeValueAsString(
                    entry.getMetadata() != null ? entry.getMetadata() : Collections.emptyMap());
            if (TransactionSynchronizationManager.isActualTransactionActive()) {
                jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
                    Savepoint savepoint = connection.setSavepoint();
                    try {
                        insert(connection.prepareStatement(INSERT_SQL), id, entry, metadataJson);
                        connection.releaseSavepoint(savepoint);
                    } catch (SQLException e) {
                        connection.rollback(savepoint);
                        throw e;
                    }
                    return null;
                });
            } else {
                jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
                    insert(connection.prepareStatement(INSERT_SQL), id, entry, metadataJson);
                    return null;
                });
            }
            log.debug("Audit entry written: id={}, action={}, user={}", id, entry.getActionType(), entry.getUserId());
            return Optional.of(id);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Audit write failed, continuing without it: action={}, user={}, description={}, error={}",
                    entry.getActionType(), entry.getUserId(), entry.getDescription(), e.getMessage());
            metrics.recordAuditWriteFailure(entry.getActionType() != null ? entry.getActionType().code() : null);
            return Optional.empty();
        }
    }

    private void insert(PreparedStatement statement, UUID id, AuditRecord entry, String metadataJson)
            throws SQLException {
        try (PreparedStatement ps = statement) {
            ps.setObject(1, id);
            ps.setObject(2, entry.getUserId());
            ps.setString(3, entry.getActionType().code());
            ps.setString(4, entry.getTableName());
            ps.setString(5, entry.getRecordId());
            ps.setString(6, entry.getDescription());
            ps.setString(7, entry.getIpAddress());
            ps.setString(8, entry.getDeviceId());
            ps.setString(9, metadataJson);
            ps.setTimestamp(10, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        }
    }

    /**
     * Most recent entries first, optionally filtered by action type and user.
     */
    @Transactional(readOnly = true)
    public List<AuditLog> recent(AuditActionType actionType, UUID userId, int limit, ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        return query(actionType, userId, limit);
    }

    List<AuditLog> query(AuditActionType actionType, UUID userId, int limit) {
        StringBuilder sql = new StringBuilder(
                "SELECT id, user_id, action_type, table_name, record_id, description, ip_address, device_id, " +
                "metadata::text AS metadata, created_at FROM audit_logs WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (actionType != null) {
            sql.append(" AND action_type = ?");
            args.add(actionType.code());
        }
        if (userId != null) {
            sql.append(" AND user_id = ?");
            args.add(userId);
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");
        args.add(Math.max(1, Math.min(limit, MAX_QUERY_LIMIT)));
        return jdbcTemplate.query(sql.toString(), auditLogRowMapper(), args.toArray());
    }

    /**
     * Entries about one record, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AuditLog> forRecord(String tableName, String recordId) {
        return jdbcTemplate.query(
                "SELECT id, user_id, action_type, table_name, record_id, description, ip_address, device_id, " +
                "metadata::text AS metadata, created_at FROM audit_logs " +
                "WHERE table_name = ? AND record_id = ? ORDER BY created_at ASC",
                auditLogRowMapper(), tableName, recordId);
    }

    /**
     * Removes entries older than the retention window. Administrators only.
     * The purge itself is audited.
     *
     * @return number of entries removed
     */
    @Transactional
    public int purgeExpired(ActorContext actor) {
        capabilities.requires(actor, Role.ADMIN);
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));

        jdbcTemplate.queryForObject("SELECT set_config('pos.audit_purge', 'on', true)", String.class);
        int removed = jdbcTemplate.update("DELETE FROM audit_logs WHERE created_at < ?", Timestamp.from(cutoff));
        jdbcTemplate.queryForObject("SELECT set_config('pos.audit_purge', 'off', true)", String.class);

        log.warn("Audit purge removed {} entries older than {} ({} days)", removed, cutoff, retentionDays);
        record(AuditRecord.by(actor, AuditActionType.USER_ACTION)
                .tableName("audit_logs")
                .description("Purged " + removed + " audit entries older than " + retentionDays + " days")
                .meta("removed", removed)
                .meta("cutoff", cutoff.toString())
                .build());
        return removed;
    }

    private RowMapper<AuditLog> auditLogRowMapper() {
        return (rs, rowNum) -> new AuditLog(
                rs.getObject("id", UUID.class),
                rs.getObject("user_id", UUID.class),
                AuditActionType.fromCode(rs.getString("action_type")),
                rs.getString("table_name"),
                rs.getString("record_id"),
                rs.getString("description"),
                rs.getString("ip_address"),
                rs.getString("device_id"),
                readMetadata(rs.getString("metadata")),
                rs.getTimestamp("created_at").toInstant()
        );
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            log.warn("Unreadable audit metadata: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
