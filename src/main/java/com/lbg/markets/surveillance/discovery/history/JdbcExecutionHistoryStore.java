package com.lbg.markets.surveillance.discovery.history;

import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionCounts;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ExecutionStatus;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;
import com.lbg.markets.surveillance.discovery.domain.Page;
import com.lbg.markets.surveillance.discovery.store.StoreException;
import com.lbg.markets.surveillance.discovery.util.ContinuationToken;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class JdbcExecutionHistoryStore implements ExecutionHistoryStore {

    private static final Logger LOG = Logger.getLogger(JdbcExecutionHistoryStore.class);

    private static final String COLUMNS = "execution_id, tenant_id, configuration_id, trigger_type, status,"
            + " created_at, started_at, completed_at, deadline_at, duration_ms, files_found, files_processed,"
            + " notifications_emitted, retry_count, resolved_path, resolved_name_pattern, error_category,"
            + " error_message";

    private static final String INSERT = "INSERT INTO execution_record (" + COLUMNS + ")"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String MARK_RUNNING = "UPDATE execution_record SET status = 'RUNNING', started_at = ?"
            + " WHERE execution_id = ? AND status = 'PENDING'";

    private static final String UPDATE_RUNNING = "UPDATE execution_record"
            + " SET resolved_path = ?, resolved_name_pattern = ?"
            + " WHERE execution_id = ? AND status = 'RUNNING'";

    private static final String COMPLETE = "UPDATE execution_record SET status = ?, started_at = ?,"
            + " completed_at = ?, duration_ms = ?, files_found = ?, files_processed = ?,"
            + " notifications_emitted = ?, retry_count = ?, resolved_path = ?, resolved_name_pattern = ?,"
            + " error_category = ?, error_message = ?"
            + " WHERE execution_id = ? AND status IN ('PENDING', 'RUNNING')";

    private static final String CLOSE_ABANDONED = "UPDATE execution_record SET status = 'FAILED',"
            + " completed_at = ?, duration_ms = ? - COALESCE(started_at, created_at),"
            + " error_category = 'CANCELLED', error_message = ?"
            + " WHERE status IN ('PENDING', 'RUNNING') AND deadline_at < ?";

    @Inject
    DataSource dataSource;

    @Override
    public ExecutionRecord createPending(ExecutionRecord pending) {
        if (pending.status() != ExecutionStatus.PENDING) {
            throw new IllegalArgumentException("New execution records must be PENDING, got " + pending.status());
        }
        try (Connection connection = dataSource.getConnection();
             PreparedStatement insert = connection.prepareStatement(INSERT)) {
            insert.setString(1, pending.executionId());
            insert.setString(2, pending.tenantId());
            insert.setString(3, pending.configurationId());
            insert.setString(4, pending.trigger().name());
            insert.setString(5, pending.status().name());
            insert.setLong(6, pending.createdAt().toEpochMilli());
            setInstant(insert, 7, pending.startedAt());
            setInstant(insert, 8, pending.completedAt());
            setInstant(insert, 9, pending.deadline());
            insert.setNull(10, Types.BIGINT);
            insert.setInt(11, 0);
            insert.setInt(12, 0);
            insert.setInt(13, 0);
            insert.setInt(14, 0);
            insert.setString(15, null);
            insert.setString(16, null);
            insert.setString(17, null);
            insert.setString(18, null);
            insert.executeUpdate();
            return pending;
        } catch (SQLException e) {
            throw new StoreException("Failed to create execution record " + pending.executionId(), e);
        }
    }

    @Override
    public boolean markRunning(ExecutionRecord running) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement update = connection.prepareStatement(MARK_RUNNING)) {
            update.setLong(1, running.startedAt().toEpochMilli());
            update.setString(2, running.executionId());
            return update.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark execution " + running.executionId() + " running", e);
        }
    }

    @Override
    public boolean updateRunning(ExecutionRecord running) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement update = connection.prepareStatement(UPDATE_RUNNING)) {
            update.setString(1, running.resolvedPath());
            update.setString(2, running.resolvedNamePattern());
            update.setString(3, running.executionId());
            return update.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to update execution " + running.executionId(), e);
        }
    }

    @Override
    public boolean complete(ExecutionRecord terminal) {
        if (!terminal.status().isTerminal()) {
            throw new IllegalArgumentException("Execution " + terminal.executionId() + " is not terminal");
        }
        ExecutionCounts counts = terminal.counts();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement update = connection.prepareStatement(COMPLETE)) {
            update.setString(1, terminal.status().name());
            setInstant(update, 2, terminal.startedAt());
            setInstant(update, 3, terminal.completedAt());
            Duration duration = terminal.duration();
            if (duration != null) {
                update.setLong(4, duration.toMillis());
            } else {
                update.setNull(4, Types.BIGINT);
            }
            update.setInt(5, counts.filesFound());
            update.setInt(6, counts.filesProcessed());
            update.setInt(7, counts.notificationsEmitted());
            update.setInt(8, counts.retryCount());
            update.setString(9, terminal.resolvedPath());
            update.setString(10, terminal.resolvedNamePattern());
            update.setString(11, terminal.errorCategory() != null ? terminal.errorCategory().name() : null);
            update.setString(12, terminal.errorMessage());
            update.setString(13, terminal.executionId());

            boolean written = update.executeUpdate() == 1;
            if (!written) {
                LOG.warnf("Execution %s was already closed; dropping %s outcome",
                        terminal.executionId(), terminal.status());
            }
            return written;
        } catch (SQLException e) {
            throw new StoreException("Failed to complete execution " + terminal.executionId(), e);
        }
    }

    @Override
    public Optional<ExecutionRecord> find(String executionId) {
        String sql = "SELECT " + COLUMNS + " FROM execution_record WHERE execution_id = ?";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement select = connection.prepareStatement(sql)) {
            select.setString(1, executionId);
            try (ResultSet rs = select.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load execution " + executionId, e);
        }
    }

    @Override
    public Page<ExecutionRecord> query(ExecutionQuery query) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM execution_record WHERE tenant_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(query.tenantId());

        if (query.configurationId() != null) {
            sql.append(" AND configuration_id = ?");
            params.add(query.configurationId());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            params.add(query.status().name());
        }
        if (query.from() != null) {
            sql.append(" AND created_at >= ?");
            params.add(query.from().toEpochMilli());
        }
        if (query.to() != null) {
            sql.append(" AND created_at < ?");
            params.add(query.to().toEpochMilli());
        }
        if (query.continuationToken() != null) {
            ContinuationToken after = ContinuationToken.decode(query.continuationToken());
            sql.append(" AND (created_at < ? OR (created_at = ? AND execution_id < ?))");
            params.add(after.timestampMillis());
            params.add(after.timestampMillis());
            params.add(after.id());
        }
        sql.append(" ORDER BY created_at DESC, execution_id DESC LIMIT ?");
        params.add(query.pageSize() + 1);

        List<ExecutionRecord> records = select(sql.toString(), params);
        if (records.size() <= query.pageSize()) {
            return new Page<>(records, null);
        }
        List<ExecutionRecord> page = records.subList(0, query.pageSize());
        ExecutionRecord last = page.get(page.size() - 1);
        return new Page<>(page, new ContinuationToken(last.createdAt().toEpochMilli(), last.executionId()).encode());
    }

    @Override
    public List<ExecutionRecord> findInWindow(String tenantId, String configurationId, Instant from, Instant to) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM execution_record"
                + " WHERE tenant_id = ? AND created_at >= ? AND created_at < ?");
        List<Object> params = new ArrayList<>(List.of(tenantId, from.toEpochMilli(), to.toEpochMilli()));
        if (configurationId != null) {
            sql.append(" AND configuration_id = ?");
            params.add(configurationId);
        }
        sql.append(" ORDER BY created_at");
        return select(sql.toString(), params);
    }

    @Override
    public int closeAbandoned(Instant cutoff, Instant now) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement update = connection.prepareStatement(CLOSE_ABANDONED)) {
            update.setLong(1, now.toEpochMilli());
            update.setLong(2, now.toEpochMilli());
            update.setString(3, "Execution abandoned past its deadline");
            update.setLong(4, cutoff.toEpochMilli());
            return update.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to close abandoned executions", e);
        }
    }

    private List<ExecutionRecord> select(String sql, List<Object> params) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement select = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                select.setObject(i + 1, params.get(i));
            }
            List<ExecutionRecord> records = new ArrayList<>();
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    records.add(map(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new StoreException("Failed to query execution history", e);
        }
    }

    private static ExecutionRecord map(ResultSet rs) throws SQLException {
        String category = rs.getString("error_category");
        return new ExecutionRecord(
                rs.getString("execution_id"),
                rs.getString("tenant_id"),
                rs.getString("configuration_id"),
                ExecutionTrigger.valueOf(rs.getString("trigger_type")),
                ExecutionStatus.valueOf(rs.getString("status")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                getInstant(rs, "started_at"),
                getInstant(rs, "completed_at"),
                getInstant(rs, "deadline_at"),
                new ExecutionCounts(
                        rs.getInt("files_found"),
                        rs.getInt("files_processed"),
                        rs.getInt("notifications_emitted"),
                        rs.getInt("retry_count")),
                rs.getString("resolved_path"),
                rs.getString("resolved_name_pattern"),
                category != null ? ErrorCategory.valueOf(category) : null,
                rs.getString("error_message")
        );
    }

    static void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value != null) {
            statement.setLong(index, value.toEpochMilli());
        } else {
            statement.setNull(index, Types.BIGINT);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }
}
