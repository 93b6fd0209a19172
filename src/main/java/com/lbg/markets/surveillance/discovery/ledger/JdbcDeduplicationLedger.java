package com.lbg.markets.surveillance.discovery.ledger;

import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.Page;
import com.lbg.markets.surveillance.discovery.domain.ProcessedFileRecord;
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
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Ledger on the {@code processed_file} table. Uniqueness comes from
 * {@code ux_processed_file_identity}: concurrent claims race on the insert
 * and exactly one of them wins.
 */
@ApplicationScoped
public class JdbcDeduplicationLedger implements DeduplicationLedger {

    private static final Logger LOG = Logger.getLogger(JdbcDeduplicationLedger.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String INSERT = "INSERT INTO processed_file"
            + " (record_id, tenant_id, configuration_id, execution_id, filename, locator,"
            + " discovery_date, size_bytes, processed_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String DELETE_CLAIM = "DELETE FROM processed_file"
            + " WHERE tenant_id = ? AND configuration_id = ? AND execution_id = ?"
            + " AND locator = ? AND discovery_date = ?";

    private static final String EXISTS = "SELECT 1 FROM processed_file"
            + " WHERE tenant_id = ? AND configuration_id = ? AND locator = ? AND discovery_date = ?";

    private static final String SELECT = "SELECT record_id, tenant_id, configuration_id, execution_id, filename,"
            + " locator, discovery_date, size_bytes, processed_at FROM processed_file"
            + " WHERE tenant_id = ? AND configuration_id = ?";

    @Inject
    DataSource dataSource;

    @Inject
    Clock clock;

    @Override
    public boolean tryMarkProcessed(String tenantId, String configurationId, String executionId,
                                    DiscoveredFile file, LocalDate discoveryDate) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement insert = connection.prepareStatement(INSERT)) {
            insert.setString(1, UUID.randomUUID().toString());
            insert.setString(2, tenantId);
            insert.setString(3, configurationId);
            insert.setString(4, executionId);
            insert.setString(5, file.filename());
            insert.setString(6, file.locator());
            insert.setObject(7, discoveryDate);
            insert.setLong(8, file.sizeBytes());
            insert.setLong(9, clock.millis());
            insert.executeUpdate();

            LOG.debugf("Marked %s processed for %s/%s (execution %s)",
                    file.locator(), tenantId, configurationId, executionId);
            return true;

        } catch (SQLException e) {
            if (isDuplicate(e)) {
                LOG.debugf("Already processed: %s for %s/%s on %s",
                        file.locator(), tenantId, configurationId, discoveryDate);
                return false;
            }
            throw new StoreException("Failed to mark " + file.locator() + " processed", e);
        }
    }

    @Override
    public boolean release(String tenantId, String configurationId, String executionId,
                           String locator, LocalDate discoveryDate) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement delete = connection.prepareStatement(DELETE_CLAIM)) {
            delete.setString(1, tenantId);
            delete.setString(2, configurationId);
            delete.setString(3, executionId);
            delete.setString(4, locator);
            delete.setObject(5, discoveryDate);
            boolean removed = delete.executeUpdate() > 0;
            if (removed) {
                LOG.infof("Released claim on %s for %s/%s (execution %s)",
                        locator, tenantId, configurationId, executionId);
            }
            return removed;
        } catch (SQLException e) {
            throw new StoreException("Failed to release claim on " + locator, e);
        }
    }

    @Override
    public boolean isProcessed(String tenantId, String configurationId, String locator, LocalDate discoveryDate) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement select = connection.prepareStatement(EXISTS)) {
            select.setString(1, tenantId);
            select.setString(2, configurationId);
            select.setString(3, locator);
            select.setObject(4, discoveryDate);
            try (ResultSet rs = select.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to look up " + locator, e);
        }
    }

    @Override
    public Page<ProcessedFileRecord> query(LedgerQuery query) {
        StringBuilder sql = new StringBuilder(SELECT);
        List<Object> params = new ArrayList<>();
        params.add(query.tenantId());
        params.add(query.configurationId());

        if (query.filename() != null && !query.filename().isBlank()) {
            sql.append(" AND filename = ?");
            params.add(query.filename());
        }
        if (query.executionId() != null && !query.executionId().isBlank()) {
            sql.append(" AND execution_id = ?");
            params.add(query.executionId());
        }
        if (query.continuationToken() != null) {
            ContinuationToken after = ContinuationToken.decode(query.continuationToken());
            sql.append(" AND (processed_at > ? OR (processed_at = ? AND record_id > ?))");
            params.add(after.timestampMillis());
            params.add(after.timestampMillis());
            params.add(after.id());
        }
        sql.append(" ORDER BY processed_at, record_id LIMIT ?");
        params.add(query.pageSize() + 1);

        try (Connection connection = dataSource.getConnection();
             PreparedStatement select = connection.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                select.setObject(i + 1, params.get(i));
            }
            List<ProcessedFileRecord> records = new ArrayList<>();
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    records.add(map(rs));
                }
            }
            return toPage(records, query.pageSize());
        } catch (SQLException e) {
            throw new StoreException("Failed to query ledger of " + query.tenantId() + "/" + query.configurationId(), e);
        }
    }

    private static Page<ProcessedFileRecord> toPage(List<ProcessedFileRecord> records, int pageSize) {
        if (records.size() <= pageSize) {
            return new Page<>(records, null);
        }
        List<ProcessedFileRecord> page = records.subList(0, pageSize);
        ProcessedFileRecord last = page.get(page.size() - 1);
        String token = new ContinuationToken(last.processedAt().toEpochMilli(), last.recordId()).encode();
        return new Page<>(page, token);
    }

    private static ProcessedFileRecord map(ResultSet rs) throws SQLException {
        return new ProcessedFileRecord(
                rs.getString("record_id"),
                rs.getString("tenant_id"),
                rs.getString("configuration_id"),
                rs.getString("execution_id"),
                rs.getString("filename"),
                rs.getString("locator"),
                rs.getObject("discovery_date", LocalDate.class),
                rs.getLong("size_bytes"),
                Instant.ofEpochMilli(rs.getLong("processed_at"))
        );
    }

    static boolean isDuplicate(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (UNIQUE_VIOLATION.equals(current.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
