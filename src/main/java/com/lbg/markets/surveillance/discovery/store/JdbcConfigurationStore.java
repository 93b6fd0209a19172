package com.lbg.markets.surveillance.discovery.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.Page;
import com.lbg.markets.surveillance.discovery.domain.ProtocolSettings;
import com.lbg.markets.surveillance.discovery.domain.ProtocolType;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.domain.Schedule;
import com.lbg.markets.surveillance.discovery.domain.TokenTimeBasis;
import com.lbg.markets.surveillance.discovery.schedule.ScheduleEvaluator;
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
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Configurations in {@code retrieval_configuration}. Protocol settings and notification
 * targets are stored as JSON; every write is a compare-and-set on {@code version}.
 */
@ApplicationScoped
public class JdbcConfigurationStore implements ConfigurationStore {

    private static final Logger LOG = Logger.getLogger(JdbcConfigurationStore.class);

    private static final TypeReference<List<NotificationTarget>> TARGET_LIST = new TypeReference<>() {
    };

    private static final String COLUMNS = "tenant_id, configuration_id, name, description, protocol, settings_json,"
            + " path_pattern, name_pattern, extension, cron_expression, zone_id, token_time_basis, active,"
            + " targets_json, created_by, created_at, modified_by, modified_at, last_executed_at,"
            + " next_scheduled_run, version";

    private static final String INSERT = "INSERT INTO retrieval_configuration (" + COLUMNS + ")"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE = "UPDATE retrieval_configuration SET name = ?, description = ?,"
            + " protocol = ?, settings_json = ?, path_pattern = ?, name_pattern = ?, extension = ?,"
            + " cron_expression = ?, zone_id = ?, token_time_basis = ?, active = ?, targets_json = ?,"
            + " modified_by = ?, modified_at = ?, last_executed_at = ?, next_scheduled_run = ?,"
            + " version = version + 1"
            + " WHERE tenant_id = ? AND configuration_id = ? AND version = ?";

    @Inject
    DataSource dataSource;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    ConfigurationValidator validator;

    @Inject
    ScheduleEvaluator scheduleEvaluator;

    @Inject
    Clock clock;

    @Override
    public RetrievalConfiguration create(RetrievalConfiguration configuration) {
        validator.validate(configuration);

        Instant now = clock.instant();
        Instant nextRun = scheduleEvaluator.nextRun(configuration.schedule(), now);
        RetrievalConfiguration stored = new RetrievalConfiguration(
                configuration.tenantId(), configuration.configurationId(), configuration.name(),
                configuration.description(), configuration.protocol(), configuration.settings(),
                configuration.pathPattern(), configuration.namePattern(), configuration.extension(),
                configuration.schedule(), configuration.tokenTimeBasis(), configuration.active(),
                configuration.targets(), configuration.createdBy(), now, configuration.createdBy(), now,
                null, nextRun, 1L);

        try (Connection connection = dataSource.getConnection();
             PreparedStatement insert = connection.prepareStatement(INSERT)) {
            insert.setString(1, stored.tenantId());
            insert.setString(2, stored.configurationId());
            int next = bindMutable(insert, 3, stored);
            insert.setString(next, stored.createdBy());
            insert.setLong(next + 1, stored.createdAt().toEpochMilli());
            insert.setString(next + 2, stored.modifiedBy());
            insert.setLong(next + 3, stored.modifiedAt().toEpochMilli());
            setInstant(insert, next + 4, stored.lastExecutedAt());
            setInstant(insert, next + 5, stored.nextScheduledRun());
            insert.setLong(next + 6, stored.version());
            insert.executeUpdate();

            LOG.infof("Created configuration %s (%s), first run at %s", stored.key(), stored.protocol(), nextRun);
            return stored;

        } catch (SQLException e) {
            if ("23505".equals(e.getSQLState())) {
                throw new ValidationException(List.of("configuration " + stored.key() + " already exists"));
            }
            throw new StoreException("Failed to create configuration " + stored.key(), e);
        }
    }

    @Override
    public Optional<RetrievalConfiguration> find(ConfigKey key) {
        String sql = "SELECT " + COLUMNS + " FROM retrieval_configuration WHERE tenant_id = ? AND configuration_id = ?";
        List<RetrievalConfiguration> found = select(sql, List.of(key.tenantId(), key.configurationId()));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public Page<RetrievalConfiguration> list(String tenantId, int pageSize, String continuationToken) {
        int size = pageSize <= 0 ? 50 : Math.min(pageSize, 500);
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM retrieval_configuration WHERE tenant_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(tenantId);
        if (continuationToken != null) {
            // The timestamp half of the cursor is unused; configurations page by id alone
            sql.append(" AND configuration_id > ?");
            params.add(ContinuationToken.decode(continuationToken).id());
        }
        sql.append(" ORDER BY configuration_id LIMIT ?");
        params.add(size + 1);

        List<RetrievalConfiguration> rows = select(sql.toString(), params);
        if (rows.size() <= size) {
            return new Page<>(rows, null);
        }
        List<RetrievalConfiguration> page = rows.subList(0, size);
        String token = new ContinuationToken(0, page.get(page.size() - 1).configurationId()).encode();
        return new Page<>(page, token);
    }

    @Override
    public List<RetrievalConfiguration> findDue(Instant now, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM retrieval_configuration"
                + " WHERE active = TRUE AND next_scheduled_run <= ?"
                + " ORDER BY next_scheduled_run, tenant_id, configuration_id LIMIT ?";
        return select(sql, List.of(now.toEpochMilli(), limit));
    }

    @Override
    public RetrievalConfiguration update(RetrievalConfiguration configuration) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement update = connection.prepareStatement(UPDATE)) {
            int next = bindMutable(update, 1, configuration);
            update.setString(next, configuration.modifiedBy());
            update.setLong(next + 1, configuration.modifiedAt() != null
                    ? configuration.modifiedAt().toEpochMilli() : clock.millis());
            setInstant(update, next + 2, configuration.lastExecutedAt());
            setInstant(update, next + 3, configuration.nextScheduledRun());
            update.setString(next + 4, configuration.tenantId());
            update.setString(next + 5, configuration.configurationId());
            update.setLong(next + 6, configuration.version());

            if (update.executeUpdate() == 0) {
                if (find(configuration.key()).isEmpty()) {
                    throw new ConfigurationNotFoundException(configuration.key());
                }
                throw new ConcurrencyConflictException(configuration.key(), configuration.version());
            }
            LOG.debugf("Updated configuration %s to version %d", configuration.key(), configuration.version() + 1);
            return configuration.withVersion(configuration.version() + 1);

        } catch (SQLException e) {
            throw new StoreException("Failed to update configuration " + configuration.key(), e);
        }
    }

    @Override
    public RetrievalConfiguration deactivate(ConfigKey key, String modifiedBy) {
        RetrievalConfiguration current = get(key);
        if (!current.active()) {
            return current;
        }
        RetrievalConfiguration updated = update(current.deactivated(modifiedBy, clock.instant()));
        LOG.infof("Deactivated configuration %s", key);
        return updated;
    }

    /**
     * Binds name through targets_json, the columns shared by insert and update.
     *
     * @return the next parameter index
     */
    private int bindMutable(PreparedStatement statement, int start, RetrievalConfiguration config)
            throws SQLException {
        int i = start;
        statement.setString(i++, config.name());
        statement.setString(i++, config.description());
        statement.setString(i++, config.protocol().name());
        statement.setString(i++, toJson(config.settings()));
        statement.setString(i++, config.pathPattern());
        statement.setString(i++, config.namePattern());
        statement.setString(i++, config.extension());
        statement.setString(i++, config.schedule().cronExpression());
        statement.setString(i++, config.schedule().zoneId());
        statement.setString(i++, config.tokenTimeBasis().name());
        statement.setBoolean(i++, config.active());
        statement.setString(i++, toJson(config.targets()));
        return i;
    }

    private List<RetrievalConfiguration> select(String sql, List<Object> params) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement select = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                select.setObject(i + 1, params.get(i));
            }
            List<RetrievalConfiguration> rows = new ArrayList<>();
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    rows.add(map(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException("Failed to query configurations", e);
        }
    }

    private RetrievalConfiguration map(ResultSet rs) throws SQLException {
        return new RetrievalConfiguration(
                rs.getString("tenant_id"),
                rs.getString("configuration_id"),
                rs.getString("name"),
                rs.getString("description"),
                ProtocolType.valueOf(rs.getString("protocol")),
                fromJson(rs.getString("settings_json"), ProtocolSettings.class),
                rs.getString("path_pattern"),
                rs.getString("name_pattern"),
                rs.getString("extension"),
                new Schedule(rs.getString("cron_expression"), rs.getString("zone_id")),
                TokenTimeBasis.valueOf(rs.getString("token_time_basis")),
                rs.getBoolean("active"),
                targetsFromJson(rs.getString("targets_json")),
                rs.getString("created_by"),
                getInstant(rs, "created_at"),
                rs.getString("modified_by"),
                getInstant(rs, "modified_at"),
                getInstant(rs, "last_executed_at"),
                getInstant(rs, "next_scheduled_run"),
                rs.getLong("version")
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialise " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt " + type.getSimpleName() + " column", e);
        }
    }

    private List<NotificationTarget> targetsFromJson(String json) {
        try {
            return objectMapper.readValue(json, TARGET_LIST);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt notification targets column", e);
        }
    }

    private static void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value != null) {
            statement.setLong(index, value.toEpochMilli());
        } else {
            statement.setNull(index, Types.BIGINT);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }
}
