package com.lbg.markets.surveillance.discovery.store;

import com.lbg.markets.surveillance.discovery.ledger.DeduplicationLedger;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Creates the tables and indexes on startup if they do not exist yet.
 */
@ApplicationScoped
public class SchemaInitializer {

    private static final Logger LOG = Logger.getLogger(SchemaInitializer.class);

    private static final List<String> DDL = List.of(
            "CREATE TABLE IF NOT EXISTS retrieval_configuration ("
                    + " tenant_id VARCHAR(50) NOT NULL,"
                    + " configuration_id VARCHAR(100) NOT NULL,"
                    + " name VARCHAR(200) NOT NULL,"
                    + " description VARCHAR(1000),"
                    + " protocol VARCHAR(20) NOT NULL,"
                    + " settings_json CLOB NOT NULL,"
                    + " path_pattern VARCHAR(500) NOT NULL,"
                    + " name_pattern VARCHAR(200) NOT NULL,"
                    + " extension VARCHAR(10),"
                    + " cron_expression VARCHAR(120) NOT NULL,"
                    + " zone_id VARCHAR(64) NOT NULL,"
                    + " token_time_basis VARCHAR(20) NOT NULL,"
                    + " active BOOLEAN NOT NULL,"
                    + " targets_json CLOB NOT NULL,"
                    + " created_by VARCHAR(100),"
                    + " created_at BIGINT NOT NULL,"
                    + " modified_by VARCHAR(100),"
                    + " modified_at BIGINT NOT NULL,"
                    + " last_executed_at BIGINT,"
                    + " next_scheduled_run BIGINT,"
                    + " version BIGINT NOT NULL,"
                    + " PRIMARY KEY (tenant_id, configuration_id))",
            "CREATE INDEX IF NOT EXISTS idx_configuration_due"
                    + " ON retrieval_configuration (active, next_scheduled_run)",

            "CREATE TABLE IF NOT EXISTS processed_file ("
                    + " record_id VARCHAR(36) PRIMARY KEY,"
                    + " tenant_id VARCHAR(50) NOT NULL,"
                    + " configuration_id VARCHAR(100) NOT NULL,"
                    + " execution_id VARCHAR(36) NOT NULL,"
                    + " filename VARCHAR(" + DeduplicationLedger.MAX_FILENAME_LENGTH + ") NOT NULL,"
                    + " locator VARCHAR(" + DeduplicationLedger.MAX_LOCATOR_LENGTH + ") NOT NULL,"
                    + " discovery_date DATE NOT NULL,"
                    + " size_bytes BIGINT NOT NULL,"
                    + " processed_at BIGINT NOT NULL)",
            // One ledger entry per file and discovery date
            "CREATE UNIQUE INDEX IF NOT EXISTS ux_processed_file_identity"
                    + " ON processed_file (tenant_id, configuration_id, locator, discovery_date)",
            "CREATE INDEX IF NOT EXISTS idx_processed_file_execution ON processed_file (execution_id)",

            "CREATE TABLE IF NOT EXISTS execution_record ("
                    + " execution_id VARCHAR(36) PRIMARY KEY,"
                    + " tenant_id VARCHAR(50) NOT NULL,"
                    + " configuration_id VARCHAR(100) NOT NULL,"
                    + " trigger_type VARCHAR(20) NOT NULL,"
                    + " status VARCHAR(20) NOT NULL,"
                    + " created_at BIGINT NOT NULL,"
                    + " started_at BIGINT,"
                    + " completed_at BIGINT,"
                    + " deadline_at BIGINT,"
                    + " duration_ms BIGINT,"
                    + " files_found INT NOT NULL,"
                    + " files_processed INT NOT NULL,"
                    + " notifications_emitted INT NOT NULL,"
                    + " retry_count INT NOT NULL,"
                    + " resolved_path VARCHAR(1024),"
                    + " resolved_name_pattern VARCHAR(1024),"
                    + " error_category VARCHAR(40),"
                    + " error_message VARCHAR(5000))",
            "CREATE INDEX IF NOT EXISTS idx_execution_config_created"
                    + " ON execution_record (tenant_id, configuration_id, created_at)",
            "CREATE INDEX IF NOT EXISTS idx_execution_status ON execution_record (status, deadline_at)"
    );

    @Inject
    DataSource dataSource;

    void onStart(@Observes @Priority(1) StartupEvent event) {
        createSchema();
    }

    public void createSchema() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : DDL) {
                statement.execute(ddl);
            }
            LOG.infof("Discovery schema ready (%d statements)", DDL.size());
        } catch (SQLException e) {
            throw new StoreException("Failed to create discovery schema", e);
        }
    }
}
