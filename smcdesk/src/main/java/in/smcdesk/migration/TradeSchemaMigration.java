package in.smcdesk.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the trades table on startup when it does not exist.
 */
public final class TradeSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(TradeSchemaMigration.class);

    private final DataSource dataSource;

    public TradeSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[TRADE MIGRATION] Starting trades table migration");

        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, "trades")) {
                log.info("[TRADE MIGRATION] trades table already exists");
                return;
            }
            log.info("[TRADE MIGRATION] Creating trades table...");
            createTradesTable(conn);
            log.info("[TRADE MIGRATION] ✓ trades table created");
        } catch (SQLException e) {
            log.error("[TRADE MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Trade migration failed", e);
        }
    }

    boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createTradesTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE trades (
                trade_id VARCHAR(64) PRIMARY KEY,
                signal_id VARCHAR(64),
                symbol VARCHAR(32) NOT NULL,
                direction VARCHAR(4) NOT NULL CHECK (direction IN ('BUY', 'SELL')),
                entry_price NUMERIC(24, 10) NOT NULL,
                quantity NUMERIC(24, 10) NOT NULL CHECK (quantity > 0),
                stop_loss NUMERIC(24, 10) NOT NULL,
                take_profit NUMERIC(24, 10) NOT NULL,
                strategy VARCHAR(64) NOT NULL,
                mode VARCHAR(16) NOT NULL,
                status VARCHAR(8) NOT NULL CHECK (status IN ('OPEN', 'CLOSED')),
                created_at TIMESTAMPTZ NOT NULL,

                -- Close (written once)
                exit_price NUMERIC(24, 10),
                pnl NUMERIC(24, 10),
                closed_at TIMESTAMPTZ,
                close_reason VARCHAR(16)
            );

            CREATE INDEX idx_trades_status ON trades(status);
            CREATE INDEX idx_trades_created_at ON trades(created_at);
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
