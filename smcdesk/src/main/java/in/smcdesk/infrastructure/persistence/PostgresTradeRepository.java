package in.smcdesk.infrastructure.persistence;

import in.smcdesk.application.port.output.TradeRepository;
import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.TradingMode;
import in.smcdesk.domain.trade.CloseReason;
import in.smcdesk.domain.trade.Trade;
import in.smcdesk.domain.trade.TradeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of TradeRepository.
 *
 * Rows are inserted once and updated once, by the conditional close:
 * {@code UPDATE ... WHERE status = 'OPEN'}.
 */
public final class PostgresTradeRepository implements TradeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeRepository.class);

    private final DataSource dataSource;

    public PostgresTradeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Trade> findById(String tradeId) {
        String sql = """
            SELECT * FROM trades
            WHERE trade_id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tradeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find trade {}: {}", tradeId, e.getMessage());
            throw new RuntimeException("Failed to find trade", e);
        }
        return Optional.empty();
    }

    @Override
    public List<Trade> findAll() {
        return query("""
            SELECT * FROM trades
            ORDER BY created_at, trade_id
            """, "all");
    }

    @Override
    public List<Trade> findOpen() {
        return query("""
            SELECT * FROM trades
            WHERE status = 'OPEN'
            ORDER BY created_at, trade_id
            """, "open");
    }

    @Override
    public List<Trade> findClosed() {
        return query("""
            SELECT * FROM trades
            WHERE status = 'CLOSED'
            ORDER BY closed_at, trade_id
            """, "closed");
    }

    private List<Trade> query(String sql, String label) {
        List<Trade> trades = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                trades.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to find {} trades: {}", label, e.getMessage());
            throw new RuntimeException("Failed to find trades", e);
        }
        return trades;
    }

    @Override
    public int countCreatedSince(Instant since) {
        String sql = """
            SELECT COUNT(*) FROM trades
            WHERE created_at >= ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            log.error("Failed to count trades since {}: {}", since, e.getMessage());
            throw new RuntimeException("Failed to count trades", e);
        }
    }

    @Override
    public void insert(Trade trade) {
        String sql = """
            INSERT INTO trades (
                trade_id, signal_id, symbol, direction,
                entry_price, quantity, stop_loss, take_profit,
                strategy, mode, status, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, trade.tradeId());
            ps.setString(2, trade.signalId());
            ps.setString(3, trade.symbol());
            ps.setString(4, trade.direction().name());
            ps.setBigDecimal(5, trade.entryPrice());
            ps.setBigDecimal(6, trade.quantity());
            ps.setBigDecimal(7, trade.stopLoss());
            ps.setBigDecimal(8, trade.takeProfit());
            ps.setString(9, trade.strategy());
            ps.setString(10, trade.mode().name());
            ps.setString(11, trade.status().name());
            ps.setTimestamp(12, Timestamp.from(trade.createdAt()));

            ps.executeUpdate();
            log.debug("Trade inserted: {}", trade.tradeId());
        } catch (SQLException e) {
            log.error("Failed to insert trade {}: {}", trade.tradeId(), e.getMessage());
            throw new RuntimeException("Failed to insert trade", e);
        }
    }

    @Override
    public boolean closeIfOpen(Trade closed) {
        String sql = """
            UPDATE trades
            SET status = 'CLOSED', exit_price = ?, pnl = ?, closed_at = ?, close_reason = ?
            WHERE trade_id = ? AND status = 'OPEN'
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBigDecimal(1, closed.exitPrice());
            ps.setBigDecimal(2, closed.pnl());
            ps.setTimestamp(3, Timestamp.from(closed.closedAt()));
            ps.setString(4, closed.closeReason().name());
            ps.setString(5, closed.tradeId());

            int rows = ps.executeUpdate();
            if (rows == 0) {
                log.warn("Close skipped, trade not OPEN: {}", closed.tradeId());
            }
            return rows == 1;
        } catch (SQLException e) {
            log.error("Failed to close trade {}: {}", closed.tradeId(), e.getMessage());
            throw new RuntimeException("Failed to close trade", e);
        }
    }

    private Trade mapRow(ResultSet rs) throws SQLException {
        Timestamp closedTs = rs.getTimestamp("closed_at");
        String reason = rs.getString("close_reason");

        return new Trade(
            rs.getString("trade_id"),
            rs.getString("signal_id"),
            rs.getString("symbol"),
            Direction.valueOf(rs.getString("direction")),
            rs.getBigDecimal("entry_price"),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("stop_loss"),
            rs.getBigDecimal("take_profit"),
            rs.getString("strategy"),
            TradingMode.valueOf(rs.getString("mode")),
            TradeStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getBigDecimal("exit_price"),
            rs.getBigDecimal("pnl"),
            closedTs != null ? closedTs.toInstant() : null,
            reason != null ? CloseReason.valueOf(reason) : null
        );
    }
}
