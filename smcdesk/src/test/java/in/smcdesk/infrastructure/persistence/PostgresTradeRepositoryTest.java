package in.smcdesk.infrastructure.persistence;

import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.TradingMode;
import in.smcdesk.domain.trade.CloseReason;
import in.smcdesk.domain.trade.Trade;
import in.smcdesk.domain.trade.TradeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Postgres Trade Repository Tests")
public class PostgresTradeRepositoryTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T09:00:00Z");
    private static final Instant CLOSED = Instant.parse("2024-03-01T11:30:00Z");

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    private PostgresTradeRepository repository;

    @BeforeEach
    public void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        repository = new PostgresTradeRepository(dataSource);
    }

    @Test
    @DisplayName("Insert binds every column of an open trade")
    public void testInsert() throws SQLException {
        Trade trade = Trade.open("t-1", "sig-1", "BTC/USD", Direction.SELL, new BigDecimal("100"),
            new BigDecimal("2"), new BigDecimal("105"), new BigDecimal("90"), "smc", TradingMode.SWING, CREATED);

        repository.insert(trade);

        verify(statement).setString(1, "t-1");
        verify(statement).setString(2, "sig-1");
        verify(statement).setString(3, "BTC/USD");
        verify(statement).setString(4, "SELL");
        verify(statement).setBigDecimal(5, new BigDecimal("100"));
        verify(statement).setBigDecimal(6, new BigDecimal("2"));
        verify(statement).setBigDecimal(7, new BigDecimal("105"));
        verify(statement).setBigDecimal(8, new BigDecimal("90"));
        verify(statement).setString(9, "smc");
        verify(statement).setString(10, "SWING");
        verify(statement).setString(11, "OPEN");
        verify(statement).setTimestamp(12, Timestamp.from(CREATED));
        verify(statement).executeUpdate();
        verify(connection).close();
    }

    @Test
    @DisplayName("Conditional close reports whether a row changed")
    public void testCloseIfOpen() throws SQLException {
        Trade closed = openTrade().withClose(new BigDecimal("110"), CloseReason.TAKE_PROFIT, CLOSED);
        when(statement.executeUpdate()).thenReturn(1, 0);

        assertTrue(repository.closeIfOpen(closed));
        assertFalse(repository.closeIfOpen(closed));

        verify(connection, times(2)).prepareStatement(contains("WHERE trade_id = ? AND status = 'OPEN'"));
        verify(statement, times(2)).setBigDecimal(1, new BigDecimal("110"));
        verify(statement, times(2)).setBigDecimal(2, new BigDecimal("10"));
        verify(statement, times(2)).setString(4, "TAKE_PROFIT");
        verify(statement, times(2)).setString(5, "t-1");
    }

    @Test
    @DisplayName("Closed row maps back to a closed trade")
    public void testFindClosedRow() throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        stubRow("CLOSED", new BigDecimal("110"), new BigDecimal("10"), Timestamp.from(CLOSED), "TAKE_PROFIT");

        Optional<Trade> found = repository.findById("t-1");

        Trade trade = found.orElseThrow();
        assertEquals(TradeStatus.CLOSED, trade.status());
        assertEquals(CLOSED, trade.closedAt());
        assertEquals(CloseReason.TAKE_PROFIT, trade.closeReason());
        assertEquals(new BigDecimal("10"), trade.pnl());
        verify(statement).setString(1, "t-1");
    }

    @Test
    @DisplayName("Open rows keep null close fields")
    public void testFindOpen() throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);
        stubRow("OPEN", null, null, null, null);

        List<Trade> open = repository.findOpen();

        assertEquals(1, open.size());
        assertTrue(open.get(0).isOpen());
        assertNull(open.get(0).closedAt());
        assertNull(open.get(0).closeReason());
    }

    @Test
    @DisplayName("Missing trade")
    public void testFindMissing() throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        assertTrue(repository.findById("missing").isEmpty());
    }

    @Test
    @DisplayName("Count binds the lower bound")
    public void testCountCreatedSince() throws SQLException {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getInt(1)).thenReturn(3);

        assertEquals(3, repository.countCreatedSince(CREATED));
        verify(statement).setTimestamp(1, Timestamp.from(CREATED));
    }

    @Test
    @DisplayName("SQL failures surface as runtime exceptions")
    public void testSqlFailure() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("connection reset"));

        RuntimeException e = assertThrows(RuntimeException.class, () -> repository.findAll());
        assertInstanceOf(SQLException.class, e.getCause());
    }

    private void stubRow(String status, BigDecimal exit, BigDecimal pnl, Timestamp closedAt, String reason)
            throws SQLException {
        when(resultSet.getString("trade_id")).thenReturn("t-1");
        when(resultSet.getString("signal_id")).thenReturn(null);
        when(resultSet.getString("symbol")).thenReturn("BTC/USD");
        when(resultSet.getString("direction")).thenReturn("BUY");
        when(resultSet.getBigDecimal("entry_price")).thenReturn(new BigDecimal("100"));
        when(resultSet.getBigDecimal("quantity")).thenReturn(BigDecimal.ONE);
        when(resultSet.getBigDecimal("stop_loss")).thenReturn(new BigDecimal("95"));
        when(resultSet.getBigDecimal("take_profit")).thenReturn(new BigDecimal("110"));
        when(resultSet.getString("strategy")).thenReturn("smc");
        when(resultSet.getString("mode")).thenReturn("INTRADAY");
        when(resultSet.getString("status")).thenReturn(status);
        when(resultSet.getTimestamp("created_at")).thenReturn(Timestamp.from(CREATED));
        when(resultSet.getBigDecimal("exit_price")).thenReturn(exit);
        when(resultSet.getBigDecimal("pnl")).thenReturn(pnl);
        when(resultSet.getTimestamp("closed_at")).thenReturn(closedAt);
        when(resultSet.getString("close_reason")).thenReturn(reason);
    }

    private static Trade openTrade() {
        return Trade.open("t-1", null, "BTC/USD", Direction.BUY, new BigDecimal("100"), BigDecimal.ONE,
            new BigDecimal("95"), new BigDecimal("110"), "smc", TradingMode.INTRADAY, CREATED);
    }
}
