package in.smcdesk.application.port.output;

import in.smcdesk.domain.trade.Trade;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only trade store. Closed trades are never modified.
 */
public interface TradeRepository {

    Optional<Trade> findById(String tradeId);

    List<Trade> findAll();

    /**
     * Open trades, oldest first.
     */
    List<Trade> findOpen();

    /**
     * Closed trades ordered by close time, oldest first.
     */
    List<Trade> findClosed();

    /**
     * Number of trades created at or after the given instant.
     */
    int countCreatedSince(Instant since);

    /**
     * Insert a new OPEN trade.
     *
     * @throws IllegalStateException if a trade with the same id exists
     */
    void insert(Trade trade);

    /**
     * Conditional OPEN → CLOSED transition.
     *
     * Replaces the stored trade with {@code closed} only when the stored
     * status is still OPEN.
     *
     * @return true when the transition was applied, false when the trade was
     *         already closed
     */
    boolean closeIfOpen(Trade closed);
}
