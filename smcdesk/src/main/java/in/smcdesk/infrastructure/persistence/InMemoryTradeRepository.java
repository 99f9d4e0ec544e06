package in.smcdesk.infrastructure.persistence;

import in.smcdesk.application.port.output.TradeRepository;
import in.smcdesk.domain.trade.Trade;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local trade store. Insertion order is kept for listing.
 */
public final class InMemoryTradeRepository implements TradeRepository {

    private final ConcurrentHashMap<String, Trade> trades = new ConcurrentHashMap<>();

    @Override
    public Optional<Trade> findById(String tradeId) {
        return Optional.ofNullable(trades.get(tradeId));
    }

    @Override
    public List<Trade> findAll() {
        List<Trade> all = new ArrayList<>(trades.values());
        all.sort(Comparator.comparing(Trade::createdAt).thenComparing(Trade::tradeId));
        return all;
    }

    @Override
    public List<Trade> findOpen() {
        return findAll().stream().filter(Trade::isOpen).toList();
    }

    @Override
    public List<Trade> findClosed() {
        List<Trade> closed = new ArrayList<>(trades.values().stream().filter(Trade::isClosed).toList());
        closed.sort(Comparator.comparing(Trade::closedAt).thenComparing(Trade::tradeId));
        return closed;
    }

    @Override
    public int countCreatedSince(Instant since) {
        return (int) trades.values().stream().filter(t -> !t.createdAt().isBefore(since)).count();
    }

    @Override
    public void insert(Trade trade) {
        if (trades.putIfAbsent(trade.tradeId(), trade) != null) {
            throw new IllegalStateException("Trade already exists: " + trade.tradeId());
        }
    }

    @Override
    public boolean closeIfOpen(Trade closed) {
        boolean[] applied = {false};
        trades.computeIfPresent(closed.tradeId(), (id, current) -> {
            if (current.isOpen()) {
                applied[0] = true;
                return closed;
            }
            return current;
        });
        return applied[0];
    }
}
