package in.smcdesk.application.service;

import in.smcdesk.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ActiveTradeIndex - symbol → open trade ids, for price-driven exits.
 *
 * Rebuilt from the repository on startup, then updated on every open and
 * close. Safe for updates from multiple coordinator partitions.
 */
public final class ActiveTradeIndex {
    private static final Logger log = LoggerFactory.getLogger(ActiveTradeIndex.class);

    // symbol → open trade ids
    private final Map<String, Set<String>> symbolToTrades = new ConcurrentHashMap<>();

    // tradeId → symbol for removal
    private final Map<String, String> tradeToSymbol = new ConcurrentHashMap<>();

    public void rebuild(List<Trade> openTrades) {
        symbolToTrades.clear();
        tradeToSymbol.clear();

        for (Trade trade : openTrades) {
            if (trade.isOpen()) {
                addTrade(trade.tradeId(), trade.symbol());
            }
        }

        log.info("ActiveTradeIndex rebuilt: {} symbols, {} open trades",
            symbolToTrades.size(), tradeToSymbol.size());
    }

    public void addTrade(String tradeId, String symbol) {
        symbolToTrades.computeIfAbsent(symbol, k -> ConcurrentHashMap.newKeySet()).add(tradeId);
        tradeToSymbol.put(tradeId, symbol);
        log.debug("Trade added to index: {} → {}", tradeId, symbol);
    }

    public void removeTrade(String tradeId) {
        String symbol = tradeToSymbol.remove(tradeId);
        if (symbol != null) {
            symbolToTrades.computeIfPresent(symbol, (k, trades) -> {
                trades.remove(tradeId);
                return trades.isEmpty() ? null : trades;
            });
            log.debug("Trade removed from index: {} (was {})", tradeId, symbol);
        }
    }

    /**
     * Snapshot of the open trade ids for a symbol; never null.
     */
    public Set<String> getOpenTrades(String symbol) {
        Set<String> trades = symbolToTrades.get(symbol);
        return trades != null ? new HashSet<>(trades) : Collections.emptySet();
    }

    public boolean contains(String tradeId) {
        return tradeToSymbol.containsKey(tradeId);
    }

    public int size() {
        return tradeToSymbol.size();
    }

    public int symbolCount() {
        return symbolToTrades.size();
    }
}
