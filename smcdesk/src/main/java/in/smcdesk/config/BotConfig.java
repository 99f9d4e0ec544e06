package in.smcdesk.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Trading bot settings. Immutable; updates replace the whole value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BotConfig(
    @JsonProperty("enabled")
    boolean enabled,                 // auto-trading switch

    @JsonProperty("riskPerTrade")
    BigDecimal riskPerTrade,         // fraction of balance risked per trade (0.02 = 2%)

    @JsonProperty("maxDailyTrades")
    int maxDailyTrades,

    @JsonProperty("allowedMarkets")
    List<String> allowedMarkets,     // market type codes, e.g. "crypto"

    @JsonProperty("strategies")
    List<String> strategies,

    @JsonProperty("autoExecute")
    boolean autoExecute,             // open a trade as soon as a signal is generated

    @JsonProperty("minRiskReward")
    BigDecimal minRiskReward,        // RR floor for TP1

    @JsonProperty("reanchorOnConfirm")
    boolean reanchorOnConfirm        // shift SL/TP to the live entry price on confirmation
) {
    public BotConfig {
        allowedMarkets = allowedMarkets == null ? List.of() : List.copyOf(allowedMarkets);
        strategies = strategies == null ? List.of() : List.copyOf(strategies);
    }

    public static BotConfig defaults() {
        return new BotConfig(
            false,
            new BigDecimal("0.02"),
            10,
            List.of("crypto", "forex", "indices", "metals", "futures", "stocks"),
            List.of("smc"),
            false,
            new BigDecimal("2.0"),
            true);
    }

    @JsonIgnore
    public boolean isValid() {
        return riskPerTrade != null
            && riskPerTrade.signum() > 0
            && riskPerTrade.compareTo(BigDecimal.ONE) <= 0
            && maxDailyTrades > 0
            && minRiskReward != null
            && minRiskReward.signum() > 0
            && !strategies.isEmpty();
    }

    /**
     * An empty list allows every market.
     */
    public boolean isMarketAllowed(String marketCode) {
        return allowedMarkets.isEmpty() || allowedMarkets.contains(marketCode);
    }

    public BotConfig withEnabled(boolean value) {
        return new BotConfig(value, riskPerTrade, maxDailyTrades, allowedMarkets, strategies,
            autoExecute, minRiskReward, reanchorOnConfirm);
    }
}
