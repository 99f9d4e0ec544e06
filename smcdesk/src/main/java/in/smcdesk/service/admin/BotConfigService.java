package in.smcdesk.service.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.smcdesk.config.BotConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Supplier;

/**
 * Bot configuration held as one immutable value and persisted as JSON.
 *
 * Readers get whichever complete value was current when they asked; an
 * update replaces the whole value.
 */
public final class BotConfigService implements Supplier<BotConfig> {
    private static final Logger log = LoggerFactory.getLogger(BotConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String FILE_NAME = "bot-config.json";

    private final Path configFilePath;
    private volatile BotConfig currentConfig;

    public BotConfigService(String configDir) {
        this.configFilePath = Paths.get(configDir, FILE_NAME);
        this.currentConfig = loadConfig();
    }

    /**
     * Never null; defaults when no file exists.
     */
    public BotConfig getConfig() {
        return currentConfig;
    }

    @Override
    public BotConfig get() {
        return currentConfig;
    }

    /**
     * Validate, persist, then publish.
     *
     * @throws IllegalArgumentException if config is invalid
     * @throws IOException if save fails
     */
    public synchronized void updateConfig(BotConfig newConfig) throws IOException {
        if (newConfig == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        if (!newConfig.isValid()) {
            throw new IllegalArgumentException("Invalid configuration values");
        }

        saveConfig(newConfig);
        this.currentConfig = newConfig;

        log.info("Bot configuration updated: enabled={} riskPerTrade={} maxDailyTrades={} autoExecute={} minRR={}",
            newConfig.enabled(), newConfig.riskPerTrade(), newConfig.maxDailyTrades(),
            newConfig.autoExecute(), newConfig.minRiskReward());
    }

    private BotConfig loadConfig() {
        try {
            if (Files.exists(configFilePath)) {
                BotConfig config = MAPPER.readValue(Files.readString(configFilePath), BotConfig.class);
                if (!config.isValid()) {
                    log.warn("Invalid bot config in {}, using defaults", configFilePath);
                    return BotConfig.defaults();
                }
                log.info("Loaded bot config from: {}", configFilePath);
                return config;
            }
            log.info("No config file found, using defaults: {}", configFilePath);
            return BotConfig.defaults();
        } catch (IOException e) {
            log.error("Failed to load config file, using defaults: {}", e.getMessage());
            return BotConfig.defaults();
        }
    }

    private void saveConfig(BotConfig config) throws IOException {
        Files.createDirectories(configFilePath.getParent());
        String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configFilePath, json);
        log.info("Configuration saved to: {}", configFilePath);
    }
}
