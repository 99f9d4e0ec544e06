package in.smcdesk.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.smcdesk.config.BotConfig;
import in.smcdesk.service.admin.BotConfigService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static in.smcdesk.transport.http.ApiHandlers.MAPPER;

/**
 * HTTP handler for bot configuration.
 *
 * - GET /api/bot/config - current configuration
 * - POST /api/bot/config - update; fields absent from the body keep their current value
 */
public final class AdminConfigHandler {
    private static final Logger log = LoggerFactory.getLogger(AdminConfigHandler.class);

    private final BotConfigService configService;

    public AdminConfigHandler(BotConfigService configService) {
        this.configService = configService;
    }

    /**
     * GET /api/bot/config
     */
    public void getBotConfig(HttpServerExchange exchange) {
        try {
            JsonNode json = MAPPER.valueToTree(configService.getConfig());
            ApiHandlers.sendJson(exchange, StatusCodes.OK, json);
            log.debug("GET /api/bot/config → 200 OK");
        } catch (Exception e) {
            log.error("Failed to get bot config: {}", e.getMessage(), e);
            ApiHandlers.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Failed to get configuration");
        }
    }

    /**
     * POST /api/bot/config
     */
    public void updateBotConfig(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, requestBody) -> {
            try {
                JsonNode patch = MAPPER.readTree(requestBody);
                if (patch == null || !patch.isObject()) {
                    throw new IllegalArgumentException("Configuration body must be a JSON object");
                }

                ObjectNode merged = MAPPER.valueToTree(configService.getConfig());
                merged.setAll((ObjectNode) patch);
                BotConfig newConfig = MAPPER.treeToValue(merged, BotConfig.class);

                configService.updateConfig(newConfig);

                ObjectNode response = MAPPER.createObjectNode();
                response.put("success", true);
                response.set("config", MAPPER.valueToTree(newConfig));
                ApiHandlers.sendJson(exch, StatusCodes.OK, response);

                log.info("POST /api/bot/config → 200 OK (enabled={}, autoExecute={})",
                    newConfig.enabled(), newConfig.autoExecute());

            } catch (JsonProcessingException e) {
                log.warn("Malformed bot config: {}", e.getOriginalMessage());
                ApiHandlers.sendError(exch, StatusCodes.BAD_REQUEST, "INVALID_CONFIG",
                    "Malformed configuration: " + e.getOriginalMessage());

            } catch (IllegalArgumentException e) {
                log.warn("Invalid configuration: {}", e.getMessage());
                ApiHandlers.sendError(exch, StatusCodes.BAD_REQUEST, "INVALID_CONFIG", e.getMessage());

            } catch (IOException e) {
                log.error("Failed to save configuration: {}", e.getMessage(), e);
                ApiHandlers.sendError(exch, StatusCodes.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                    "Failed to save configuration");
            }
        }, StandardCharsets.UTF_8);
    }
}
