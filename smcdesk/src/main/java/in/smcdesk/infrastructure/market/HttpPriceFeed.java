package in.smcdesk.infrastructure.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.smcdesk.application.port.output.PriceFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Last-traded-price lookup against an HTTP quote endpoint.
 *
 * GET {baseUrl}?symbol=BTC%2FUSD answering {"symbol":"BTC/USD","price":43000.5}.
 * Timeouts are enforced by LivePriceService; the request timeout here only
 * bounds a hung connection.
 */
public final class HttpPriceFeed implements PriceFeed {
    private static final Logger log = LoggerFactory.getLogger(HttpPriceFeed.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpPriceFeed(String baseUrl, Duration requestTimeout) {
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public BigDecimal fetchPrice(String symbol) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "?symbol=" + URLEncoder.encode(symbol, StandardCharsets.UTF_8)))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            log.warn("[HttpPriceFeed] Quote API HTTP {} for {}", response.statusCode(), symbol);
            throw new IOException("Quote API returned HTTP " + response.statusCode() + " for " + symbol);
        }

        JsonNode json = objectMapper.readTree(response.body());
        JsonNode price = json.get("price");
        if (price == null || price.isNull()) {
            throw new IOException("Quote API response has no price for " + symbol);
        }
        BigDecimal value = price.isNumber() ? price.decimalValue() : new BigDecimal(price.asText());
        if (value.signum() <= 0) {
            throw new IOException("Quote API returned non-positive price " + value + " for " + symbol);
        }
        log.debug("[HttpPriceFeed] {} = {}", symbol, value);
        return value;
    }
}
