package in.smcdesk.security;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Validation of request inputs before they reach the desk services.
 *
 * Validation Rules:
 * - Symbols: upper-case alphanumerics with limited separators (: - _ / .),
 *   e.g. BTC/USD, EURUSD, NSE:SBIN-EQ
 * - Quantities: positive decimals, max 1,000,000
 * - Prices: positive decimals, max 100,000,000, at most 10 decimal places
 * - Names (strategy, ids): a-z, A-Z, 0-9, _ and -
 */
public class InputValidator {

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9_:./-]+$");
    private static final Pattern ALPHANUMERIC_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private static final Pattern SQL_INJECTION_PATTERN =
        Pattern.compile(".*(--|;|\\bOR\\b|\\bAND\\b|\\bUNION\\b|\\bSELECT\\b|\\bDROP\\b|\\bINSERT\\b|\\bUPDATE\\b|\\bDELETE\\b).*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern XSS_PATTERN =
        Pattern.compile(".*(<script|javascript:|onerror=|onload=|<iframe|<object|<embed).*",
            Pattern.CASE_INSENSITIVE);

    private static final int MAX_SYMBOL_LENGTH = 32;
    private static final int MAX_NAME_LENGTH = 64;
    private static final BigDecimal MAX_QUANTITY = new BigDecimal("1000000");
    private static final BigDecimal MAX_PRICE = new BigDecimal("100000000");
    private static final int MAX_PRICE_SCALE = 10;

    public boolean isValidSymbol(String symbol) {
        if (symbol == null || symbol.isBlank() || symbol.length() > MAX_SYMBOL_LENGTH) {
            return false;
        }
        return SYMBOL_PATTERN.matcher(symbol).matches();
    }

    /**
     * @throws IllegalArgumentException if the symbol is malformed
     */
    public String validateSymbol(String symbol) {
        if (!isValidSymbol(symbol)) {
            throw new IllegalArgumentException("Invalid symbol: " + symbol);
        }
        return symbol;
    }

    /**
     * @throws IllegalArgumentException if not positive or above the maximum
     */
    public void validateQuantity(BigDecimal quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("Quantity cannot be null");
        }
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        if (quantity.compareTo(MAX_QUANTITY) > 0) {
            throw new IllegalArgumentException("Quantity exceeds maximum (" + MAX_QUANTITY + "): " + quantity);
        }
    }

    /**
     * @throws IllegalArgumentException if not positive, too large or too precise
     */
    public void validatePrice(BigDecimal price) {
        if (price == null) {
            throw new IllegalArgumentException("Price cannot be null");
        }
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
        if (price.compareTo(MAX_PRICE) > 0) {
            throw new IllegalArgumentException("Price exceeds maximum (" + MAX_PRICE + "): " + price);
        }
        if (price.stripTrailingZeros().scale() > MAX_PRICE_SCALE) {
            throw new IllegalArgumentException("Price scale must be <= " + MAX_PRICE_SCALE + " decimal places: " + price);
        }
    }

    public boolean isAlphanumeric(String input) {
        if (input == null || input.isBlank() || input.length() > MAX_NAME_LENGTH) {
            return false;
        }
        return ALPHANUMERIC_PATTERN.matcher(input).matches();
    }

    /**
     * @throws IllegalArgumentException if the name has characters outside [a-zA-Z0-9_-]
     */
    public String validateName(String input, String fieldName) {
        if (!isAlphanumeric(input)) {
            throw new IllegalArgumentException("Invalid " + fieldName + ": " + input);
        }
        return input;
    }

    public boolean containsSqlInjection(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        return SQL_INJECTION_PATTERN.matcher(input).matches();
    }

    public boolean containsXss(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        return XSS_PATTERN.matcher(input).matches();
    }

    /**
     * Trim, drop control characters and cap length.
     *
     * @throws SecurityException if an injection pattern is present
     */
    public String validateAndSanitize(String input, String fieldName) {
        if (input == null || input.isBlank()) {
            return input;
        }
        if (containsSqlInjection(input)) {
            throw new SecurityException(fieldName + " contains SQL injection pattern");
        }
        if (containsXss(input)) {
            throw new SecurityException(fieldName + " contains XSS pattern");
        }
        String result = input.trim().replaceAll("[\\p{Cntrl}&&[^\n\t]]", "");
        return result.length() > MAX_NAME_LENGTH ? result.substring(0, MAX_NAME_LENGTH) : result;
    }

    public void validateRange(int value, int min, int max, String fieldName) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                fieldName + " must be between " + min + " and " + max + ": " + value);
        }
    }
}
