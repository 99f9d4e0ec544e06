package in.smcdesk.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputValidator request validations.
 */
@DisplayName("Input Validator Tests")
public class InputValidatorTest {

    private InputValidator validator;

    @BeforeEach
    public void setUp() {
        validator = new InputValidator();
    }

    @Test
    @DisplayName("Valid symbols pass validation")
    public void testValidSymbols() {
        assertTrue(validator.isValidSymbol("BTC/USD"));
        assertTrue(validator.isValidSymbol("EURUSD"));
        assertTrue(validator.isValidSymbol("NSE:SBIN-EQ"));
        assertTrue(validator.isValidSymbol("ES_F.2024"));
        assertEquals("XAU/USD", validator.validateSymbol("XAU/USD"));
    }

    @Test
    @DisplayName("Invalid symbols fail validation")
    public void testInvalidSymbols() {
        assertFalse(validator.isValidSymbol(null));
        assertFalse(validator.isValidSymbol(""));
        assertFalse(validator.isValidSymbol("   "));
        assertFalse(validator.isValidSymbol("btc/usd"));
        assertFalse(validator.isValidSymbol("BTC<script>"));
        assertFalse(validator.isValidSymbol("BTC'; DROP TABLE--"));
        assertFalse(validator.isValidSymbol("A".repeat(33)));
        assertThrows(IllegalArgumentException.class, () -> validator.validateSymbol("BTC USD"));
    }

    @Test
    @DisplayName("Valid quantities pass")
    public void testValidQuantities() {
        assertDoesNotThrow(() -> validator.validateQuantity(new BigDecimal("0.001")));
        assertDoesNotThrow(() -> validator.validateQuantity(new BigDecimal("1")));
        assertDoesNotThrow(() -> validator.validateQuantity(new BigDecimal("1000000")));
    }

    @Test
    @DisplayName("Invalid quantities throw exception")
    public void testInvalidQuantities() {
        assertThrows(IllegalArgumentException.class, () -> validator.validateQuantity(null));
        assertThrows(IllegalArgumentException.class, () -> validator.validateQuantity(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> validator.validateQuantity(new BigDecimal("-1")));
        assertThrows(IllegalArgumentException.class, () -> validator.validateQuantity(new BigDecimal("1000001")));
    }

    @Test
    @DisplayName("Valid prices pass")
    public void testValidPrices() {
        assertDoesNotThrow(() -> validator.validatePrice(new BigDecimal("100.50")));
        assertDoesNotThrow(() -> validator.validatePrice(new BigDecimal("0.0000012345")));
        assertDoesNotThrow(() -> validator.validatePrice(new BigDecimal("65000.1000000000000")));
    }

    @Test
    @DisplayName("Invalid prices throw exception")
    public void testInvalidPrices() {
        assertThrows(IllegalArgumentException.class, () -> validator.validatePrice(null));
        assertThrows(IllegalArgumentException.class, () -> validator.validatePrice(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> validator.validatePrice(new BigDecimal("-1")));
        assertThrows(IllegalArgumentException.class,
            () -> validator.validatePrice(new BigDecimal("100000001")));
        assertThrows(IllegalArgumentException.class,
            () -> validator.validatePrice(new BigDecimal("1.00000000001"))); // 11 decimal places
    }

    @Test
    @DisplayName("Names accept only alphanumerics, dash and underscore")
    public void testNames() {
        assertEquals("smc", validator.validateName("smc", "strategy"));
        assertEquals("order_block-v2", validator.validateName("order_block-v2", "strategy"));
        assertThrows(IllegalArgumentException.class, () -> validator.validateName("smc v2", "strategy"));
        assertThrows(IllegalArgumentException.class, () -> validator.validateName(null, "strategy"));
        assertThrows(IllegalArgumentException.class, () -> validator.validateName("a".repeat(65), "strategy"));
    }

    @Test
    @DisplayName("SQL injection patterns detected")
    public void testSqlInjectionDetection() {
        assertTrue(validator.containsSqlInjection("'; DROP TABLE trades--"));
        assertTrue(validator.containsSqlInjection("1 OR 1=1"));
        assertTrue(validator.containsSqlInjection("UNION SELECT * FROM"));
        assertTrue(validator.containsSqlInjection("admin'--"));

        assertFalse(validator.containsSqlInjection("normal text"));
        assertFalse(validator.containsSqlInjection("BTC/USD"));
        assertFalse(validator.containsSqlInjection(null));
    }

    @Test
    @DisplayName("XSS patterns detected")
    public void testXssDetection() {
        assertTrue(validator.containsXss("<script>alert('XSS')</script>"));
        assertTrue(validator.containsXss("javascript:alert(1)"));
        assertTrue(validator.containsXss("<img onerror='alert(1)'>"));
        assertTrue(validator.containsXss("<iframe src='evil.com'>"));

        assertFalse(validator.containsXss("normal text"));
        assertFalse(validator.containsXss("EURUSD"));
    }

    @Test
    @DisplayName("Validate and sanitize throws on dangerous input")
    public void testValidateAndSanitizeThrows() {
        assertThrows(SecurityException.class,
            () -> validator.validateAndSanitize("'; DROP TABLE--", "reason"));
        assertThrows(SecurityException.class,
            () -> validator.validateAndSanitize("<script>alert(1)</script>", "reason"));
    }

    @Test
    @DisplayName("Validate and sanitize trims and caps clean input")
    public void testValidateAndSanitizeAccepts() {
        assertEquals("manual exit", validator.validateAndSanitize("  manual exit  ", "reason"));
        assertEquals("hello", validator.validateAndSanitize("hello\u0000", "reason"));
        assertEquals(64, validator.validateAndSanitize("a".repeat(200), "reason").length());
        assertNull(validator.validateAndSanitize(null, "reason"));
    }

    @Test
    @DisplayName("Range validation")
    public void testRange() {
        assertDoesNotThrow(() -> validator.validateRange(1, 1, 500, "limit"));
        assertDoesNotThrow(() -> validator.validateRange(500, 1, 500, "limit"));
        assertThrows(IllegalArgumentException.class, () -> validator.validateRange(0, 1, 500, "limit"));
        assertThrows(IllegalArgumentException.class, () -> validator.validateRange(501, 1, 500, "limit"));
    }
}
