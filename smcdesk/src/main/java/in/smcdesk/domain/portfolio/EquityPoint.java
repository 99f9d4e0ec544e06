package in.smcdesk.domain.portfolio;

import java.math.BigDecimal;
import java.time.Instant;

public record EquityPoint(Instant timestamp, BigDecimal equity) {
}
