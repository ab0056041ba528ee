package work.lcod.markup.shared;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations such as {@code 250ms}, {@code 5s}, {@code 1.5s} or {@code 2m}.
 * A bare number is read as seconds, matching the {@code timeout_seconds} wording of the sandbox API.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long unitMillis = 1_000L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            unitMillis = 1L;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 3_600_000L;
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        long millis = amount.multiply(BigDecimal.valueOf(unitMillis)).longValue();
        return Optional.of(Duration.ofMillis(millis));
    }

    public static Duration ofSeconds(double seconds) {
        if (Double.isNaN(seconds) || seconds < 0) {
            throw new IllegalArgumentException("Timeout must be a non-negative number of seconds: " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }

    public static String toSecondsLabel(Duration duration) {
        return BigDecimal.valueOf(duration.toMillis()).movePointLeft(3).stripTrailingZeros().toPlainString();
    }
}
