package sh.harold.uodm.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts ISO-8601 durations ({@code PT0.25S}) as well as {@code 250ms}, {@code 2s}, {@code 1m}
 * and bare numbers, which are read as milliseconds.
 */
final class DurationDeserializer extends StdDeserializer<Duration> {

    private static final Pattern SUFFIXED = Pattern.compile("(\\d+)\\s*(ms|s|m)?");

    DurationDeserializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        String raw = parser.getValueAsString();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        raw = raw.trim();
        Matcher matcher = SUFFIXED.matcher(raw);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            String unit = matcher.group(2);
            if (unit == null || unit.equals("ms")) {
                return Duration.ofMillis(amount);
            }
            return unit.equals("s") ? Duration.ofSeconds(amount) : Duration.ofMinutes(amount);
        }
        try {
            return Duration.parse(raw);
        } catch (DateTimeParseException exception) {
            throw context.weirdStringException(raw, Duration.class, "Unrecognized duration format");
        }
    }
}
