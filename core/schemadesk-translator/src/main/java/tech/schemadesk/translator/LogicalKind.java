package tech.schemadesk.translator;

import java.util.Arrays;
import java.util.Optional;

/**
 * Avro logical types rendered as format-tagged strings.
 *
 * <p>Logical types not listed here (decimal, duration, local timestamps) keep the
 * mapping of their underlying primitive.
 */
public enum LogicalKind {
    DATE("date", "date", "2024-01-01"),
    TIMESTAMP_MILLIS("timestamp-millis", "date-time", "2024-01-01T12:00:00Z"),
    TIMESTAMP_MICROS("timestamp-micros", "date-time", "2024-01-01T12:00:00Z"),
    TIME_MILLIS("time-millis", "time", "12:00:00"),
    TIME_MICROS("time-micros", "time", "12:00:00"),
    UUID("uuid", "uuid", "123e4567-e89b-12d3-a456-426614174000");

    private final String tag;
    private final String format;
    private final String example;

    LogicalKind(String tag, String format, String example) {
        this.tag = tag;
        this.format = format;
        this.example = example;
    }

    public static Optional<LogicalKind> fromTag(String tag) {
        return Arrays.stream(values())
            .filter(kind -> kind.tag.equals(tag))
            .findFirst();
    }

    public String format() {
        return format;
    }

    public String example() {
        return example;
    }
}
