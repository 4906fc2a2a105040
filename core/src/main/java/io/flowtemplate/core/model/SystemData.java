package io.flowtemplate.core.model;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code $system} block of a context. Seeded once, when the context is created, with a
 * {@code datetime} object describing the current instant in UTC:
 *
 * <ul>
 * <li>{@code now} - RFC 3339 timestamp
 * <li>{@code timestamp} - epoch seconds (integer)
 * <li>{@code iso} - {@code yyyy-MM-ddTHH:mm:ssZ}
 * <li>{@code date} - {@code yyyy-MM-dd}
 * <li>{@code time} - {@code HH:mm:ss}
 * </ul>
 */
public final class SystemData {

    private static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Instant capturedAt;
    private final Value root;

    private SystemData(Instant capturedAt, Value root) {
        this.capturedAt = capturedAt;
        this.root = root;
    }

    /** Captures the current instant from {@code clock}. */
    public static SystemData capture(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        Instant now = clock.instant();
        OffsetDateTime utc = OffsetDateTime.ofInstant(now, ZoneOffset.UTC);

        Map<String, Value> datetime = new LinkedHashMap<>();
        datetime.put("now", Value.of(utc.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)));
        datetime.put("timestamp", Value.of(now.getEpochSecond()));
        datetime.put("iso", Value.of(utc.format(ISO)));
        datetime.put("date", Value.of(utc.format(DATE)));
        datetime.put("time", Value.of(utc.format(TIME)));

        return new SystemData(now, Value.object(Map.of("datetime", Value.object(datetime))));
    }

    /** Looks up a dotted path below {@code $system}; the empty path returns the whole block. */
    public Optional<Value> get(String path) {
        return root.navigate(path);
    }

    /** The whole block as an object value. */
    public Value asValue() {
        return root;
    }

    /** The instant the block was seeded with. */
    public Instant capturedAt() {
        return capturedAt;
    }
}
