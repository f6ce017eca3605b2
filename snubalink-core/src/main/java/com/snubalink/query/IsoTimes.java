package com.snubalink.query;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Conversions between instants and the timezone-naive UTC timestamps the analytics store speaks.
 */
public final class IsoTimes {

    /** {@code 2020-01-01T00:00:00}, with a six digit fraction only when it is non-zero. */
    private static final DateTimeFormatter NAIVE = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.MICRO_OF_SECOND, 0, 6, true)
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter MICROS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");
    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private IsoTimes() {}

    /**
     * Normalizes any date-time to a UTC instant. A {@link LocalDateTime} carries no zone and is
     * taken to already be UTC.
     */
    public static Instant toUtcInstant(TemporalAccessor value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        throw new IllegalArgumentException("Unsupported date-time type: " + value.getClass().getName());
    }

    public static String formatNaive(Instant instant) {
        LocalDateTime local = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        int micros = local.getNano() / 1_000;
        return micros == 0 ? SECONDS.format(local) : MICROS.format(local);
    }

    /**
     * Parses the datetime strings found in result rows, such as {@code 2020-01-01T00:00:00+00:00}
     * or a naive {@code 2020-01-01T00:00:00}.
     */
    public static Instant parse(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // no offset, read as naive UTC
        }
        try {
            return LocalDateTime.parse(value, NAIVE).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable datetime: " + value, e);
        }
    }

    public static long toEpochSeconds(String value) {
        return parse(value).getEpochSecond();
    }
}
