package com.companya.crm.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Coerces the mixed timestamp formats of upstream systems into one naive (UTC-based)
 * LocalDateTime representation, so that events from different sources sort together.
 */
@Slf4j
public final class TimestampUtils {

    private static final DateTimeFormatter FLEXIBLE_ISO = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private TimestampUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Accepts ISO offset date-times ("2025-03-01T10:00:00-06:00", "...Z"), local date-times
     * ("2025-03-01T10:00:00", "2025-03-01 10:00:00"), plain dates, or epoch milliseconds.
     * Offset values are converted to UTC before dropping the zone.
     *
     * @return the parsed value, or null if the input is blank or unparseable
     */
    public static LocalDateTime toNaive(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime;
        }
        if (value instanceof LocalDate localDate) {
            return localDate.atStartOfDay();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof Number epochMillis) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis.longValue()), ZoneOffset.UTC);
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            TemporalAccessor parsed = FLEXIBLE_ISO.parseBest(text.replace(' ', 'T'),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime;
            }
            return ((LocalDate) parsed).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}': {}", text, e.getMessage());
            return null;
        }
    }
}
