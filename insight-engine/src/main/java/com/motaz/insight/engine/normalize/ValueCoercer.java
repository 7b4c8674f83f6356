package com.motaz.insight.engine.normalize;

import com.motaz.insight.engine.model.FieldType;
import com.motaz.insight.engine.model.FieldValue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-type coercion of untyped raw scalars. Never throws on bad input: an
 * unparseable value comes back as {@link FieldValue#invalid}, a null or blank
 * one as {@link FieldValue#absent}.
 */
@Slf4j
public class ValueCoercer {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "0");

    private final List<DateTimeFormatter> formatters;

    public ValueCoercer(List<String> timestampFormats) {
        this.formatters = timestampFormats.stream()
                .map(pattern -> DateTimeFormatter.ofPattern(pattern, Locale.ROOT))
                .toList();
    }

    public static boolean isMissing(Object raw) {
        return raw == null || (raw instanceof String text && text.isBlank());
    }

    public FieldValue coerce(FieldType type, Object raw) {
        if (isMissing(raw)) {
            return FieldValue.absent(type);
        }
        String rawText = String.valueOf(raw);
        Object value = switch (type) {
            case NUMERIC -> toNumber(raw);
            case BOOLEAN -> toBoolean(raw);
            case TIMESTAMP -> toInstant(raw);
            case CATEGORICAL -> toCategory(raw);
        };
        return value == null ? FieldValue.invalid(type, rawText) : FieldValue.valid(type, value, rawText);
    }

    private static Double toNumber(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        if (raw instanceof String text) {
            String trimmed = text.trim();
            if (!NUMBER.matcher(trimmed).matches()) {
                return null;
            }
            double value = Double.parseDouble(trimmed);
            return Double.isFinite(value) ? value : null;
        }
        return null;
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        String word = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        if (raw instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            word = String.valueOf(number.longValue());
        }
        if (TRUE_WORDS.contains(word)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(word)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private Instant toInstant(Object raw) {
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof Number number) {
            double millis = number.doubleValue();
            return millis == Math.rint(millis) && Double.isFinite(millis) ? Instant.ofEpochMilli(number.longValue()) : null;
        }
        String text = String.valueOf(raw).trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.trace("'{}' is not an ISO instant, trying configured patterns", text);
        }
        for (DateTimeFormatter formatter : formatters) {
            try {
                TemporalAccessor parsed = formatter.parseBest(text, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
                if (parsed instanceof ZonedDateTime zoned) {
                    return zoned.toInstant();
                }
                if (parsed instanceof LocalDateTime local) {
                    return local.toInstant(ZoneOffset.UTC);
                }
                return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, formatter);
            }
        }
        return null;
    }

    private static String toCategory(Object raw) {
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            double value = ((Number) raw).doubleValue();
            if (!Double.isFinite(value)) {
                return null;
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
        String text = String.valueOf(raw).trim();
        return text.isEmpty() ? null : text;
    }
}
