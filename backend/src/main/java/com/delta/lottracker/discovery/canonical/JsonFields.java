package com.delta.lottracker.discovery.canonical;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

/**
 * Lenient readers for marketplace payload fields. Every reader takes candidate keys in priority
 * order and returns null when none of them holds a usable value.
 */
final class JsonFields {
    // 2024-05-01, 2024-05-01 18:30:00, 2024-05-01T18:30:00, 2024-05-01T18:30:00Z, ...+00:00
    private static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.ROOT);
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private JsonFields() {
    }

    static JsonNode first(JsonNode node, List<String> keys) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull() && !(value.isTextual() && value.asText().isBlank())) {
                return value;
            }
        }
        return null;
    }

    static String text(JsonNode node, List<String> keys) {
        JsonNode value = first(node, keys);
        if (value == null) {
            return null;
        }
        if (value.isObject()) {
            JsonNode name = value.get("name");
            return name == null || !name.isValueNode() ? null : blankToNull(name.asText());
        }
        if (value.isIntegralNumber()) {
            return value.bigIntegerValue().toString();
        }
        if (value.isNumber()) {
            BigDecimal decimal = value.decimalValue().stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
        }
        if (!value.isValueNode()) {
            return null;
        }
        return blankToNull(value.asText());
    }

    static BigDecimal decimal(JsonNode node, List<String> keys) {
        JsonNode value = first(node, keys);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (!value.isTextual()) {
            return null;
        }
        String cleaned = value.asText().replace("$", "").replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Integer integer(JsonNode node, List<String> keys) {
        BigDecimal value = decimal(node, keys);
        if (value == null) {
            return null;
        }
        try {
            return value.toBigInteger().intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    static Boolean bool(JsonNode node, List<String> keys) {
        JsonNode value = first(node, keys);
        if (value == null) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0.0;
        }
        String text = value.asText().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "1", "true", "yes", "y", "open" -> true;
            case "0", "false", "no", "n", "closed" -> false;
            default -> null;
        };
    }

    static Instant instant(JsonNode node, List<String> keys, ZoneId zone) {
        JsonNode value = first(node, keys);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return fromEpoch(value.asLong());
        }
        if (!value.isTextual()) {
            return null;
        }
        String text = value.asText().trim();
        if (text.chars().allMatch(Character::isDigit)) {
            try {
                return fromEpoch(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            TemporalAccessor parsed = FLEXIBLE.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            if (parsed instanceof LocalDateTime local) {
                return local.atZone(zone).toInstant();
            }
            return ((LocalDate) parsed).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static Instant fromEpoch(long value) {
        if (value <= 0) {
            return null;
        }
        try {
            return value >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
