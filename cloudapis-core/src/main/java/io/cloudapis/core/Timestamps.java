package io.cloudapis.core;

import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.json.spi.JsonNode;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Parses wire timestamps. JSON protocols send epoch seconds as a number, possibly fractional;
 * some REST shapes send ISO-8601 text, with either {@code Z}, {@code +00:00} or {@code +0000} offsets.
 */
public final class Timestamps {
    private Timestamps() {}

    private static final DateTimeFormatter COMPACT_OFFSET = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss[.SSS]Z");

    private static final List<Function<String, Instant>> TEXT_PARSERS = List.of(
            Instant::parse,
            v -> OffsetDateTime.parse(v).toInstant(),
            v -> OffsetDateTime.parse(v, COMPACT_OFFSET).toInstant());

    /**
     * @param node a JSON number or string; null or JSON null yields null
     * @throws CloudApiException.MalformedResponse if the value is neither a number of seconds nor ISO-8601 text
     */
    public static Instant parse(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return fromEpochSeconds(node.asText());
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        throw new CloudApiException.MalformedResponse("Expected a timestamp, got " + node.getNodeType());
    }

    public static Instant parse(String text) {
        if (text == null) {
            return null;
        }
        String value = text.trim();
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : TEXT_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new CloudApiException.MalformedResponse("Invalid timestamp \"" + text + "\"", last);
    }

    private static Instant fromEpochSeconds(String number) {
        try {
            BigDecimal seconds = new BigDecimal(number);
            long whole = seconds.toBigInteger().longValueExact();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            throw new CloudApiException.MalformedResponse("Invalid epoch timestamp \"" + number + "\"", e);
        }
    }
}
