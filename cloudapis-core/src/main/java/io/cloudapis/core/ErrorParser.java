package io.cloudapis.core;

import io.cloudapis.json.spi.JsonNode;

import java.util.Optional;

/**
 * Extracts the error discriminator and diagnostic fields from a failed JSON response.
 *
 * <p>Lookup order for the code:
 * <ol>
 *   <li>{@code x-amzn-query-error} header, part before {@code ;} (the part after it is the fault type)</li>
 *   <li>{@code x-amzn-ErrorType} header, part before {@code :}</li>
 *   <li>{@code __type} body field, part after the last {@code #}</li>
 *   <li>{@code code} or {@code Code} body field</li>
 *   <li>{@code Type} body field</li>
 * </ol>
 */
public final class ErrorParser {
    private ErrorParser() {}

    public static AwsError parse(Response response) {
        JsonNode body = response.toJsonOrNull();

        String code = null;
        String type = null;

        Optional<String> queryError = response.header(Protocol.H_QUERY_ERROR);
        if (queryError.isPresent() && !queryError.get().isBlank()) {
            String value = queryError.get().trim();
            int semi = value.indexOf(';');
            code = semi >= 0 ? value.substring(0, semi) : value;
            type = semi >= 0 ? emptyToNull(value.substring(semi + 1)) : null;
        }
        if (code == null) {
            code = response.header(Protocol.H_ERROR_TYPE)
                    .map(v -> v.contains(":") ? v.substring(0, v.indexOf(':')) : v)
                    .map(String::trim)
                    .map(ErrorParser::emptyToNull)
                    .orElse(null);
        }
        if (code == null) {
            String discriminator = text(body, Protocol.F_TYPE_DISCRIMINATOR);
            if (discriminator != null) {
                code = emptyToNull(discriminator.substring(discriminator.lastIndexOf('#') + 1));
            }
        }
        if (code == null) {
            code = firstText(body, Protocol.F_CODE, Protocol.F_CODE_UPPER);
        }

        String bodyType = firstText(body, Protocol.F_TYPE, Protocol.F_TYPE_LOWER);
        if (code == null) {
            code = bodyType;
        }
        if (type == null) {
            type = bodyType;
        }

        String message = firstText(body, Protocol.F_MESSAGE, Protocol.F_MESSAGE_UPPER);
        String detail = text(body, Protocol.F_DETAIL);
        return new AwsError(code, type, message, detail, body);
    }

    private static String firstText(JsonNode body, String... names) {
        for (String name : names) {
            String value = text(body, name);
            if (value != null) return value;
        }
        return null;
    }

    private static String text(JsonNode body, String name) {
        if (body == null || !body.isObject()) return null;
        JsonNode node = body.get(name);
        if (node == null || node.isNull() || node.isObject() || node.isArray()) return null;
        return emptyToNull(node.asText());
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
