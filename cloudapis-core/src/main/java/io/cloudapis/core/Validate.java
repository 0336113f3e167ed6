package io.cloudapis.core;

import io.cloudapis.core.exception.CloudApiException;

/**
 * Checks applied while an input is being serialized. Nothing here runs at construction time.
 */
public final class Validate {
    private Validate() {}

    /**
     * @return {@code value} if set
     * @throws CloudApiException.MissingRequiredField if {@code value} is null
     */
    public static <T> T required(T value, String field, Class<?> owner) {
        if (value == null) {
            throw new CloudApiException.MissingRequiredField(field, owner);
        }
        return value;
    }

    /**
     * @return {@code value} if it is a member of {@code type}
     * @throws CloudApiException.InvalidEnumValue otherwise
     */
    public static <E extends Enum<E> & WireEnum> String member(String value, Class<E> type, String field, Class<?> owner) {
        if (!WireEnum.exists(type, value)) {
            throw new CloudApiException.InvalidEnumValue(field, value, type, owner);
        }
        return value;
    }
}
