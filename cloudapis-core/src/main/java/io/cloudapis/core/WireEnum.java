package io.cloudapis.core;

import java.util.Optional;

/**
 * A closed set of string values fixed by a service contract.
 *
 * <p>Inputs and outputs carry enum-typed fields as plain strings. The enum type is the single place
 * that knows the member values; use {@link #exists(Class, String)} to check membership.
 */
public interface WireEnum {

    /**
     * The value exactly as it appears on the wire.
     */
    String value();

    static <E extends Enum<E> & WireEnum> boolean exists(Class<E> type, String value) {
        return find(type, value).isPresent();
    }

    static <E extends Enum<E> & WireEnum> Optional<E> find(Class<E> type, String value) {
        if (value == null) return Optional.empty();
        for (E constant : type.getEnumConstants()) {
            if (constant.value().equals(value)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
