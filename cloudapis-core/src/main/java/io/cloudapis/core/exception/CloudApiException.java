package io.cloudapis.core.exception;

/**
 * Base class for all exceptions raised by the service clients.
 *
 * <p>Local faults (invalid input, unreadable responses) are nested here. Faults reported by a
 * service extend {@link HttpException}; transport failures extend {@link NetworkException}.
 */
public abstract class CloudApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected CloudApiException(String message) {
        super(message);
    }

    protected CloudApiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an input or configuration value is rejected before any request is sent.
     */
    public static class InvalidArgument extends CloudApiException {
        private static final long serialVersionUID = 1L;

        public InvalidArgument(String message) {
            super(message);
        }

        public InvalidArgument(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised by {@code request()} when a required field is unset.
     */
    public static class MissingRequiredField extends InvalidArgument {
        private static final long serialVersionUID = 1L;

        private final String field;
        private final String owner;

        public MissingRequiredField(String field, Class<?> owner) {
            super(String.format("Missing parameter \"%s\" for \"%s\". The value cannot be null.", field, owner.getName()));
            this.field = field;
            this.owner = owner.getName();
        }

        /** Wire name of the missing field. */
        public String field() {
            return field;
        }

        /** Fully qualified name of the type declaring the field. */
        public String owner() {
            return owner;
        }
    }

    /**
     * Raised by {@code request()} when an enum-constrained field holds a value outside its set.
     */
    public static class InvalidEnumValue extends InvalidArgument {
        private static final long serialVersionUID = 1L;

        private final String field;
        private final String value;
        private final String enumType;

        public InvalidEnumValue(String field, String value, Class<?> enumType, Class<?> owner) {
            super(String.format("Invalid parameter \"%s\" for \"%s\". The value \"%s\" is not a valid \"%s\".",
                    field, owner.getName(), value, enumType.getSimpleName()));
            this.field = field;
            this.value = value;
            this.enumType = enumType.getSimpleName();
        }

        public String field() {
            return field;
        }

        public String value() {
            return value;
        }

        public String enumType() {
            return enumType;
        }
    }

    /**
     * Raised when a response body cannot be hydrated (invalid JSON, unreadable timestamp, wrong shape).
     */
    public static class MalformedResponse extends CloudApiException {
        private static final long serialVersionUID = 1L;

        public MalformedResponse(String message) {
            super(message);
        }

        public MalformedResponse(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
