package io.cloudapis.core.exception;

/**
 * Raised when the transport fails before a response is available (connection refused, reset, DNS).
 */
public class NetworkException extends CloudApiException {

    private static final long serialVersionUID = 1L;

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the transport gave up waiting for a response.
     */
    public static class Timeout extends NetworkException {
        private static final long serialVersionUID = 1L;

        public Timeout(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
