package io.cloudapis.client;

import io.cloudapis.core.exception.CloudApiException;

import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Client configuration: region, optional endpoint override and optional per-request timeout.
 *
 * <p>Immutable. Build one with {@link #builder()}, from option keys with {@link #create(Map)}, or
 * from the process environment with {@link #fromEnvironment()}.
 */
public final class Configuration {

    public static final String DEFAULT_REGION = "us-east-1";

    public static final String OPTION_REGION = "region";
    public static final String OPTION_ENDPOINT = "endpoint";
    public static final String OPTION_TIMEOUT = "timeout";

    static final String ENV_REGION = "AWS_REGION";
    static final String ENV_DEFAULT_REGION = "AWS_DEFAULT_REGION";
    static final String ENV_ENDPOINT = "AWS_ENDPOINT_URL";

    private static final Set<String> OPTIONS = Set.of(OPTION_REGION, OPTION_ENDPOINT, OPTION_TIMEOUT);

    private final String region;
    private final URI endpoint;
    private final Duration timeout;

    private Configuration(Builder builder) {
        this.region = builder.region == null || builder.region.isBlank() ? DEFAULT_REGION : builder.region;
        this.endpoint = builder.endpoint;
        this.timeout = builder.timeout;
    }

    public static Configuration defaults() {
        return builder().build();
    }

    /**
     * Builds a configuration from option keys ({@code region}, {@code endpoint}, {@code timeout} as an
     * ISO-8601 duration).
     *
     * @throws CloudApiException.InvalidArgument for an unknown key or an unparseable value
     */
    public static Configuration create(Map<String, String> options) {
        Objects.requireNonNull(options, "options");
        for (String key : options.keySet()) {
            if (!OPTIONS.contains(key)) {
                throw new CloudApiException.InvalidArgument(String.format(
                        "Invalid option \"%s\" passed to \"%s\". Known options are \"%s\".",
                        key, Configuration.class.getName(), String.join("\", \"", OPTIONS.stream().sorted().toList())));
            }
        }
        Builder builder = builder().region(options.get(OPTION_REGION));
        String endpoint = options.get(OPTION_ENDPOINT);
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpoint(parseEndpoint(endpoint));
        }
        String timeout = options.get(OPTION_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            try {
                builder.timeout(Duration.parse(timeout.trim()));
            } catch (DateTimeParseException e) {
                throw new CloudApiException.InvalidArgument("Invalid timeout \"" + timeout + "\"", e);
            }
        }
        return builder.build();
    }

    public static Configuration fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads {@code AWS_REGION} (falling back to {@code AWS_DEFAULT_REGION}) and {@code AWS_ENDPOINT_URL}.
     */
    public static Configuration fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String region = env.get(ENV_REGION);
        if (region == null || region.isBlank()) {
            region = env.get(ENV_DEFAULT_REGION);
        }
        Builder builder = builder().region(region);
        String endpoint = env.get(ENV_ENDPOINT);
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpoint(parseEndpoint(endpoint));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().region(region).endpoint(endpoint).timeout(timeout);
    }

    public String region() {
        return region;
    }

    public Optional<URI> endpoint() {
        return Optional.ofNullable(endpoint);
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * Returns the endpoint for a service: the override if one is set, otherwise
     * {@code https://<endpointPrefix>.<region>.amazonaws.com}.
     *
     * @param endpointPrefix the service's host prefix, e.g. {@code sqs}
     * @param regionOverride per-request region, or null to use the configured one
     */
    public URI resolveEndpoint(String endpointPrefix, String regionOverride) {
        if (endpoint != null) {
            return endpoint;
        }
        String effective = regionOverride == null || regionOverride.isBlank() ? region : regionOverride;
        return URI.create("https://" + endpointPrefix + "." + effective + ".amazonaws.com");
    }

    private static URI parseEndpoint(String value) {
        try {
            URI uri = URI.create(value.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new CloudApiException.InvalidArgument("Endpoint \"" + value + "\" must be an absolute http(s) URL");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new CloudApiException.InvalidArgument("Invalid endpoint \"" + value + "\"", e);
        }
    }

    @Override
    public String toString() {
        return "Configuration{region=" + region + ", endpoint=" + endpoint + ", timeout=" + timeout + "}";
    }

    public static final class Builder {
        private String region;
        private URI endpoint;
        private Duration timeout;

        private Builder() {}

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Configuration build() {
            return new Configuration(this);
        }
    }
}
