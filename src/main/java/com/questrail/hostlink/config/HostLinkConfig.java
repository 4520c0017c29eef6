package com.questrail.hostlink.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * HostLinkConfig
 * -----------------------------------------------------------------------------
 * Aggregated configuration for a host link.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>address</b>: host socket server. Defaults to
 *       {@value #DEFAULT_HOST}:{@value #DEFAULT_PORT}.</li>
 *   <li><b>responseTimeout</b>: bound on one round trip (write plus receive).
 *       Defaults to 180 seconds, the host's own processing timeout, so long
 *       host-side work is not cut short.</li>
 *   <li><b>connectTimeout</b>: bound on opening the channel.</li>
 *   <li><b>readChunkSize</b>: maximum bytes taken from the channel per read.</li>
 *   <li><b>healthCheckCommand</b>: command issued to verify a cached
 *       connection before reuse. It must be cheap and side-effect free on the
 *       host.</li>
 * </ul>
 *
 * <h2>Environment overrides</h2>
 * <ul>
 *   <li>{@value #ENV_HOST}</li>
 *   <li>{@value #ENV_PORT}</li>
 *   <li>{@value #ENV_TIMEOUT_SECONDS}</li>
 *   <li>{@value #ENV_CONNECT_TIMEOUT_SECONDS}</li>
 * </ul>
 */
public record HostLinkConfig(
        HostAddress address,
        Duration responseTimeout,
        Duration connectTimeout,
        int readChunkSize,
        String healthCheckCommand
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 9876;
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(180);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_READ_CHUNK_SIZE = 8192;
    public static final String DEFAULT_HEALTH_CHECK_COMMAND = "get_polyhaven_status";

    public static final String ENV_HOST = "BLENDER_HOST";
    public static final String ENV_PORT = "BLENDER_PORT";
    public static final String ENV_TIMEOUT_SECONDS = "HOSTLINK_TIMEOUT_SECONDS";
    public static final String ENV_CONNECT_TIMEOUT_SECONDS = "HOSTLINK_CONNECT_TIMEOUT_SECONDS";

    public HostLinkConfig {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(healthCheckCommand, "healthCheckCommand");

        if (responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("responseTimeout must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readChunkSize <= 0) {
            throw new IllegalArgumentException("readChunkSize must be positive");
        }
        if (healthCheckCommand.isBlank()) {
            throw new IllegalArgumentException("healthCheckCommand must not be blank");
        }
    }

    public static HostLinkConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a configuration from the process environment.
     */
    public static HostLinkConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds a configuration from the given environment map. Unset or blank
     * variables keep their defaults; malformed values are rejected.
     *
     * @throws IllegalArgumentException if a variable is set but not valid
     */
    public static HostLinkConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder();

        String host = trimmed(env.get(ENV_HOST));
        String port = trimmed(env.get(ENV_PORT));
        builder.withAddress(new HostAddress(
                host != null ? host : DEFAULT_HOST,
                port != null ? parseInt(ENV_PORT, port) : DEFAULT_PORT));

        String timeout = trimmed(env.get(ENV_TIMEOUT_SECONDS));
        if (timeout != null) {
            builder.withResponseTimeout(Duration.ofSeconds(parseInt(ENV_TIMEOUT_SECONDS, timeout)));
        }

        String connectTimeout = trimmed(env.get(ENV_CONNECT_TIMEOUT_SECONDS));
        if (connectTimeout != null) {
            builder.withConnectTimeout(Duration.ofSeconds(parseInt(ENV_CONNECT_TIMEOUT_SECONDS, connectTimeout)));
        }

        return builder.build();
    }

    private static String trimmed(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HostAddress address = new HostAddress(DEFAULT_HOST, DEFAULT_PORT);
        private Duration responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private int readChunkSize = DEFAULT_READ_CHUNK_SIZE;
        private String healthCheckCommand = DEFAULT_HEALTH_CHECK_COMMAND;

        public Builder withAddress(HostAddress address) {
            this.address = address;
            return this;
        }

        public Builder withAddress(String host, int port) {
            return withAddress(new HostAddress(host, port));
        }

        public Builder withResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withReadChunkSize(int readChunkSize) {
            this.readChunkSize = readChunkSize;
            return this;
        }

        public Builder withHealthCheckCommand(String healthCheckCommand) {
            this.healthCheckCommand = healthCheckCommand;
            return this;
        }

        public HostLinkConfig build() {
            return new HostLinkConfig(address, responseTimeout, connectTimeout, readChunkSize, healthCheckCommand);
        }
    }
}
