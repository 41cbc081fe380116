package io.concourse.driver;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link ConcourseClient} instances.
 */
public final class Config {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 1717;
    public static final String DEFAULT_USERNAME = "admin";
    public static final String DEFAULT_PASSWORD = "admin";
    public static final String DEFAULT_ENVIRONMENT = "";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final String host;
    private final Integer port;
    private final String baseUrl;
    private final String username;
    private final String password;
    private final String environment;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Boolean logoutOnClose;

    private Config(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.baseUrl = builder.baseUrl;
        this.username = builder.username;
        this.password = builder.password;
        this.environment = builder.environment;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.logoutOnClose = builder.logoutOnClose;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedHost = Optional.ofNullable(host).map(String::trim).filter(s -> !s.isEmpty()).orElse(DEFAULT_HOST);
        int resolvedPort = Optional.ofNullable(port).orElse(DEFAULT_PORT);
        if (resolvedPort <= 0 || resolvedPort > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }

        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl)
            .orElse("http://" + resolvedHost + ":" + resolvedPort));

        String resolvedUsername = Optional.ofNullable(username).orElse(DEFAULT_USERNAME);
        if (resolvedUsername.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        String resolvedPassword = Optional.ofNullable(password).orElse(DEFAULT_PASSWORD);
        String resolvedEnvironment = Optional.ofNullable(environment).map(String::trim).orElse(DEFAULT_ENVIRONMENT);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        return new Builder()
            .host(resolvedHost)
            .port(resolvedPort)
            .baseUrl(resolvedBaseUrl)
            .username(resolvedUsername)
            .password(resolvedPassword)
            .environment(resolvedEnvironment)
            .httpClient(httpClient)
            .httpTimeout(resolvedTimeout)
            .logoutOnClose(logoutOnClose == null || logoutOnClose)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getEnvironment() {
        return environment;
    }

    /**
     * @return the caller-supplied client, or {@code null} when the driver should create and own one.
     */
    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public boolean isLogoutOnClose() {
        return logoutOnClose;
    }

    @Override
    public String toString() {
        return "Config{baseUrl=" + baseUrl + ", username=" + username + ", environment=" + environment + "}";
    }

    public static final class Builder {
        private String host;
        private Integer port;
        private String baseUrl;
        private String username;
        private String password;
        private String environment;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Boolean logoutOnClose;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * Overrides the endpoint derived from host and port.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder logoutOnClose(boolean logoutOnClose) {
            this.logoutOnClose = logoutOnClose;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
