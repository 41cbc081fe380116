package io.concourse.driver.transport;

import java.util.Objects;

/**
 * Opaque session handle issued by the server at login. Valid for the lifetime of the connection.
 */
public record Credential(String token) {

    public Credential {
        Objects.requireNonNull(token, "token");
        if (token.isBlank()) {
            throw new IllegalArgumentException("credential token must be non-empty");
        }
    }

    @Override
    public String toString() {
        return "Credential[****]";
    }
}
