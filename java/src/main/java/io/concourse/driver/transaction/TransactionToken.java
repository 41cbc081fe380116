package io.concourse.driver.transaction;

import java.util.Objects;

/**
 * Opaque handle the server issues when staging begins.
 */
public record TransactionToken(String value) {

    public TransactionToken {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("transaction token must be non-empty");
        }
    }
}
