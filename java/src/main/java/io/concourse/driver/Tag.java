package io.concourse.driver;

import java.util.Objects;

/**
 * A string value that the server stores without full-text indexing.
 */
public record Tag(String value) {

    public Tag {
        Objects.requireNonNull(value, "value");
    }

    public static Tag of(String value) {
        return new Tag(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
