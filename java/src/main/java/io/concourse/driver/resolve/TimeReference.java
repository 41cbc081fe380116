package io.concourse.driver.resolve;

import java.util.Objects;
import java.util.Optional;

/**
 * A point in time as supplied by a caller: either an absolute instant in microseconds since the epoch or a
 * natural-language phrase that the server resolves.
 */
public interface TimeReference {

    boolean isAbsolute();

    static TimeReference absolute(long micros) {
        return new Absolute(micros);
    }

    static TimeReference phrase(String text) {
        return new Phrase(text);
    }

    /**
     * Numbers are absolute instants (decimals truncate), text is a phrase; every other shape has no time meaning.
     */
    static Optional<TimeReference> from(ArgumentValue value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isNumeric()) {
            return Optional.of(absolute(value.asLong()));
        }
        if (value.shape() == ArgumentValue.Shape.TEXT) {
            return Optional.of(phrase(value.asText()));
        }
        return Optional.empty();
    }

    record Absolute(long micros) implements TimeReference {
        @Override
        public boolean isAbsolute() {
            return true;
        }
    }

    record Phrase(String text) implements TimeReference {
        public Phrase {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public boolean isAbsolute() {
            return false;
        }
    }
}
