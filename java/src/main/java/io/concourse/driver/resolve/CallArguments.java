package io.concourse.driver.resolve;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Immutable set of arguments supplied to one logical operation. Each parameter is either absent or holds exactly
 * one classified {@link ArgumentValue}.
 *
 * <p>
 * Typed builder methods cover the common shapes; {@link Builder#put(Parameter, Object)} and {@link #of(Map)} accept
 * dynamically typed values for callers that assemble arguments at runtime.
 * </p>
 */
public final class CallArguments {

    private static final CallArguments EMPTY = new CallArguments(new EnumMap<>(Parameter.class));

    private final Map<Parameter, ArgumentValue> values;

    private CallArguments(EnumMap<Parameter, ArgumentValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CallArguments empty() {
        return EMPTY;
    }

    /**
     * Builds arguments from a name/value map. Names may be parameter names or aliases ({@code ccl} for
     * {@code criteria}, {@code ts} for {@code timestamp}, ...). Null values are treated as absent.
     *
     * @throws IllegalArgumentException for unknown names, a parameter supplied twice via aliases, or malformed values.
     */
    public static CallArguments of(Map<String, ?> named) {
        Builder builder = builder();
        if (named == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : named.entrySet()) {
            Parameter parameter = Parameter.forName(entry.getKey());
            if (entry.getValue() == null) {
                continue;
            }
            if (builder.values.containsKey(parameter)) {
                throw new IllegalArgumentException("parameter " + parameter.paramName() + " supplied more than once");
            }
            builder.put(parameter, entry.getValue());
        }
        return builder.build();
    }

    public Optional<ArgumentValue> get(Parameter parameter) {
        return Optional.ofNullable(values.get(parameter));
    }

    public boolean has(Parameter parameter) {
        return values.containsKey(parameter);
    }

    public Set<Parameter> parameters() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CallArguments)) {
            return false;
        }
        return values.equals(((CallArguments) other).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "CallArguments" + values;
    }

    static long toMicros(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        return Math.addExact(TimeUnit.SECONDS.toMicros(instant.getEpochSecond()),
            TimeUnit.NANOSECONDS.toMicros(instant.getNano()));
    }

    public static final class Builder {
        private final EnumMap<Parameter, ArgumentValue> values = new EnumMap<>(Parameter.class);

        private Builder() {
        }

        /**
         * Sets a parameter from a dynamically typed value; {@code null} clears it.
         */
        public Builder put(Parameter parameter, Object value) {
            Objects.requireNonNull(parameter, "parameter");
            if (value == null) {
                values.remove(parameter);
            } else if (value instanceof Instant) {
                values.put(parameter, ArgumentValue.of(toMicros((Instant) value)));
            } else {
                values.put(parameter, ArgumentValue.of(value));
            }
            return this;
        }

        public Builder key(String key) {
            return put(Parameter.KEY, key);
        }

        public Builder keys(Collection<String> keys) {
            return put(Parameter.KEYS, keys == null ? null : new ArrayList<>(keys));
        }

        public Builder keys(String... keys) {
            return put(Parameter.KEYS, keys == null ? null : List.of(keys));
        }

        public Builder record(long record) {
            return put(Parameter.RECORD, record);
        }

        public Builder records(Collection<Long> records) {
            return put(Parameter.RECORDS, records == null ? null : new ArrayList<>(records));
        }

        public Builder records(long... records) {
            if (records == null) {
                return put(Parameter.RECORDS, null);
            }
            List<Long> boxed = new ArrayList<>(records.length);
            for (long record : records) {
                boxed.add(record);
            }
            return put(Parameter.RECORDS, boxed);
        }

        public Builder criteria(String criteria) {
            return put(Parameter.CRITERIA, criteria);
        }

        public Builder timestamp(long micros) {
            return put(Parameter.TIMESTAMP, micros);
        }

        public Builder timestamp(String phrase) {
            return put(Parameter.TIMESTAMP, phrase);
        }

        public Builder timestamp(Instant instant) {
            return put(Parameter.TIMESTAMP, instant);
        }

        public Builder start(long micros) {
            return put(Parameter.START, micros);
        }

        public Builder start(String phrase) {
            return put(Parameter.START, phrase);
        }

        public Builder start(Instant instant) {
            return put(Parameter.START, instant);
        }

        public Builder end(long micros) {
            return put(Parameter.END, micros);
        }

        public Builder end(String phrase) {
            return put(Parameter.END, phrase);
        }

        public Builder end(Instant instant) {
            return put(Parameter.END, instant);
        }

        public Builder value(Object value) {
            return put(Parameter.VALUE, value);
        }

        public Builder phrase(String phrase) {
            return put(Parameter.PHRASE, phrase);
        }

        public CallArguments build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new CallArguments(new EnumMap<>(values));
        }
    }
}
