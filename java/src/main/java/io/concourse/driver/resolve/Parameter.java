package io.concourse.driver.resolve;

import java.util.List;
import java.util.Locale;

/**
 * Named argument accepted by the logical operations of {@link io.concourse.driver.ConcourseClient}.
 */
public enum Parameter {
    KEY("key"),
    KEYS("keys"),
    RECORD("record"),
    RECORDS("records"),
    CRITERIA("criteria", "ccl", "where", "query"),
    TIMESTAMP("timestamp", "time", "ts"),
    START("start"),
    END("end"),
    VALUE("value"),
    PHRASE("phrase");

    private final String paramName;
    private final List<String> aliases;

    Parameter(String paramName, String... aliases) {
        this.paramName = paramName;
        this.aliases = List.of(aliases);
    }

    public String paramName() {
        return paramName;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Looks up a parameter by its name or one of its aliases, ignoring case.
     *
     * @throws IllegalArgumentException when no parameter answers to {@code name}.
     */
    public static Parameter forName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("parameter name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Parameter candidate : values()) {
            if (candidate.paramName.equals(normalized) || candidate.aliases.contains(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("unknown parameter " + name);
    }
}
