package io.concourse.driver.resolve;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output of {@link ArgumentResolver}: the shape a call resolved to plus its normalized values keyed by slot.
 */
public record ResolvedCall(OperationFamily family, ShapeTag shape, Map<Slot, Object> values) {

    public ResolvedCall {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(shape, "shape");
        values = values == null || values.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public Object value(Slot slot) {
        return values.get(slot);
    }
}
