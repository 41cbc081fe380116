package io.concourse.driver.dispatch;

import io.concourse.driver.resolve.OperationFamily;
import io.concourse.driver.resolve.ShapeTag;
import io.concourse.driver.resolve.Slot;

import java.util.List;
import java.util.Objects;

/**
 * One remote operation variant: the name the server exposes and the slots it expects, in call order.
 */
public record OperationDescriptor(String name, OperationFamily family, ShapeTag shape, List<Slot> parameters) {

    public OperationDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(shape, "shape");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (name.isBlank()) {
            throw new IllegalArgumentException("descriptor name must be non-empty");
        }
    }

    static OperationDescriptor of(String name, OperationFamily family, ShapeTag shape) {
        return new OperationDescriptor(name, family, shape, shape.slots());
    }
}
