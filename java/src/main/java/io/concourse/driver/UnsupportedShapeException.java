package io.concourse.driver;

/**
 * Signals that the argument resolver produced a shape the dispatch table has no entry for. This is a driver bug,
 * not a caller error, so it is unchecked.
 */
public final class UnsupportedShapeException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public UnsupportedShapeException(String family, String shape) {
        super("no remote variant registered for " + family + " with shape " + shape);
    }
}
