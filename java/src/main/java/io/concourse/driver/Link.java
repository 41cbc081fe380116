package io.concourse.driver;

/**
 * A value that points at another record. Links are stored and queried like any other value.
 */
public record Link(long record) {

    public static Link to(long record) {
        return new Link(record);
    }

    @Override
    public String toString() {
        return "@" + record;
    }
}
