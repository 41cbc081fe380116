package io.concourse.driver.transport;

import io.concourse.driver.ConcourseException;

/**
 * Resolves a natural-language time phrase such as {@code "last month"} to microseconds since the epoch.
 */
public interface TimestampResolver {

    long resolvePhrase(String phrase) throws ConcourseException;
}
