package io.concourse.driver.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts between native Java values and their wire representation.
 */
public interface ValueCodec {

    JsonNode encode(Object value);

    Object decode(JsonNode wire);
}
