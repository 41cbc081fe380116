package io.concourse.driver.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.concourse.driver.AuthenticationException;
import io.concourse.driver.ConcourseApiException;
import io.concourse.driver.TransactionConflictException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding error payloads from Concourse Server into the driver's exception types.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static ConcourseApiException decode(int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return classify(statusCode, null, null);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return classify(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            String code = node.hasNonNull("code") ? node.get("code").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : null;
            return classify(statusCode, code, message);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            return classify(statusCode, null, fallback);
        }
    }

    static ConcourseApiException classify(int statusCode, String code, String message) {
        if (TransactionConflictException.CODE.equals(code) || (code == null && statusCode == 409)) {
            return new TransactionConflictException(statusCode, message);
        }
        if (AuthenticationException.CODE.equals(code) || (code == null && statusCode == 401)) {
            return new AuthenticationException(statusCode, message);
        }
        return new ConcourseApiException(statusCode, code, message);
    }
}
