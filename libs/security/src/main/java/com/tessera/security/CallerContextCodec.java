package com.tessera.security;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Base64;

/**
 * Encodes and decodes an {@link AuthenticatedCaller} for transport in a single request header.
 * <p>
 * WHY JSON + Base64: the upstream gateway that verifies credentials forwards the caller's
 * identity and claim bundle as one header value. JSON keeps the claim list structured and
 * Base64 keeps the value header-safe.
 */
public final class CallerContextCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CallerContextCodec() {
        // utility class
    }

    /**
     * Encodes a caller to a Base64-encoded JSON string.
     *
     * @throws CallerContextFormatException if serialization fails
     */
    public static String encode(AuthenticatedCaller caller) {
        try {
            return Base64.getEncoder().encodeToString(MAPPER.writeValueAsBytes(caller));
        } catch (Exception e) {
            throw new CallerContextFormatException("Failed to encode caller context", e);
        }
    }

    /**
     * Decodes a Base64-encoded JSON string back to a caller.
     *
     * @throws CallerContextFormatException if the value is not Base64 or not a caller document
     */
    public static AuthenticatedCaller decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new CallerContextFormatException("Caller context is empty", null);
        }
        try {
            byte[] json = Base64.getDecoder().decode(encoded.trim());
            return MAPPER.readValue(json, AuthenticatedCaller.class);
        } catch (Exception e) {
            throw new CallerContextFormatException("Failed to decode caller context", e);
        }
    }

    /**
     * Thrown when a caller context cannot be encoded or decoded.
     */
    public static class CallerContextFormatException extends RuntimeException {
        public CallerContextFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
