package com.tessera.security;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Parsing rules for the external tenant identifier used in routes and claims.
 *
 * <p>The identifier is a UUID in its canonical 8-4-4-4-12 hex form. {@link UUID#fromString}
 * alone is too lenient (it accepts "1-2-3-4-5"), so the shape is checked first.
 */
public final class TenantIdentifiers {

    private static final Pattern CANONICAL =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private TenantIdentifiers() {
        // utility class
    }

    /**
     * Parses a tenant identifier.
     *
     * @param value the raw text, e.g. from a path segment
     * @return the identifier, or empty if the text is null or not a canonical UUID
     */
    public static Optional<UUID> parse(String value) {
        if (value == null || !CANONICAL.matcher(value).matches()) {
            return Optional.empty();
        }
        return Optional.of(UUID.fromString(value.toLowerCase(Locale.ROOT)));
    }

    /** Formats an identifier the way it appears on the wire (lower-case canonical form). */
    public static String format(UUID identifier) {
        return identifier.toString();
    }
}
