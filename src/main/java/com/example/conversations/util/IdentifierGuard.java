package com.example.conversations.util;

import com.example.conversations.exception.InvalidIdentifierException;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Parses identifiers taken from request paths. Runs before any lookup so that a
 * malformed value never reaches the database.
 */
public final class IdentifierGuard {

    // UUID.fromString alone accepts non-canonical forms such as "1-2-3-4-5"
    private static final Pattern CANONICAL_UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private IdentifierGuard() {
    }

    /**
     * @param raw           identifier as received
     * @param parameterName name reported back to the client on failure
     * @return the parsed identifier
     * @throws InvalidIdentifierException if {@code raw} is not a canonical UUID string
     */
    public static UUID requireUuid(String raw, String parameterName) {
        if (raw == null || !CANONICAL_UUID.matcher(raw).matches()) {
            throw new InvalidIdentifierException(parameterName, raw);
        }
        return UUID.fromString(raw);
    }
}
