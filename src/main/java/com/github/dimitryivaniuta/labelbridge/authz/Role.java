package com.github.dimitryivaniuta.labelbridge.authz;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Organization roles, ordered by rank. Comparison is always by {@link #rank()}, never by name
 * or ordinal.
 */
public enum Role {
    VIEWER(1),
    ANNOTATOR(2),
    MANAGER(3),
    OWNER(4);

    private final int rank;

    Role(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean atLeast(Role required) {
        return rank >= required.rank;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
