package com.debstats.statistics.model;

import java.util.Locale;

/**
 * How many packages to report: either every package, or the top {@code n}.
 * Resolved once from user input; the selector never re-interprets it.
 */
public interface Selection {

    String ALL_TOKEN = "all";

    static Selection all() {
        return All.INSTANCE;
    }

    static Selection top(int limit) {
        return new Top(limit);
    }

    /**
     * Parses a command-line token. {@code all} and {@code 0} select every
     * package, a positive integer selects that many.
     *
     * @throws InvalidSelectionException for negative or non-numeric tokens
     */
    static Selection parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidSelectionException("Missing package count");
        }
        String trimmed = token.trim();
        if (ALL_TOKEN.equals(trimmed.toLowerCase(Locale.ROOT))) {
            return all();
        }
        int value;
        try {
            value = Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new InvalidSelectionException("Invalid package count: " + token, e);
        }
        if (value < 0) {
            throw new InvalidSelectionException("Package count must not be negative: " + token);
        }
        return value == 0 ? all() : top(value);
    }

    /**
     * Number of entries to emit out of {@code available}.
     */
    int limit(int available);

    enum All implements Selection {
        INSTANCE;

        @Override
        public int limit(int available) {
            return available;
        }

        @Override
        public String toString() {
            return ALL_TOKEN;
        }
    }

    record Top(int count) implements Selection {

        public Top {
            if (count <= 0) {
                throw new InvalidSelectionException("Package count must be positive: " + count);
            }
        }

        @Override
        public int limit(int available) {
            return Math.min(count, available);
        }
    }
}
