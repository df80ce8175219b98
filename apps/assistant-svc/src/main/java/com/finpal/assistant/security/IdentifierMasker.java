package com.finpal.assistant.security;

/**
 * Masks phone identifiers before they reach the logs, keeping the last four characters.
 */
public final class IdentifierMasker {

    private static final int VISIBLE_TAIL = 4;

    private IdentifierMasker() {
    }

    public static String mask(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return "<none>";
        }
        String value = identifier.trim();
        if (value.length() <= VISIBLE_TAIL) {
            return "*".repeat(value.length());
        }
        return "*".repeat(value.length() - VISIBLE_TAIL) + value.substring(value.length() - VISIBLE_TAIL);
    }
}
